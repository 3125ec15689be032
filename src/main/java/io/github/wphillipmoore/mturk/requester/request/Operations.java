package io.github.wphillipmoore.mturk.requester.request;

import static io.github.wphillipmoore.mturk.requester.request.StructuredField.HIT_LAYOUT_PARAMETER;
import static io.github.wphillipmoore.mturk.requester.request.StructuredField.KEYWORDS;
import static io.github.wphillipmoore.mturk.requester.request.StructuredField.NOTIFICATION;
import static io.github.wphillipmoore.mturk.requester.request.StructuredField.QUALIFICATION_REQUIREMENT;
import static io.github.wphillipmoore.mturk.requester.request.StructuredField.REWARD;

import java.util.List;

/**
 * The requester operations supported by {@link
 * io.github.wphillipmoore.mturk.requester.MturkSession}.
 *
 * @see <a href="https://docs.aws.amazon.com/AWSMechTurk/latest/AWSMturkAPI/">API reference</a>
 */
public final class Operations {

  private static final List<String> PAGING =
      List.of("SortProperty", "SortDirection", "PageSize", "PageNumber");

  // HITs

  /** CreateHIT from an existing HIT type and layout. */
  public static final OperationSpec CREATE_HIT_BY_TYPE_ID_AND_LAYOUT_ID =
      new OperationSpec(
          "CreateHIT",
          List.of("HITTypeId", "HITLayoutId", "LifetimeInSeconds", "MaxAssignments"),
          List.of("RequesterAnnotation", "UniqueRequestToken"),
          List.of(HIT_LAYOUT_PARAMETER),
          "HIT");

  /** CreateHIT from an existing layout, declaring the HIT type properties inline. */
  public static final OperationSpec CREATE_HIT_BY_LAYOUT_ID =
      new OperationSpec(
          "CreateHIT",
          List.of(
              "Title",
              "Description",
              "HITLayoutId",
              "AssignmentDurationInSeconds",
              "LifetimeInSeconds",
              "MaxAssignments",
              "AutoApprovalDelayInSeconds"),
          List.of("RequesterAnnotation", "UniqueRequestToken"),
          List.of(REWARD, HIT_LAYOUT_PARAMETER, KEYWORDS, QUALIFICATION_REQUIREMENT),
          "HIT");

  public static final OperationSpec REGISTER_HIT_TYPE =
      new OperationSpec(
          "RegisterHITType",
          List.of(
              "Title", "Description", "AssignmentDurationInSeconds", "AutoApprovalDelayInSeconds"),
          List.of(),
          List.of(REWARD, KEYWORDS, QUALIFICATION_REQUIREMENT),
          "RegisterHITTypeResult");

  public static final OperationSpec SET_HIT_TYPE_NOTIFICATION =
      new OperationSpec(
          "SetHITTypeNotification",
          List.of("HITTypeId"),
          List.of("Active"),
          List.of(NOTIFICATION),
          "SetHITTypeNotificationResult");

  public static final OperationSpec CHANGE_HIT_TYPE_OF_HIT =
      OperationSpec.of("ChangeHITTypeOfHIT", List.of("HITId", "HITTypeId"), List.of());

  public static final OperationSpec GET_HIT =
      new OperationSpec("GetHIT", List.of("HITId"), List.of(), "HIT");

  public static final OperationSpec SEARCH_HITS = OperationSpec.of("SearchHITs", List.of(), PAGING);

  public static final OperationSpec GET_REVIEWABLE_HITS =
      OperationSpec.of(
          "GetReviewableHITs",
          List.of(),
          List.of(
              "HITTypeId", "Status", "SortProperty", "SortDirection", "PageSize", "PageNumber"));

  public static final OperationSpec SET_HIT_AS_REVIEWING =
      OperationSpec.of("SetHITAsReviewing", List.of("HITId"), List.of("Revert"));

  public static final OperationSpec EXTEND_HIT =
      OperationSpec.of(
          "ExtendHIT",
          List.of("HITId"),
          List.of("MaxAssignmentsIncrement", "ExpirationIncrementInSeconds", "UniqueRequestToken"));

  public static final OperationSpec FORCE_EXPIRE_HIT =
      OperationSpec.of("ForceExpireHIT", List.of("HITId"), List.of());

  /** Removes a HIT that is not yet reviewable. */
  public static final OperationSpec DISABLE_HIT =
      OperationSpec.of("DisableHIT", List.of("HITId"), List.of());

  /** Removes a HIT in the reviewable state. */
  public static final OperationSpec DISPOSE_HIT =
      OperationSpec.of("DisposeHIT", List.of("HITId"), List.of());

  // Assignments

  public static final OperationSpec GET_ASSIGNMENTS_FOR_HIT =
      OperationSpec.of(
          "GetAssignmentsForHIT",
          List.of("HITId"),
          List.of("AssignmentStatus", "SortProperty", "SortDirection", "PageSize", "PageNumber"));

  public static final OperationSpec GET_ASSIGNMENT =
      OperationSpec.of("GetAssignment", List.of("AssignmentId"), List.of());

  public static final OperationSpec APPROVE_ASSIGNMENT =
      OperationSpec.of("ApproveAssignment", List.of("AssignmentId"), List.of("RequesterFeedback"));

  public static final OperationSpec REJECT_ASSIGNMENT =
      OperationSpec.of("RejectAssignment", List.of("AssignmentId"), List.of("RequesterFeedback"));

  public static final OperationSpec APPROVE_REJECTED_ASSIGNMENT =
      OperationSpec.of(
          "ApproveRejectedAssignment", List.of("AssignmentId"), List.of("RequesterFeedback"));

  public static final OperationSpec GET_FILE_UPLOAD_URL =
      OperationSpec.of(
          "GetFileUploadURL", List.of("AssignmentId", "QuestionIdentifier"), List.of());

  // Notifications

  public static final OperationSpec SEND_TEST_EVENT_NOTIFICATION =
      new OperationSpec(
          "SendTestEventNotification",
          List.of("TestEventType"),
          List.of(),
          List.of(NOTIFICATION),
          "SendTestEventNotificationResult");

  public static final OperationSpec NOTIFY_WORKERS =
      OperationSpec.of("NotifyWorkers", List.of("Subject", "MessageText", "WorkerId"), List.of());

  // Payments and statistics

  public static final OperationSpec GRANT_BONUS =
      OperationSpec.of(
          "GrantBonus",
          List.of("WorkerId", "AssignmentId", "BonusAmount", "Reason"),
          List.of("UniqueRequestToken"));

  public static final OperationSpec GET_BONUS_PAYMENTS =
      OperationSpec.of(
          "GetBonusPayments",
          List.of(),
          List.of("HITId", "AssignmentId", "PageSize", "PageNumber"));

  public static final OperationSpec GET_ACCOUNT_BALANCE =
      OperationSpec.of("GetAccountBalance", List.of(), List.of());

  public static final OperationSpec GET_REQUESTER_STATISTIC =
      new OperationSpec(
          "GetRequesterStatistic",
          List.of("Statistic", "TimePeriod"),
          List.of("Count"),
          "GetStatisticResult");

  public static final OperationSpec GET_REQUESTER_WORKER_STATISTIC =
      new OperationSpec(
          "GetRequesterWorkerStatistic",
          List.of("Statistic", "WorkerId", "TimePeriod"),
          List.of("Count"),
          "GetStatisticResult");

  // Workers

  /**
   * Blocks a worker from the requester's HITs.
   *
   * <p>Earlier clients of this API sent {@code Operation=UnblockWorker} for the block call too.
   * This constant sends and signs {@code BlockWorker} and reads {@code BlockWorkerResult}.
   */
  public static final OperationSpec BLOCK_WORKER =
      OperationSpec.of("BlockWorker", List.of("WorkerId", "Reason"), List.of());

  public static final OperationSpec UNBLOCK_WORKER =
      OperationSpec.of("UnblockWorker", List.of("WorkerId"), List.of("Reason"));

  public static final OperationSpec GET_BLOCKED_WORKERS =
      OperationSpec.of("GetBlockedWorkers", List.of(), List.of("PageNumber", "PageSize"));

  /** Every operation above, in declaration order. */
  public static final List<OperationSpec> ALL =
      List.of(
          CREATE_HIT_BY_TYPE_ID_AND_LAYOUT_ID,
          CREATE_HIT_BY_LAYOUT_ID,
          REGISTER_HIT_TYPE,
          SET_HIT_TYPE_NOTIFICATION,
          CHANGE_HIT_TYPE_OF_HIT,
          GET_HIT,
          SEARCH_HITS,
          GET_REVIEWABLE_HITS,
          SET_HIT_AS_REVIEWING,
          EXTEND_HIT,
          FORCE_EXPIRE_HIT,
          DISABLE_HIT,
          DISPOSE_HIT,
          GET_ASSIGNMENTS_FOR_HIT,
          GET_ASSIGNMENT,
          APPROVE_ASSIGNMENT,
          REJECT_ASSIGNMENT,
          APPROVE_REJECTED_ASSIGNMENT,
          GET_FILE_UPLOAD_URL,
          SEND_TEST_EVENT_NOTIFICATION,
          NOTIFY_WORKERS,
          GRANT_BONUS,
          GET_BONUS_PAYMENTS,
          GET_ACCOUNT_BALANCE,
          GET_REQUESTER_STATISTIC,
          GET_REQUESTER_WORKER_STATISTIC,
          BLOCK_WORKER,
          UNBLOCK_WORKER,
          GET_BLOCKED_WORKERS);

  private Operations() {}
}
