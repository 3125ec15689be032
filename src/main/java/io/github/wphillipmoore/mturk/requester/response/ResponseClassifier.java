package io.github.wphillipmoore.mturk.requester.response;

import io.github.wphillipmoore.mturk.requester.exception.MturkNotAuthorizedException;
import io.github.wphillipmoore.mturk.requester.exception.MturkRequestException;
import io.github.wphillipmoore.mturk.requester.exception.MturkUnclassifiedException;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Decides whether a decoded response is a success and, if not, which failure it reports.
 *
 * <p>A response succeeds when the HTTP status is 200 and {@code <resultKey>/Request/IsValid} is
 * {@code True}. Otherwise, in order:
 *
 * <ol>
 *   <li>an {@code OperationRequest/Errors/Error/Code} of {@value #NOT_AUTHORIZED_CODE} raises
 *       {@link MturkNotAuthorizedException}, whatever result element was expected;
 *   <li>a {@code <resultKey>/Request/Errors/Error} node raises {@link MturkRequestException};
 *   <li>anything else raises {@link MturkUnclassifiedException}.
 * </ol>
 *
 * <p>Where the tree holds a list (repeated elements), the result element is taken from its first
 * entry, and the authorization check matches any of the listed errors.
 */
public final class ResponseClassifier {

  /** Error code the service reports when it rejects the request credentials. */
  public static final String NOT_AUTHORIZED_CODE = "AWS.NotAuthorized";

  static final String VALID = "True";

  private ResponseClassifier() {}

  /**
   * Classifies a decoded response.
   *
   * @param statusCode the HTTP status code
   * @param tree the decoded response tree
   * @param resultKey the element expected to hold the operation's result
   * @return the tree itself, when the response is a success
   * @throws MturkNotAuthorizedException if the credentials were rejected
   * @throws MturkRequestException if the service rejected the request
   * @throws MturkUnclassifiedException if the response fits no known pattern
   */
  public static Map<String, Object> classify(
      int statusCode, Map<String, Object> tree, String resultKey) {
    if (isSuccess(statusCode, tree, resultKey)) {
      return tree;
    }

    Map<String, Object> operationErrors = asMap(path(tree, "OperationRequest", "Errors"));
    if (operationErrors != null && hasNotAuthorizedCode(operationErrors.get("Error"))) {
      throw new MturkNotAuthorizedException(
          "AWS credentials rejected.", operationErrors, statusCode);
    }

    Map<String, Object> requestErrors = asMap(path(tree, resultKey, "Request", "Errors"));
    if (requestErrors != null && requestErrors.get("Error") != null) {
      throw new MturkRequestException(
          "Request returned error. See errors for context.", requestErrors, statusCode);
    }

    throw new MturkUnclassifiedException(
        "Request returned error. No context available.", statusCode, null);
  }

  /**
   * Returns whether a decoded response is a success.
   *
   * @param statusCode the HTTP status code
   * @param tree the decoded response tree
   * @param resultKey the element expected to hold the operation's result
   * @return {@code true} for status 200 with a valid request marker
   */
  public static boolean isSuccess(int statusCode, Map<String, Object> tree, String resultKey) {
    return statusCode == 200 && VALID.equals(path(tree, resultKey, "Request", "IsValid"));
  }

  private static boolean hasNotAuthorizedCode(@Nullable Object error) {
    if (error instanceof List<?> errors) {
      for (Object item : errors) {
        if (hasNotAuthorizedCode(item)) {
          return true;
        }
      }
      return false;
    }
    Map<String, Object> errorMap = asMap(error);
    return errorMap != null && NOT_AUTHORIZED_CODE.equals(errorMap.get("Code"));
  }

  static @Nullable Object path(Map<String, Object> tree, String... keys) {
    Object current = tree;
    for (String key : keys) {
      Map<String, Object> node = asMap(current);
      if (node == null) {
        return null;
      }
      current = node.get(key);
    }
    return current;
  }

  @SuppressWarnings("unchecked")
  private static @Nullable Map<String, Object> asMap(@Nullable Object node) {
    if (node instanceof List<?> list && !list.isEmpty()) {
      node = list.get(0);
    }
    return node instanceof Map ? (Map<String, Object>) node : null;
  }
}
