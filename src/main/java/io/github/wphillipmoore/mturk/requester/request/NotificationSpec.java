package io.github.wphillipmoore.mturk.requester.request;

import java.util.List;
import java.util.Objects;

/**
 * Where and how the service delivers event notifications.
 *
 * @param destination the e-mail address, SQS queue URL or SNS topic ARN, never null
 * @param transport {@code Email}, {@code SQS} or {@code SNS}, never null
 * @param version the notification message format version, never null
 * @param eventTypes the events to notify about, never null or empty
 * @see <a
 *     href="https://docs.aws.amazon.com/AWSMechTurk/latest/AWSMturkAPI/ApiReference_NotificationDataStructureArticle.html">Notification</a>
 */
public record NotificationSpec(
    String destination, String transport, String version, List<String> eventTypes) {

  /** Validates required fields and copies the event type list. */
  public NotificationSpec {
    Objects.requireNonNull(destination, "destination");
    Objects.requireNonNull(transport, "transport");
    Objects.requireNonNull(version, "version");
    eventTypes = List.copyOf(Objects.requireNonNull(eventTypes, "eventTypes"));
    if (eventTypes.isEmpty()) {
      throw new IllegalArgumentException("eventTypes must not be empty");
    }
  }

  /** Creates a notification for a single event type. */
  public NotificationSpec(String destination, String transport, String version, String eventType) {
    this(destination, transport, version, List.of(eventType));
  }
}
