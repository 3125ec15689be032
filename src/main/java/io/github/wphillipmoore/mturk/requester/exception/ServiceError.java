package io.github.wphillipmoore.mturk.requester.exception;

import java.util.Objects;

/**
 * A single {@code {Code, Message}} error record reported by the service.
 *
 * @param code the error code (e.g. {@code AWS.NotAuthorized}), empty if absent
 * @param message the human-readable message, empty if absent
 */
public record ServiceError(String code, String message) {

  /** Validates that code and message are non-null. */
  public ServiceError {
    Objects.requireNonNull(code, "code");
    Objects.requireNonNull(message, "message");
  }
}
