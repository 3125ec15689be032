package io.github.wphillipmoore.mturk.requester.exception;

import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when the service refused a request as invalid (malformed request, business-rule
 * violation such as an insufficient balance).
 */
public final class MturkRequestException extends MturkServiceException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a request exception.
   *
   * @param message description of the failure
   * @param errors the raw {@code Errors} node of the result element's {@code Request}
   * @param statusCode the HTTP status code, or {@code null} if unavailable
   */
  public MturkRequestException(
      String message, Map<String, Object> errors, @Nullable Integer statusCode) {
    super(message, errors, statusCode);
  }
}
