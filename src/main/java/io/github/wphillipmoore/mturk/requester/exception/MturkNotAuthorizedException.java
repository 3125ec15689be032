package io.github.wphillipmoore.mturk.requester.exception;

import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when the service rejected the request credentials.
 *
 * <p>Detected from the {@code OperationRequest} node, independent of the result element the
 * operation expected.
 */
public final class MturkNotAuthorizedException extends MturkServiceException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a not-authorized exception.
   *
   * @param message description of the failure
   * @param errors the raw {@code Errors} node of the {@code OperationRequest} element
   * @param statusCode the HTTP status code, or {@code null} if unavailable
   */
  public MturkNotAuthorizedException(
      String message, Map<String, Object> errors, @Nullable Integer statusCode) {
    super(message, errors, statusCode);
  }
}
