package io.github.wphillipmoore.mturk.requester.exception;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a response matched neither the success envelope nor a known error envelope.
 *
 * <p>Also covers bodies that could not be decoded at all. The {@code statusCode} and {@code
 * responseText} may be {@code null} if they were not available.
 */
public final class MturkUnclassifiedException extends MturkException {

  private static final long serialVersionUID = 1L;

  private final @Nullable Integer statusCode;
  private final @Nullable String responseText;

  /**
   * Creates an unclassified exception.
   *
   * @param message description of the failure
   * @param statusCode the HTTP status code, or {@code null} if unavailable
   * @param responseText the raw response text, or {@code null} if unavailable
   */
  public MturkUnclassifiedException(
      String message, @Nullable Integer statusCode, @Nullable String responseText) {
    super(message);
    this.statusCode = statusCode;
    this.responseText = responseText;
  }

  /**
   * Creates an unclassified exception with a cause.
   *
   * @param message description of the failure
   * @param statusCode the HTTP status code, or {@code null} if unavailable
   * @param responseText the raw response text, or {@code null} if unavailable
   * @param cause the underlying cause
   */
  public MturkUnclassifiedException(
      String message,
      @Nullable Integer statusCode,
      @Nullable String responseText,
      Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
    this.responseText = responseText;
  }

  /** Returns the HTTP status code, or {@code null} if the status code was not available. */
  public @Nullable Integer getStatusCode() {
    return statusCode;
  }

  /** Returns the raw response text, or {@code null} if the response body was not available. */
  public @Nullable String getResponseText() {
    return responseText;
  }
}
