package io.github.wphillipmoore.mturk.requester.exception;

import java.util.Objects;

/**
 * Thrown when a network or connection failure occurs communicating with the service.
 *
 * <p>The recorded URL is the endpoint without its query string, so the exception never carries the
 * access key or the request signature.
 */
public final class MturkTransportException extends MturkException {

  private static final long serialVersionUID = 1L;

  private final String url;

  /**
   * Creates a transport exception.
   *
   * @param message description of the failure
   * @param url the URL that was being accessed
   */
  public MturkTransportException(String message, String url) {
    super(message);
    this.url = stripQuery(Objects.requireNonNull(url, "url"));
  }

  /**
   * Creates a transport exception with a cause.
   *
   * @param message description of the failure
   * @param url the URL that was being accessed
   * @param cause the underlying cause
   */
  public MturkTransportException(String message, String url, Throwable cause) {
    super(message, cause);
    this.url = stripQuery(Objects.requireNonNull(url, "url"));
  }

  /** Returns the endpoint that was being accessed, without query string. */
  public String getUrl() {
    return url;
  }

  private static String stripQuery(String url) {
    int queryStart = url.indexOf('?');
    return queryStart >= 0 ? url.substring(0, queryStart) : url;
  }
}
