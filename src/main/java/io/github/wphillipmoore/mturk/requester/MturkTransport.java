package io.github.wphillipmoore.mturk.requester;

import java.time.Duration;
import org.jspecify.annotations.Nullable;

/**
 * Transport interface for the Mechanical Turk query API.
 *
 * <p>Every operation is a single GET with all parameters, the signature included, in the query
 * string. Implementations perform the HTTP exchange and should throw {@link
 * io.github.wphillipmoore.mturk.requester.exception.MturkTransportException} for network or
 * connection failures. Non-2xx statuses are not failures at this level; they are returned so the
 * error envelope in the body can be classified.
 */
public interface MturkTransport {

  /**
   * Sends a GET request.
   *
   * @param url fully-qualified URL, query string included
   * @param timeout request timeout, or {@code null} for no timeout
   * @return the transport response
   */
  TransportResponse get(String url, @Nullable Duration timeout);
}
