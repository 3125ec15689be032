package io.github.wphillipmoore.mturk.requester;

import java.util.Objects;

/**
 * Immutable result of a transport GET: the HTTP status and the raw XML body.
 *
 * @param statusCode the HTTP status code
 * @param body the response body text, never null (empty string if no body)
 */
public record TransportResponse(int statusCode, String body) {

  /** Validates that the body is non-null. */
  public TransportResponse {
    Objects.requireNonNull(body, "body");
  }
}
