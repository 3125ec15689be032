package io.github.wphillipmoore.mturk.requester.request;

import java.util.Objects;

/**
 * A fully assembled, signed request URL.
 *
 * <p>{@link #toString()} omits the URL, which carries the access key and signature.
 *
 * @param operation the wire operation name
 * @param timestamp the timestamp the signature covers
 * @param signature the Base64 request signature
 * @param url the endpoint followed by the complete query string
 */
public record SignedRequest(String operation, String timestamp, String signature, String url) {

  /** Validates that all fields are non-null. */
  public SignedRequest {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(signature, "signature");
    Objects.requireNonNull(url, "url");
  }

  /** Returns the query string, without the leading {@code ?}. */
  public String query() {
    int queryStart = url.indexOf('?');
    return queryStart >= 0 ? url.substring(queryStart + 1) : "";
  }

  @Override
  public String toString() {
    return "SignedRequest[operation=" + operation + ", timestamp=" + timestamp + "]";
  }
}
