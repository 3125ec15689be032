package io.github.wphillipmoore.mturk.requester.request;

import io.github.wphillipmoore.mturk.requester.auth.AwsCredentials;
import io.github.wphillipmoore.mturk.requester.exception.MturkMissingParameterException;
import io.github.wphillipmoore.mturk.requester.signing.RequestSigner;
import java.util.Objects;

/**
 * Assembles signed request URLs.
 *
 * <p>The query string is laid out as: the common fields ({@code Service}, {@code
 * AWSAccessKeyId}, {@code Version}, {@code Operation}, {@code Signature}, {@code Timestamp}), then
 * the operation's required keys, its optional keys that are present, and finally its structured
 * fields, each group in declaration order. All validation happens before the request is signed.
 */
public final class RequestBuilder {

  /** Service identifier sent with, and signed into, every request. */
  public static final String SERVICE = "AWSMechanicalTurkRequester";

  /** API version sent with every request. */
  public static final String API_VERSION = "2014-08-15";

  private final AwsCredentials credentials;
  private final RequestSigner signer;

  /**
   * Creates a request builder.
   *
   * @param credentials the credentials identifying the caller
   * @param signer the signer holding the same credentials' secret key
   */
  public RequestBuilder(AwsCredentials credentials, RequestSigner signer) {
    this.credentials = Objects.requireNonNull(credentials, "credentials");
    this.signer = Objects.requireNonNull(signer, "signer");
  }

  /**
   * Builds a signed request.
   *
   * @param baseUrl the endpoint the query string is appended to
   * @param operation the operation being requested
   * @param params the caller's parameters
   * @param defaults the mode's default parameters, overridden by {@code params}
   * @return the signed request
   * @throws MturkMissingParameterException if a required key or structured field is absent
   * @throws IllegalArgumentException if a required or optional key holds a structured value
   */
  public SignedRequest build(
      String baseUrl, OperationSpec operation, ParameterBag params, ParameterBag defaults) {
    Objects.requireNonNull(baseUrl, "baseUrl");
    Objects.requireNonNull(operation, "operation");
    ParameterBag effective =
        Objects.requireNonNull(defaults, "defaults")
            .overriddenBy(Objects.requireNonNull(params, "params"));

    StringBuilder parameters = new StringBuilder();
    for (String key : operation.requiredKeys()) {
      Object value = effective.get(key);
      if (value == null) {
        throw new MturkMissingParameterException(key);
      }
      QueryEncoding.appendParameter(parameters, key, value);
    }
    for (String key : operation.optionalKeys()) {
      Object value = effective.get(key);
      if (value != null) {
        QueryEncoding.appendParameter(parameters, key, value);
      }
    }
    for (StructuredField field : operation.structuredFields()) {
      parameters.append(field.encode(effective));
    }

    String timestamp = signer.timestamp();
    String signature = signer.sign(SERVICE, operation.name(), timestamp);

    StringBuilder url = new StringBuilder(baseUrl.length() + 256 + parameters.length());
    url.append(baseUrl)
        .append("?Service=")
        .append(SERVICE)
        .append("&AWSAccessKeyId=")
        .append(QueryEncoding.encode(credentials.accessKeyId()))
        .append("&Version=")
        .append(API_VERSION)
        .append("&Operation=")
        .append(operation.name())
        .append("&Signature=")
        .append(QueryEncoding.encode(signature))
        .append("&Timestamp=")
        .append(QueryEncoding.encode(timestamp))
        .append(parameters);
    return new SignedRequest(operation.name(), timestamp, signature, url.toString());
  }
}
