package io.github.wphillipmoore.mturk.requester.config;

import io.github.wphillipmoore.mturk.requester.request.ParameterBag;
import java.util.Objects;

/**
 * Endpoint and default parameters for one {@link Mode}.
 *
 * @param mode the mode this configuration belongs to
 * @param baseUrl the endpoint URL the query string is appended to
 * @param region the AWS region of the endpoint
 * @param defaults parameters merged under every request's own parameters
 */
public record EndpointConfig(Mode mode, String baseUrl, String region, ParameterBag defaults) {

  /** Validates that all fields are non-null and the URL is not blank. */
  public EndpointConfig {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(baseUrl, "baseUrl");
    Objects.requireNonNull(region, "region");
    Objects.requireNonNull(defaults, "defaults");
    if (baseUrl.isBlank()) {
      throw new IllegalArgumentException("baseUrl must not be blank");
    }
  }
}
