package io.github.wphillipmoore.mturk.requester.auth;

import java.util.Objects;

/**
 * Access key and secret key used to sign every request of a session.
 *
 * <p>{@link #toString()} redacts the secret key so credentials can appear in diagnostics without
 * leaking it.
 *
 * @param accessKeyId the AWS access key id, never null or blank
 * @param secretKey the AWS secret access key, never null or blank
 */
public record AwsCredentials(String accessKeyId, String secretKey) {

  /** Validates that both keys are present. */
  public AwsCredentials {
    Objects.requireNonNull(accessKeyId, "accessKeyId");
    Objects.requireNonNull(secretKey, "secretKey");
    if (accessKeyId.isBlank()) {
      throw new IllegalArgumentException("accessKeyId must not be blank");
    }
    if (secretKey.isBlank()) {
      throw new IllegalArgumentException("secretKey must not be blank");
    }
  }

  @Override
  public String toString() {
    return "AwsCredentials[accessKeyId=" + accessKeyId + ", secretKey=****]";
  }
}
