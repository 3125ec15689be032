package io.github.wphillipmoore.mturk.requester.signing;

import io.github.wphillipmoore.mturk.requester.auth.AwsCredentials;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * Signs requests using the legacy Mechanical Turk query-string scheme.
 *
 * <p>The string to sign is {@code service + operation + timestamp} with no separators. It is
 * authenticated with an HMAC-SHA1 built by hand from two SHA-1 passes: the secret key is padded
 * with zero bytes (or cut) to the 64-byte block size, XORed with {@code 0x36} for the inner pass
 * and {@code 0x5c} for the outer pass. The raw outer digest is Base64 encoded.
 *
 * <p>For secret keys of at most 64 bytes this is byte-identical to {@code Mac("HmacSHA1")}.
 *
 * @see <a
 *     href="https://docs.aws.amazon.com/AWSMechTurk/latest/AWSMechanicalTurkRequester/MakingRequests_RequestAuthenticationArticle.html">Request
 *     authentication</a>
 */
public final class RequestSigner {

  public static final String DIGEST_ALGORITHM = "SHA-1";
  public static final int BLOCK_SIZE = 64;
  public static final String TIMESTAMP_PATTERN = "yyyy-MM-dd'T'HH:mm:ss'Z'";

  private static final byte INNER_PAD = 0x36;
  private static final byte OUTER_PAD = 0x5c;
  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern(TIMESTAMP_PATTERN).withZone(ZoneOffset.UTC);

  private final byte[] secretKey;
  private final Clock clock;

  /**
   * Creates a signer for the given credentials using the system UTC clock.
   *
   * @param credentials the credentials whose secret key signs requests
   */
  public RequestSigner(AwsCredentials credentials) {
    this(credentials, Clock.systemUTC());
  }

  /**
   * Creates a signer with an explicit clock.
   *
   * @param credentials the credentials whose secret key signs requests
   * @param clock the clock used to stamp requests
   */
  public RequestSigner(AwsCredentials credentials, Clock clock) {
    Objects.requireNonNull(credentials, "credentials");
    this.secretKey = credentials.secretKey().getBytes(StandardCharsets.UTF_8);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns the current time formatted as {@code YYYY-MM-DDTHH:mm:ssZ} in UTC.
   *
   * @return a fresh timestamp
   */
  public String timestamp() {
    return TIMESTAMP_FORMAT.format(clock.instant());
  }

  /**
   * Signs an operation call with this signer's secret key.
   *
   * @param service the service identifier
   * @param operation the operation name
   * @param timestamp the request timestamp, exactly as sent on the wire
   * @return the Base64 signature
   */
  public String sign(String service, String operation, String timestamp) {
    return sign(service, operation, timestamp, secretKey);
  }

  /**
   * Signs an operation call.
   *
   * @param service the service identifier
   * @param operation the operation name
   * @param timestamp the request timestamp, exactly as sent on the wire
   * @param secretKey the raw secret key bytes
   * @return the Base64 signature
   */
  public static String sign(String service, String operation, String timestamp, byte[] secretKey) {
    Objects.requireNonNull(service, "service");
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(secretKey, "secretKey");
    byte[] message = (service + operation + timestamp).getBytes(StandardCharsets.UTF_8);
    return Base64.getEncoder().encodeToString(hmacSha1(secretKey, message));
  }

  static byte[] hmacSha1(byte[] key, byte[] message) {
    byte[] block = Arrays.copyOf(key, BLOCK_SIZE);
    MessageDigest digest = newDigest();
    digest.update(xor(block, INNER_PAD));
    digest.update(message);
    byte[] inner = digest.digest();
    digest.update(xor(block, OUTER_PAD));
    digest.update(inner);
    return digest.digest();
  }

  private static byte[] xor(byte[] block, byte pad) {
    byte[] result = new byte[block.length];
    for (int i = 0; i < block.length; i++) {
      result[i] = (byte) (block[i] ^ pad);
    }
    return result;
  }

  private static MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance(DIGEST_ALGORITHM);
    } catch (NoSuchAlgorithmException e) {
      // Every JRE is required to ship SHA-1.
      throw new IllegalStateException("SHA-1 digest unavailable", e);
    }
  }
}
