package io.github.wphillipmoore.mturk.requester.exception;

import java.util.Objects;

/**
 * Thrown when a required request parameter is absent.
 *
 * <p>Raised while the request is being assembled, so no network call has been made when this is
 * thrown.
 */
public final class MturkMissingParameterException extends MturkException {

  private static final long serialVersionUID = 1L;

  private final String key;

  /**
   * Creates a missing parameter exception.
   *
   * @param key the name of the missing parameter
   */
  public MturkMissingParameterException(String key) {
    super("The " + Objects.requireNonNull(key, "key") + " parameter is required.");
    this.key = key;
  }

  /** Returns the name of the missing parameter. */
  public String getKey() {
    return key;
  }
}
