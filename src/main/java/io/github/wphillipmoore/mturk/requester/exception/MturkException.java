package io.github.wphillipmoore.mturk.requester.exception;

/**
 * Base exception for all Mechanical Turk requester errors.
 *
 * <p>This is an unchecked exception hierarchy. Every failure of a session call surfaces as exactly
 * one subclass; none are retried or swallowed by the session.
 */
public sealed class MturkException extends RuntimeException
    permits MturkMissingParameterException,
        MturkServiceException,
        MturkUnclassifiedException,
        MturkTransportException {

  private static final long serialVersionUID = 1L;

  /** Creates an exception with the given message. */
  public MturkException(String message) {
    super(message);
  }

  /** Creates an exception with the given message and cause. */
  public MturkException(String message, Throwable cause) {
    super(message, cause);
  }
}
