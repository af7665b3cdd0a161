package org.waabox.walship.lease;

/**
 * Thrown when the coordination backend behind a {@link Leaser} cannot be
 * reached.
 *
 * <p>Connection failures are transient: the store retries them with
 * backoff and never treats them as fatal.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class LeaseConnectionException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception with the given message.
   *
   * @param message the detail message, never null
   */
  public LeaseConnectionException(final String message) {
    super(message);
  }

  /**
   * Creates a new exception with the given message and cause.
   *
   * @param message the detail message, never null
   * @param cause   the underlying cause, never null
   */
  public LeaseConnectionException(final String message,
      final Throwable cause) {
    super(message, cause);
  }
}
