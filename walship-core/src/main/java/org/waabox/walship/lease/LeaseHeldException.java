package org.waabox.walship.lease;

/**
 * Thrown by {@link Leaser#acquire(org.waabox.walship.Node)} when another
 * node holds a valid lease, or when the lock-delay after the previous
 * lease has not elapsed yet.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class LeaseHeldException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception with the given message.
   *
   * @param message the detail message, never null
   */
  public LeaseHeldException(final String message) {
    super(message);
  }
}
