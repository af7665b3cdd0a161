package org.waabox.walship.lease;

/**
 * Thrown by {@link Leaser#renew(Lease)} when the backend reports that the
 * lease is no longer held by this node.
 *
 * <p>This is the expected way a primary discovers it has been demoted.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class LeaseLostException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception with the given message.
   *
   * @param message the detail message, never null
   */
  public LeaseLostException(final String message) {
    super(message);
  }
}
