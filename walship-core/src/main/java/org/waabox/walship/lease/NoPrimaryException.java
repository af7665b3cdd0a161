package org.waabox.walship.lease;

/**
 * Thrown by {@link Leaser#primary()} when no node currently holds a valid
 * lease.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoPrimaryException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with a default message. */
  public NoPrimaryException() {
    super("No primary currently holds the lease");
  }
}
