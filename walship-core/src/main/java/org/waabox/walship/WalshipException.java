package org.waabox.walship;

/**
 * Base exception for local infrastructure failures in walship.
 *
 * <p>This is an unchecked exception intended to wrap failures of local
 * resources (frame store I/O, missing collaborators) that cannot be
 * meaningfully recovered from at the call site. Transient network and
 * lease backend failures use their own exception types and are absorbed
 * by the {@link Store} retry loops.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class WalshipException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public WalshipException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public WalshipException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
