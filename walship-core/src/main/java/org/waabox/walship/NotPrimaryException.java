package org.waabox.walship;

/**
 * Thrown when a commit is attempted on a node that is not the primary.
 *
 * <p>The caller must reject the underlying write and re-check the role of
 * the node before retrying. This is also raised when the node still
 * believes it is primary but its local view of the lease has expired.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NotPrimaryException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception for a rejected commit.
   *
   * @param message the detail message, never null
   */
  public NotPrimaryException(final String message) {
    super(message);
  }
}
