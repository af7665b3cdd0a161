package org.waabox.walship.replication;

/**
 * The errors a primary reports on a replication stream.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum ErrorCode {

  /** The requested resume position is outside the retained window. */
  POSITION_TOO_OLD(1),

  /** The requested database does not exist on the primary yet. */
  UNKNOWN_DATABASE(2),

  /** The node serving the stream is not the primary. */
  NOT_PRIMARY(3);

  /** The wire value. */
  private final int code;

  ErrorCode(final int theCode) {
    code = theCode;
  }

  /**
   * Returns the wire value.
   *
   * @return the code
   */
  public int code() {
    return code;
  }

  /**
   * Resolves a wire value.
   *
   * @param code the wire value
   * @return the error code, never null
   * @throws IllegalArgumentException if the value is unknown
   */
  public static ErrorCode fromCode(final int code) {
    for (final ErrorCode value : values()) {
      if (value.code == code) {
        return value;
      }
    }
    throw new IllegalArgumentException("Unknown error code: " + code);
  }
}
