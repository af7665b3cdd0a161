package org.waabox.walship;

import java.time.Instant;
import java.util.Objects;

/**
 * An opaque, ordered unit of committed change for one database.
 *
 * <p>Frames are applied atomically and in position order. The payload is
 * never interpreted by walship.
 *
 * @param database    the database the frame belongs to, never null
 * @param position    the position created by this frame, never null
 * @param committedAt the instant the primary committed the frame, never
 *                    null
 * @param payload     the committed bytes, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Frame(String database, Position position, Instant committedAt,
    byte[] payload) {

  /**
   * Validates the record components.
   *
   * @throws NullPointerException if any component is null
   */
  public Frame {
    Objects.requireNonNull(database, "database must not be null");
    Objects.requireNonNull(position, "position must not be null");
    Objects.requireNonNull(committedAt, "committedAt must not be null");
    Objects.requireNonNull(payload, "payload must not be null");
  }

  /**
   * Returns the transaction id of this frame.
   *
   * @return the txid, always greater than zero
   */
  public long txid() {
    return position.txid();
  }

  @Override
  public String toString() {
    return "Frame[" + database + "@" + position + ", " + payload.length
        + " bytes]";
  }
}
