package org.waabox.walship.replication;

import java.util.Objects;

import org.waabox.walship.Position;

/**
 * The full state of a database at a position, used to resync a replica
 * whose position can no longer be served incrementally.
 *
 * @param database the database name, never null
 * @param position the position the image corresponds to, never null
 * @param image    the opaque database image, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Snapshot(String database, Position position, byte[] image) {

  /**
   * Validates the record components.
   *
   * @throws NullPointerException if any component is null
   */
  public Snapshot {
    Objects.requireNonNull(database, "database must not be null");
    Objects.requireNonNull(position, "position must not be null");
    Objects.requireNonNull(image, "image must not be null");
  }
}
