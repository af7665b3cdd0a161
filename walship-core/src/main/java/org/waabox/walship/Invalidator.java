package org.waabox.walship;

/**
 * Callback notified on a replica after a frame or snapshot has been fully
 * applied, so cached views of the database can be dropped.
 *
 * <p>Implementations must be idempotent and safe to call from the
 * replication consumer thread. The callback is never invoked for a
 * partially applied frame.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface Invalidator {

  /** An invalidator that ignores every notification. */
  Invalidator NONE = (database, position) -> { };

  /**
   * Called after the given database reached the given position.
   *
   * @param database the database name, never null
   * @param position the position that is now fully applied, never null
   */
  void invalidatePosition(String database, Position position);
}
