package org.waabox.walship.replication;

import org.waabox.walship.Position;

/**
 * Captures and restores full database images for resynchronization.
 *
 * <p>Implemented by the component that owns the database files. On the
 * primary, {@link #capture(String)} is called while the database is locked
 * against commits, so the image always matches the reported position.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface SnapshotHandler {

  /**
   * Returns the current image of the given database.
   *
   * @param database the database name, never null
   * @return the image bytes, never null
   */
  byte[] capture(String database);

  /**
   * Replaces the local image of the given database.
   *
   * @param database the database name, never null
   * @param position the position the image corresponds to, never null
   * @param image    the image bytes, never null
   */
  void restore(String database, Position position, byte[] image);
}
