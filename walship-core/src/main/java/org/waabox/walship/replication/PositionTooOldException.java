package org.waabox.walship.replication;

import org.waabox.walship.Position;

/**
 * Thrown when a requested resume position can no longer be served
 * incrementally, because the frames after it were pruned or because the
 * position is not part of the primary's history.
 *
 * <p>The replica must perform a full resync from a snapshot.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class PositionTooOldException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** The database the position belongs to. */
  private final String database;

  /**
   * Creates a new exception.
   *
   * @param theDatabase the database name, never null
   * @param requested   the rejected position, never null
   * @param reason      why the position cannot be served, never null
   */
  public PositionTooOldException(final String theDatabase,
      final Position requested, final String reason) {
    super("Position " + requested + " of database '" + theDatabase
        + "' cannot be served: " + reason);
    database = theDatabase;
  }

  /**
   * Creates a new exception from a remote error message.
   *
   * @param theDatabase the database name, never null
   * @param message     the detail message, never null
   */
  public PositionTooOldException(final String theDatabase,
      final String message) {
    super(message);
    database = theDatabase;
  }

  /**
   * Returns the database the rejected position belongs to.
   *
   * @return the database name, never null
   */
  public String database() {
    return database;
  }
}
