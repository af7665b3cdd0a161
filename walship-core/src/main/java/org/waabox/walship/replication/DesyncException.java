package org.waabox.walship.replication;

import org.waabox.walship.Position;

/**
 * Thrown on a replica when a received frame does not directly follow the
 * last applied one, or belongs to a history the replica does not share.
 *
 * <p>The replica must perform a full resync from a snapshot.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class DesyncException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** The database with the gap. */
  private final String database;

  /**
   * Creates a new exception.
   *
   * @param theDatabase the database name, never null
   * @param expected    the txid the replica expected next
   * @param received    the txid the replica received
   */
  public DesyncException(final String theDatabase, final long expected,
      final long received) {
    super("Database '" + theDatabase + "' expected txid " + expected
        + " but received " + received);
    database = theDatabase;
  }

  /**
   * Creates a new exception for a frame from a diverged history.
   *
   * @param theDatabase the database name, never null
   * @param received    the position of the received frame, never null
   * @param reason      what diverged, never null
   */
  public DesyncException(final String theDatabase, final Position received,
      final String reason) {
    super("Database '" + theDatabase + "' received frame " + received
        + ": " + reason);
    database = theDatabase;
  }

  /**
   * Returns the database with the gap.
   *
   * @return the database name, never null
   */
  public String database() {
    return database;
  }
}
