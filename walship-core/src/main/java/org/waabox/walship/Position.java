package org.waabox.walship;

/**
 * A point in the committed history of a database.
 *
 * <p>The {@code txid} is the gap-free commit sequence of the database: the
 * first commit is 1 and 0 means that nothing has been applied. The
 * {@code generation} identifies a continuous history. A node starts a new
 * generation for every database when it becomes primary, so two primaries
 * that committed the same txid on top of a common prefix can be told
 * apart.
 *
 * @param generation the history identifier, 0 only for {@link #ZERO}
 * @param txid       the transaction sequence number, never negative
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Position(long generation, long txid) {

  /** The position of a database with no applied transaction. */
  public static final Position ZERO = new Position(0, 0);

  /**
   * Validates the record components.
   *
   * @throws IllegalArgumentException if txid is negative
   */
  public Position {
    if (txid < 0) {
      throw new IllegalArgumentException("txid must not be negative, got: "
          + txid);
    }
  }

  /**
   * Returns whether this is the empty position.
   *
   * @return true if no transaction has been applied
   */
  public boolean isZero() {
    return txid == 0;
  }

  /**
   * Returns the position of the next transaction in the same generation.
   *
   * @return the next position, never null
   */
  public Position next() {
    return new Position(generation, txid + 1);
  }

  @Override
  public String toString() {
    return String.format("%016x/%d", generation, txid);
  }
}
