package org.waabox.walship.storage;

import java.util.List;
import java.util.Set;

import org.waabox.walship.Frame;
import org.waabox.walship.Position;

/**
 * A durable store for the retained frame log of every database.
 *
 * <p>Implementations define where frames are kept (e.g. the local data
 * directory). The store lets a restarted node resume replication from its
 * last applied position instead of resyncing from a snapshot. Failures are
 * reported as {@link org.waabox.walship.WalshipException}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface FrameStore {

  /** A store that keeps nothing, for purely in-memory nodes. */
  FrameStore NONE = new FrameStore() {
    @Override
    public void append(final Frame frame) {
    }

    @Override
    public List<Frame> load(final String database) {
      return List.of();
    }

    @Override
    public Position base(final String database) {
      return Position.ZERO;
    }

    @Override
    public Set<String> databases() {
      return Set.of();
    }

    @Override
    public void prune(final String database, final long beforeTxid) {
    }

    @Override
    public void reset(final String database, final Position base) {
    }
  };

  /**
   * Durably records a frame. Frames of a database are appended in txid
   * order.
   *
   * @param frame the frame to record, never null
   */
  void append(Frame frame);

  /**
   * Loads the retained frames of the given database.
   *
   * @param database the database name, never null
   * @return the frames in txid order, never null, possibly empty
   */
  List<Frame> load(String database);

  /**
   * Returns the position the database was last reset to, or
   * {@link Position#ZERO} if it was never reset.
   *
   * @param database the database name, never null
   * @return the base position, never null
   */
  Position base(String database);

  /**
   * Returns the names of the databases with stored state.
   *
   * @return the database names, never null
   */
  Set<String> databases();

  /**
   * Removes the frames of the database with txid strictly below the given
   * one.
   *
   * @param database   the database name, never null
   * @param beforeTxid the first txid to keep
   */
  void prune(String database, long beforeTxid);

  /**
   * Discards every frame of the database and records a new base position,
   * after the database was restored from a snapshot.
   *
   * @param database the database name, never null
   * @param base     the restored position, never null
   */
  void reset(String database, Position base);
}
