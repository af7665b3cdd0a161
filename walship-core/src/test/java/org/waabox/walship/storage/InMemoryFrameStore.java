package org.waabox.walship.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.waabox.walship.Frame;
import org.waabox.walship.Position;

/**
 * A frame store kept in memory, so tests can seed a node with a history
 * and inspect what it recorded.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class InMemoryFrameStore implements FrameStore {

  /** The frames per database, in txid order. */
  private final Map<String, List<Frame>> frames = new ConcurrentHashMap<>();

  /** The base position per database. */
  private final Map<String, Position> bases = new ConcurrentHashMap<>();

  @Override
  public synchronized void append(final Frame frame) {
    frames.computeIfAbsent(frame.database(), name -> new ArrayList<>())
        .add(frame);
  }

  @Override
  public synchronized List<Frame> load(final String database) {
    return List.copyOf(frames.getOrDefault(database, List.of()));
  }

  @Override
  public Position base(final String database) {
    return bases.getOrDefault(database, Position.ZERO);
  }

  @Override
  public synchronized Set<String> databases() {
    return Set.copyOf(frames.keySet());
  }

  @Override
  public synchronized void prune(final String database,
      final long beforeTxid) {
    final List<Frame> stored = frames.get(database);
    if (stored != null) {
      stored.removeIf(frame -> frame.txid() < beforeTxid);
    }
  }

  @Override
  public synchronized void reset(final String database,
      final Position base) {
    frames.put(database, new ArrayList<>());
    bases.put(database, base);
  }
}
