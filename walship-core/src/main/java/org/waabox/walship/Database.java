package org.waabox.walship;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import org.waabox.walship.replication.DesyncException;
import org.waabox.walship.replication.PositionTooOldException;
import org.waabox.walship.replication.Snapshot;
import org.waabox.walship.replication.SnapshotHandler;
import org.waabox.walship.retention.RetentionPolicy;

/**
 * A replicated database: its current position, the generations that make
 * up its history and the frames retained since the last retention
 * boundary.
 *
 * <p>Frames are appended by a single writer, the local apply path (commit
 * on the primary, stream consumer on a replica), and read by any number
 * of serving sessions. All state is guarded by a per-database lock, so
 * commits to different databases never contend.
 *
 * <p>Retained frames are contiguous: the first retained frame has txid
 * {@code prunedThrough + 1} and the last one has the current txid.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Database {

  /** A continuous history and the txid it forked from. */
  private record Generation(long id, long forkTxid) {
  }

  /** The database name. */
  private final String name;

  /** Guards every field below. */
  private final ReentrantLock lock = new ReentrantLock();

  /** The retained frames, ordered by txid. */
  private final List<Frame> frames = new ArrayList<>();

  /** The generations of this database, oldest first. */
  private final List<Generation> generations = new ArrayList<>();

  /** The current position. */
  private Position position = Position.ZERO;

  /** The highest txid that is no longer retained. */
  private long prunedThrough = 0;

  /**
   * Creates a new, empty database.
   *
   * @param theName the database name, never null
   */
  public Database(final String theName) {
    name = Objects.requireNonNull(theName, "name must not be null");
  }

  /**
   * Returns the database name.
   *
   * @return the name, never null
   */
  public String name() {
    return name;
  }

  /**
   * Returns the current position.
   *
   * @return the position, never null
   */
  public Position position() {
    lock.lock();
    try {
      return position;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the txid of the oldest frame that can still be streamed.
   *
   * @return the first retained txid
   */
  public long retainedFrom() {
    lock.lock();
    try {
      return prunedThrough + 1;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of retained frames.
   *
   * @return the frame count
   */
  public int frameCount() {
    lock.lock();
    try {
      return frames.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Starts a new generation at the current txid. Called when this node
   * becomes primary, so that its commits can be told apart from frames a
   * previous primary may have committed at the same txids.
   *
   * @param generation the new generation id, must not be 0
   */
  public void startGeneration(final long generation) {
    if (generation == 0) {
      throw new IllegalArgumentException("generation must not be 0");
    }
    lock.lock();
    try {
      generations.add(new Generation(generation, position.txid()));
      position = new Position(generation, position.txid());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Appends a new frame on the primary.
   *
   * <p>The sink is invoked with the lock held before the frame becomes
   * visible, so it can durably record it in order. If the sink throws, the
   * frame is discarded and the position does not move.
   *
   * @param payload the committed bytes, never null
   * @param now     the commit instant, never null
   * @param sink    receives the frame before it is published, never null
   *
   * @return the appended frame, never null
   *
   * @throws IllegalStateException if no generation was started
   */
  public Frame append(final byte[] payload, final Instant now,
      final Consumer<Frame> sink) {
    Objects.requireNonNull(payload, "payload must not be null");
    lock.lock();
    try {
      if (generations.isEmpty()) {
        throw new IllegalStateException("Database '" + name
            + "' has no generation, it was never promoted");
      }
      final Frame frame = new Frame(name, position.next(), now,
          payload.clone());
      sink.accept(frame);
      frames.add(frame);
      position = frame.position();
      return frame;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Applies a frame received from the primary.
   *
   * <p>Frames at or below the current txid are duplicates of an
   * at-least-once delivery and are skipped, as long as the local history
   * holds the frame's generation at that txid.
   *
   * @param frame the received frame, never null
   * @param sink  receives the frame before it is published, never null
   *
   * @return true if the frame was applied, false if it was a duplicate
   *
   * @throws DesyncException if the frame does not follow the current txid,
   *                         or it is an older frame from a history this
   *                         database does not share
   */
  public boolean apply(final Frame frame, final Consumer<Frame> sink) {
    Objects.requireNonNull(frame, "frame must not be null");
    lock.lock();
    try {
      final long expected = position.txid() + 1;
      if (frame.txid() < expected) {
        if (generationAt(frame.txid()) != frame.position().generation()) {
          throw new DesyncException(name, frame.position(),
              "history diverged at or before txid " + frame.txid());
        }
        return false;
      }
      if (frame.txid() > expected) {
        throw new DesyncException(name, expected, frame.txid());
      }
      final long generation = frame.position().generation();
      if (generations.isEmpty()
          || generations.get(generations.size() - 1).id() != generation) {
        generations.add(new Generation(generation, position.txid()));
      }
      sink.accept(frame);
      frames.add(frame);
      position = frame.position();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the generation that produced the frame at the given txid.
   * Must be called with the lock held.
   *
   * @param txid the txid, greater than 0
   * @return the generation id, 0 when the txid precedes every known
   *         generation
   */
  private long generationAt(final long txid) {
    for (int i = generations.size() - 1; i >= 0; i--) {
      if (generations.get(i).forkTxid() < txid) {
        return generations.get(i).id();
      }
    }
    return 0;
  }

  /**
   * Validates a resume position requested by a replica.
   *
   * @param requested the last position the replica applied, never null
   *
   * @return the txid after which frames must be streamed
   *
   * @throws PositionTooOldException if the frames after the position were
   *                                 pruned, or the position is not part of
   *                                 this database's history
   */
  public long resolve(final Position requested) {
    Objects.requireNonNull(requested, "requested must not be null");
    lock.lock();
    try {
      if (requested.txid() < prunedThrough) {
        throw new PositionTooOldException(name, requested,
            "frames up to txid " + prunedThrough + " were pruned");
      }
      if (requested.isZero()) {
        return 0;
      }
      int index = -1;
      for (int i = 0; i < generations.size(); i++) {
        if (generations.get(i).id() == requested.generation()) {
          index = i;
        }
      }
      if (index < 0) {
        throw new PositionTooOldException(name, requested,
            "unknown generation");
      }
      final long upper = index == generations.size() - 1
          ? position.txid()
          : generations.get(index + 1).forkTxid();
      if (requested.txid() > upper) {
        throw new PositionTooOldException(name, requested,
            "history diverged at txid " + upper);
      }
      return requested.txid();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the retained frames following the given txid.
   *
   * @param afterTxid the last txid the reader already has
   * @param max       the maximum number of frames to return
   *
   * @return the frames in txid order, never null, possibly empty
   *
   * @throws PositionTooOldException if the next frame was pruned
   */
  public List<Frame> framesAfter(final long afterTxid, final int max) {
    lock.lock();
    try {
      if (afterTxid < prunedThrough) {
        throw new PositionTooOldException(name,
            new Position(0, afterTxid),
            "frames up to txid " + prunedThrough + " were pruned");
      }
      if (afterTxid >= position.txid() || frames.isEmpty()) {
        return List.of();
      }
      final int from = (int) (afterTxid - prunedThrough);
      final int to = Math.min(frames.size(), from + max);
      return List.copyOf(frames.subList(from, to));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the smallest txid the retention policy wants to keep.
   *
   * <p>A frame is prunable when it was committed before
   * {@code now - duration}, or when it falls outside the last
   * {@code maxFrames} frames.
   *
   * @param policy the retention policy, never null
   * @param now    the current instant, never null
   *
   * @return the policy cutoff txid
   */
  public long retentionCutoff(final RetentionPolicy policy,
      final Instant now) {
    lock.lock();
    try {
      long cutoff = position.txid() + 1;
      final Instant horizon = now.minus(policy.duration());
      for (final Frame frame : frames) {
        if (!frame.committedAt().isBefore(horizon)) {
          cutoff = frame.txid();
          break;
        }
      }
      if (policy.maxFrames().isPresent()) {
        cutoff = Math.max(cutoff,
            position.txid() - policy.maxFrames().getAsInt() + 1);
      }
      return cutoff;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes the frames strictly below the given txid. The frame at the
   * current position is always kept.
   *
   * @param beforeTxid the first txid to keep
   *
   * @return the number of frames removed
   */
  public int prune(final long beforeTxid) {
    lock.lock();
    try {
      final long limit = Math.min(beforeTxid, position.txid());
      final int count = (int) Math.max(0,
          Math.min(frames.size(), limit - prunedThrough - 1));
      if (count == 0) {
        return 0;
      }
      frames.subList(0, count).clear();
      prunedThrough += count;
      return count;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Captures a snapshot of this database. Commits are blocked while the
   * handler runs, so the image matches the returned position.
   *
   * @param handler the component producing the image, never null
   *
   * @return the snapshot, never null
   */
  public Snapshot capture(final SnapshotHandler handler) {
    Objects.requireNonNull(handler, "handler must not be null");
    lock.lock();
    try {
      return new Snapshot(name, position, handler.capture(name));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Discards the whole history and restarts it at the given position,
   * after the database was restored from a snapshot.
   *
   * @param base the position of the restored image, never null
   */
  public void reset(final Position base) {
    Objects.requireNonNull(base, "base must not be null");
    lock.lock();
    try {
      frames.clear();
      generations.clear();
      if (base.generation() != 0) {
        generations.add(new Generation(base.generation(), base.txid()));
      }
      position = base;
      prunedThrough = base.txid();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Rebuilds the in-memory history from durable storage.
   *
   * @param base   the position of the last restored image, never null
   * @param stored the stored frames in txid order, never null
   *
   * @throws WalshipException if the stored frames have gaps
   */
  public void recover(final Position base, final List<Frame> stored) {
    if (stored.isEmpty()) {
      reset(base);
      return;
    }
    final Frame first = stored.get(0);
    reset(new Position(first.position().generation(), first.txid() - 1));
    for (final Frame frame : stored) {
      try {
        apply(frame, f -> { });
      } catch (final DesyncException e) {
        throw new WalshipException("Stored frames of database '" + name
            + "' are not contiguous", e);
      }
    }
  }

  @Override
  public String toString() {
    return "Database[" + name + "@" + position() + "]";
  }
}
