package org.waabox.walship.replication;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The replication sessions of this primary, connected and recently
 * disconnected.
 *
 * <p>A single lock guards session registration and the retention sweep,
 * so a resume position validated at registration cannot be pruned before
 * the session starts protecting it. When a session disconnects its
 * cursors are remembered, keyed by node, so that the node can resume
 * without a resync if it reconnects within the retention duration.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SessionRegistry {

  private static final Logger log =
      LoggerFactory.getLogger(SessionRegistry.class);

  /** The cursors of a session that went away. */
  private record Disconnected(Map<String, Long> cursors,
      Instant disconnectedAt) {
  }

  /** Guards every field below. */
  private final ReentrantLock lock = new ReentrantLock();

  /** The connected sessions. */
  private final List<ReplicationSession> sessions = new ArrayList<>();

  /** The sessions that disconnected, keyed by node. */
  private final Map<String, Disconnected> disconnected = new HashMap<>();

  /**
   * Runs the action while holding the registry lock.
   *
   * @param <T>    the result type
   * @param action the action, never null
   * @return the action result
   */
  public <T> T withLock(final Supplier<T> action) {
    Objects.requireNonNull(action, "action must not be null");
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Registers a connected session. A remembered disconnection of the
   * same node is forgotten.
   *
   * @param session the session, never null
   */
  public void register(final ReplicationSession session) {
    Objects.requireNonNull(session, "session must not be null");
    lock.lock();
    try {
      disconnected.remove(session.node());
      sessions.add(session);
    } finally {
      lock.unlock();
    }
    log.info("Replica {} connected", session.node());
  }

  /**
   * Unregisters a session and remembers its cursors.
   *
   * @param session the session, never null
   * @param now     the disconnection instant, never null
   */
  public void unregister(final ReplicationSession session,
      final Instant now) {
    Objects.requireNonNull(session, "session must not be null");
    lock.lock();
    try {
      if (!sessions.remove(session)) {
        return;
      }
      disconnected.put(session.node(),
          new Disconnected(session.cursors(), now));
    } finally {
      lock.unlock();
    }
    log.info("Replica {} disconnected", session.node());
  }

  /**
   * Returns the smallest txid of the database that a connected session,
   * or one disconnected within the retention duration, still needs.
   *
   * @param database  the database name, never null
   * @param now       the current instant, never null
   * @param retention the retention duration, never null
   *
   * @return the required txid, {@link Long#MAX_VALUE} when nobody needs
   *         anything
   */
  public long requiredTxid(final String database, final Instant now,
      final Duration retention) {
    lock.lock();
    try {
      long required = Long.MAX_VALUE;
      for (final ReplicationSession session : sessions) {
        if (!session.isSkipped(database)) {
          required = Math.min(required, session.cursor(database) + 1);
        }
      }
      final Instant horizon = now.minus(retention);
      for (final Disconnected gone : disconnected.values()) {
        if (gone.disconnectedAt().isAfter(horizon)) {
          final Long cursor = gone.cursors().get(database);
          if (cursor != null) {
            required = Math.min(required, cursor + 1);
          }
        }
      }
      return required;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Forgets the sessions disconnected longer than the retention duration.
   *
   * @param now       the current instant, never null
   * @param retention the retention duration, never null
   * @return the number of forgotten sessions
   */
  public int expireDisconnected(final Instant now,
      final Duration retention) {
    final Instant horizon = now.minus(retention);
    lock.lock();
    try {
      int count = 0;
      final Iterator<Disconnected> it = disconnected.values().iterator();
      while (it.hasNext()) {
        if (!it.next().disconnectedAt().isAfter(horizon)) {
          it.remove();
          count++;
        }
      }
      return count;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the connected sessions.
   *
   * @return an immutable snapshot, never null
   */
  public List<ReplicationSession> sessions() {
    lock.lock();
    try {
      return List.copyOf(sessions);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Closes every connected session.
   *
   * @param graceful true to let sessions finish with an end of stream
   *                 record, false to abort their streams
   */
  public void closeAll(final boolean graceful) {
    lock.lock();
    try {
      for (final ReplicationSession session : sessions) {
        if (graceful) {
          session.end();
        } else {
          session.abort();
        }
      }
    } finally {
      lock.unlock();
    }
  }
}
