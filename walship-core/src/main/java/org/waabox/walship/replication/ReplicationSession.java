package org.waabox.walship.replication;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.walship.Position;

/**
 * A replica connected to this primary.
 *
 * <p>The session tracks, per database, the last txid it delivered. A
 * database without a cursor has not been streamed yet and is delivered
 * from its first retained frame. Databases the replica must resync are
 * skipped for the rest of the session.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ReplicationSession {

  private static final Logger log =
      LoggerFactory.getLogger(ReplicationSession.class);

  /** The requesting node's hostname. */
  private final String node;

  /** The stream the session writes to. */
  private final OutputStream output;

  /** When the session connected. */
  private final Instant connectedAt;

  /** The last delivered txid per database. */
  private final Map<String, Long> cursors = new ConcurrentHashMap<>();

  /**
   * The positions requested for databases the primary did not have at
   * connect time. They are resolved once the database appears.
   */
  private final Map<String, Position> awaiting = new ConcurrentHashMap<>();

  /** The databases this session no longer streams. */
  private final Set<String> skipped = ConcurrentHashMap.newKeySet();

  /** Set when the session must end with an end of stream record. */
  private volatile boolean ending = false;

  /** Set when the session was aborted and its stream closed. */
  private volatile boolean aborted = false;

  /**
   * Creates a new session.
   *
   * @param theNode        the requesting node's hostname, never null
   * @param theOutput      the stream to write to, never null
   * @param theConnectedAt when the session connected, never null
   */
  public ReplicationSession(final String theNode,
      final OutputStream theOutput, final Instant theConnectedAt) {
    node = Objects.requireNonNull(theNode, "node must not be null");
    output = Objects.requireNonNull(theOutput, "output must not be null");
    connectedAt = Objects.requireNonNull(theConnectedAt,
        "connectedAt must not be null");
  }

  /**
   * Returns the requesting node's hostname.
   *
   * @return the hostname, never null
   */
  public String node() {
    return node;
  }

  /**
   * Returns when the session connected.
   *
   * @return the instant, never null
   */
  public Instant connectedAt() {
    return connectedAt;
  }

  /**
   * Returns the last delivered txid of the database.
   *
   * @param database the database name, never null
   * @return the txid, 0 when nothing was delivered yet
   */
  public long cursor(final String database) {
    return cursors.getOrDefault(database, 0L);
  }

  /**
   * Records the last delivered txid of the database.
   *
   * @param database the database name, never null
   * @param txid     the delivered txid
   */
  public void advance(final String database, final long txid) {
    cursors.put(database, txid);
  }

  /**
   * Returns a copy of the cursors.
   *
   * @return the last delivered txid per database, never null
   */
  public Map<String, Long> cursors() {
    return Map.copyOf(cursors);
  }

  /**
   * Remembers the position a replica requested for a database this node
   * does not have yet.
   *
   * @param database  the database name, never null
   * @param requested the replica's position, never null
   */
  public void await(final String database, final Position requested) {
    awaiting.put(database, requested);
  }

  /**
   * Returns and forgets the position requested for a database that did
   * not exist when the session started.
   *
   * @param database the database name, never null
   * @return the requested position, null if none is pending
   */
  public Position takeAwaiting(final String database) {
    return awaiting.remove(database);
  }

  /**
   * Stops streaming the database for the rest of the session.
   *
   * @param database the database name, never null
   */
  public void skip(final String database) {
    skipped.add(database);
  }

  /**
   * Tells whether the database is no longer streamed.
   *
   * @param database the database name, never null
   * @return true if skipped
   */
  public boolean isSkipped(final String database) {
    return skipped.contains(database);
  }

  /** Asks the session to finish with an end of stream record. */
  public void end() {
    ending = true;
  }

  /**
   * Tells whether the session was asked to end.
   *
   * @return true once {@link #end()} was called
   */
  public boolean isEnding() {
    return ending;
  }

  /**
   * Aborts the session, closing its stream so that a blocked write
   * fails immediately.
   */
  public void abort() {
    aborted = true;
    try {
      output.close();
    } catch (final IOException e) {
      log.debug("Error closing stream of session {}", node, e);
    }
  }

  /**
   * Tells whether the session was aborted.
   *
   * @return true once {@link #abort()} was called
   */
  public boolean isAborted() {
    return aborted;
  }

  @Override
  public String toString() {
    return "ReplicationSession[node=" + node + ", connectedAt="
        + connectedAt + "]";
  }
}
