package org.waabox.walship.replication;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.walship.Database;
import org.waabox.walship.DatabaseRegistry;
import org.waabox.walship.Frame;
import org.waabox.walship.Position;

/**
 * The producing side of replication: streams the frame log of every
 * database to connected replicas.
 *
 * <p>Transports call {@link #serve(StreamRequest, OutputStream)} once per
 * replica connection, on a thread of their own; the call blocks for the
 * lifetime of the session.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ReplicationServer {

  private static final Logger log =
      LoggerFactory.getLogger(ReplicationServer.class);

  /** A database the session cannot stream as requested. */
  private record Rejection(ErrorCode code, String database, String message) {
  }

  /** The maximum number of frames read from a database per pass. */
  private static final int BATCH_SIZE = 256;

  /** The databases to stream. */
  private final DatabaseRegistry registry;

  /** The connected sessions. */
  private final SessionRegistry sessions;

  /** Tells whether this node currently is the primary. */
  private final BooleanSupplier primary;

  /** Captures snapshots for resyncing replicas, may be null. */
  private final SnapshotHandler snapshotHandler;

  /** How long an idle session waits before sending a heartbeat. */
  private final Duration heartbeatInterval;

  /** The clock. */
  private final Clock clock;

  /**
   * Creates a new server.
   *
   * @param theRegistry          the databases, never null
   * @param theSessions          the session registry, never null
   * @param isPrimary            tells whether this node is primary, never
   *                             null
   * @param theSnapshotHandler   the snapshot collaborator, may be null
   * @param theHeartbeatInterval the idle heartbeat interval, never null
   * @param theClock             the clock, never null
   */
  public ReplicationServer(final DatabaseRegistry theRegistry,
      final SessionRegistry theSessions, final BooleanSupplier isPrimary,
      final SnapshotHandler theSnapshotHandler,
      final Duration theHeartbeatInterval, final Clock theClock) {
    registry = Objects.requireNonNull(theRegistry,
        "registry must not be null");
    sessions = Objects.requireNonNull(theSessions,
        "sessions must not be null");
    primary = Objects.requireNonNull(isPrimary, "isPrimary must not be null");
    heartbeatInterval = Objects.requireNonNull(theHeartbeatInterval,
        "heartbeatInterval must not be null");
    clock = Objects.requireNonNull(theClock, "clock must not be null");
    snapshotHandler = theSnapshotHandler;
  }

  /**
   * Serves a replication stream until the session ends, is aborted or the
   * replica goes away.
   *
   * @param request the replica's request, never null
   * @param output  the stream to write records to, never null
   *
   * @throws IOException if writing to the replica fails
   */
  public void serve(final StreamRequest request, final OutputStream output)
      throws IOException {
    Objects.requireNonNull(request, "request must not be null");
    Objects.requireNonNull(output, "output must not be null");

    final StreamWriter writer = new StreamWriter(output);
    final ReplicationSession session = new ReplicationSession(
        request.node(), output, clock.instant());
    final List<Rejection> rejections = new ArrayList<>();

    final Map<String, Position> handshake = sessions.withLock(() -> {
      if (!primary.getAsBoolean()) {
        return null;
      }
      for (final Map.Entry<String, Position> entry
          : request.positions().entrySet()) {
        final String name = entry.getKey();
        final Optional<Database> database = registry.find(name);
        if (database.isEmpty()) {
          session.await(name, entry.getValue());
          rejections.add(new Rejection(ErrorCode.UNKNOWN_DATABASE, name,
              "Database '" + name + "' does not exist"));
          continue;
        }
        try {
          session.advance(name, database.get().resolve(entry.getValue()));
        } catch (final PositionTooOldException e) {
          session.skip(name);
          rejections.add(new Rejection(ErrorCode.POSITION_TOO_OLD, name,
              e.getMessage()));
        }
      }
      sessions.register(session);
      return registry.positions();
    });

    if (handshake == null) {
      writer.error(ErrorCode.NOT_PRIMARY, "", "Node is not the primary");
      writer.end();
      return;
    }

    try {
      writer.handshake(handshake);
      for (final Rejection rejection : rejections) {
        log.info("Replica {}: {} for database '{}'", request.node(),
            rejection.code(), rejection.database());
        writer.error(rejection.code(), rejection.database(),
            rejection.message());
      }
      stream(session, writer);
    } catch (final IOException e) {
      if (!session.isAborted()) {
        throw e;
      }
      log.debug("Session of replica {} aborted", request.node());
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      log.debug("Session of replica {} interrupted", request.node());
    } finally {
      sessions.unregister(session, clock.instant());
    }
  }

  private void stream(final ReplicationSession session,
      final StreamWriter writer) throws IOException, InterruptedException {
    while (!session.isAborted()) {
      final long seen = registry.changeCount();
      if (session.isEnding()) {
        writer.end();
        return;
      }
      boolean sent = false;
      for (final Database database : registry.databases()) {
        if (session.isSkipped(database.name())) {
          continue;
        }
        final Position awaited = session.takeAwaiting(database.name());
        if (awaited != null) {
          try {
            session.advance(database.name(), database.resolve(awaited));
          } catch (final PositionTooOldException e) {
            session.skip(database.name());
            writer.error(ErrorCode.POSITION_TOO_OLD, database.name(),
                e.getMessage());
            continue;
          }
        }
        final List<Frame> batch;
        try {
          batch = database.framesAfter(session.cursor(database.name()),
              BATCH_SIZE);
        } catch (final PositionTooOldException e) {
          session.skip(database.name());
          writer.error(ErrorCode.POSITION_TOO_OLD, database.name(),
              e.getMessage());
          continue;
        }
        for (final Frame frame : batch) {
          writer.frame(frame);
          session.advance(database.name(), frame.txid());
          sent = true;
        }
      }
      if (!sent && !registry.awaitChange(seen, heartbeatInterval)) {
        writer.heartbeat();
      }
    }
  }

  /**
   * Writes a snapshot record of the database.
   *
   * <p>Writes an error record instead when this node is not the primary,
   * the database does not exist or no snapshot collaborator is set.
   *
   * @param database the database name, never null
   * @param output   the stream to write to, never null
   *
   * @throws IOException if writing fails
   */
  public void snapshot(final String database, final OutputStream output)
      throws IOException {
    Objects.requireNonNull(database, "database must not be null");
    final StreamWriter writer = new StreamWriter(output);
    if (!primary.getAsBoolean()) {
      writer.error(ErrorCode.NOT_PRIMARY, database, "Node is not the primary");
      return;
    }
    final Optional<Database> found = registry.find(database);
    if (found.isEmpty() || snapshotHandler == null) {
      writer.error(ErrorCode.UNKNOWN_DATABASE, database,
          found.isEmpty() ? "Database '" + database + "' does not exist"
              : "No snapshot handler configured");
      return;
    }
    final Snapshot snapshot = found.get().capture(snapshotHandler);
    log.info("Serving snapshot of database '{}' at {}", database,
        snapshot.position());
    writer.snapshot(snapshot);
  }

  /**
   * Returns the number of connected replicas.
   *
   * @return the session count
   */
  public int sessionCount() {
    return sessions.sessions().size();
  }

  /**
   * Closes every session and wakes the ones waiting for frames.
   *
   * @param graceful true to finish streams with an end record, false to
   *                 abort them
   */
  public void closeSessions(final boolean graceful) {
    sessions.closeAll(graceful);
    registry.signalChange();
  }
}
