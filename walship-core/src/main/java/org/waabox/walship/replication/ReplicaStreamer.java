package org.waabox.walship.replication;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.walship.Database;
import org.waabox.walship.DatabaseRegistry;
import org.waabox.walship.Frame;
import org.waabox.walship.Invalidator;
import org.waabox.walship.Node;
import org.waabox.walship.NotPrimaryException;
import org.waabox.walship.Position;
import org.waabox.walship.WalshipException;
import org.waabox.walship.metrics.WalshipMetrics;
import org.waabox.walship.storage.FrameStore;

/**
 * The consuming side of replication: applies the primary's frame log to
 * the local databases.
 *
 * <p>A frame is applied only when it directly follows the local position.
 * Every applied frame is durably stored and then reported to the
 * {@link Invalidator}. When the primary can no longer serve a database
 * incrementally, or a gap is detected, the database is resynced from a
 * snapshot and the stream is reopened.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ReplicaStreamer {

  private static final Logger log =
      LoggerFactory.getLogger(ReplicaStreamer.class);

  /** This node's hostname, sent with every request. */
  private final String hostname;

  /** The local databases. */
  private final DatabaseRegistry registry;

  /** The transport. */
  private final ReplicationClient client;

  /** Notified after every applied frame or restore. */
  private final Invalidator invalidator;

  /** Restores snapshots, may be null. */
  private final SnapshotHandler snapshotHandler;

  /** Durable frame storage. */
  private final FrameStore frameStore;

  /** Operational metrics. */
  private final WalshipMetrics metrics;

  /** Runs the idle watchdog. */
  private final ScheduledExecutorService timer;

  /** How long the stream may stay silent before it is dropped. */
  private final Duration idleTimeout;

  /** The clock. */
  private final Clock clock;

  /** The open stream, null when not streaming. */
  private volatile InputStream current;

  /** When the last record was received. */
  private volatile Instant lastReceived;

  /** Set once the streamer was closed. */
  private volatile boolean closed = false;

  /**
   * Creates a new streamer.
   *
   * @param theHostname        this node's hostname, never null
   * @param theRegistry        the local databases, never null
   * @param theClient          the transport, never null
   * @param theInvalidator     the invalidator, never null
   * @param theSnapshotHandler the snapshot collaborator, may be null
   * @param theFrameStore      the frame store, never null
   * @param theMetrics         the metrics, never null
   * @param theTimer           the scheduler for the idle watchdog, never
   *                           null
   * @param theIdleTimeout     the maximum silence, never null
   * @param theClock           the clock, never null
   */
  public ReplicaStreamer(final String theHostname,
      final DatabaseRegistry theRegistry, final ReplicationClient theClient,
      final Invalidator theInvalidator,
      final SnapshotHandler theSnapshotHandler,
      final FrameStore theFrameStore, final WalshipMetrics theMetrics,
      final ScheduledExecutorService theTimer, final Duration theIdleTimeout,
      final Clock theClock) {
    hostname = Objects.requireNonNull(theHostname,
        "hostname must not be null");
    registry = Objects.requireNonNull(theRegistry,
        "registry must not be null");
    client = Objects.requireNonNull(theClient, "client must not be null");
    invalidator = Objects.requireNonNull(theInvalidator,
        "invalidator must not be null");
    frameStore = Objects.requireNonNull(theFrameStore,
        "frameStore must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
    timer = Objects.requireNonNull(theTimer, "timer must not be null");
    idleTimeout = Objects.requireNonNull(theIdleTimeout,
        "idleTimeout must not be null");
    clock = Objects.requireNonNull(theClock, "clock must not be null");
    snapshotHandler = theSnapshotHandler;
  }

  /**
   * Streams from the primary until the stream ends, fails, or a database
   * was resynced and the stream must be reopened.
   *
   * @param primary     the primary, never null
   * @param onCaughtUp  run once every database reached the position the
   *                    primary reported when the stream opened, never null
   *
   * @throws IOException          if the stream fails
   * @throws NotPrimaryException  if the node is no longer the primary
   */
  public void run(final Node primary, final Runnable onCaughtUp)
      throws IOException {
    Objects.requireNonNull(primary, "primary must not be null");
    Objects.requireNonNull(onCaughtUp, "onCaughtUp must not be null");
    if (closed) {
      return;
    }

    final StreamRequest request = new StreamRequest(hostname,
        registry.positions());
    log.debug("Opening stream from {} at {}", primary.advertiseUrl(),
        request.positions());

    final InputStream in = client.stream(primary, request);
    current = in;
    lastReceived = clock.instant();
    final long checkMillis = Math.max(1, idleTimeout.toMillis() / 2);
    final ScheduledFuture<?> watchdog = timer.scheduleWithFixedDelay(
        this::checkIdle, checkMillis, checkMillis, TimeUnit.MILLISECONDS);

    final FrameApplier applier = new FrameApplier(onCaughtUp);
    try {
      final StreamReader reader = new StreamReader(in);
      while (!closed && reader.next(applier)) {
        lastReceived = clock.instant();
        if (applier.resync != null) {
          resync(primary, applier.resync);
          return;
        }
      }
    } catch (final DesyncException e) {
      log.warn("Replication gap detected: {}", e.getMessage());
      resync(primary, e.database());
    } catch (final IOException e) {
      if (closed) {
        log.debug("Stream closed on shutdown");
        return;
      }
      throw e;
    } finally {
      watchdog.cancel(false);
      current = null;
      closeQuietly(in);
    }
  }

  /** Closes the open stream, if any, and stops streaming for good. */
  public void close() {
    closed = true;
    final InputStream in = current;
    if (in != null) {
      closeQuietly(in);
    }
  }

  private void checkIdle() {
    final InputStream in = current;
    if (in != null && lastReceived.plus(idleTimeout)
        .isBefore(clock.instant())) {
      log.warn("No data received from primary for {}, dropping stream",
          idleTimeout);
      closeQuietly(in);
    }
  }

  /**
   * Replaces the database with a snapshot fetched from the primary.
   *
   * @param primary  the primary, never null
   * @param database the database name, never null
   *
   * @throws IOException if the snapshot cannot be fetched
   */
  void resync(final Node primary, final String database)
      throws IOException {
    if (snapshotHandler == null) {
      throw new WalshipException("Database '" + database
          + "' needs a resync but no snapshot handler is configured");
    }
    log.warn("Resyncing database '{}' from snapshot", database);
    final Snapshot snapshot;
    try (InputStream in = client.snapshot(primary, database)) {
      snapshot = new StreamReader(in).readSnapshot();
    }
    snapshotHandler.restore(database, snapshot.position(), snapshot.image());
    final Database local = registry.getOrCreate(database);
    local.reset(snapshot.position());
    frameStore.reset(database, snapshot.position());
    invalidate(database, snapshot.position());
    metrics.resynced(database);
    log.info("Database '{}' restored at {}", database, snapshot.position());
  }

  private void invalidate(final String database, final Position position) {
    try {
      invalidator.invalidatePosition(database, position);
    } catch (final Exception e) {
      log.warn("Invalidator failed for database '{}' at {}", database,
          position, e);
    }
  }

  private void closeQuietly(final InputStream in) {
    try {
      in.close();
    } catch (final IOException e) {
      log.debug("Error closing replication stream", e);
    }
  }

  /** Applies the records of one stream. */
  private final class FrameApplier implements StreamHandler {

    /** Fired once the handshake targets are reached. */
    private final Runnable onCaughtUp;

    /** The primary's txid per database at connect time. */
    private final Map<String, Long> targets = new HashMap<>();

    /** Whether the handshake targets were reached. */
    private boolean caughtUp = false;

    /** The database to resync before reconnecting, if any. */
    private String resync;

    private FrameApplier(final Runnable theOnCaughtUp) {
      onCaughtUp = theOnCaughtUp;
    }

    @Override
    public void onHandshake(final Map<String, Position> positions) {
      for (final Map.Entry<String, Position> entry : positions.entrySet()) {
        targets.put(entry.getKey(), entry.getValue().txid());
      }
      checkCaughtUp();
    }

    @Override
    public void onFrame(final Frame frame) {
      final Database database = registry.getOrCreate(frame.database());
      if (!database.apply(frame, frameStore::append)) {
        log.debug("Skipping duplicate frame {}", frame);
        return;
      }
      invalidate(frame.database(), frame.position());
      metrics.frameApplied(frame.database(), frame.txid());
      checkCaughtUp();
    }

    @Override
    public void onError(final ErrorCode code, final String database,
        final String message) {
      switch (code) {
        case POSITION_TOO_OLD -> {
          log.warn("Primary cannot resume database '{}': {}", database,
              message);
          resync = database;
        }
        case UNKNOWN_DATABASE -> log.warn("Primary does not know database"
            + " '{}' yet: {}", database, message);
        case NOT_PRIMARY -> throw new NotPrimaryException(message);
        default -> throw new IllegalStateException("Unexpected: " + code);
      }
    }

    private void checkCaughtUp() {
      if (caughtUp) {
        return;
      }
      for (final Map.Entry<String, Long> target : targets.entrySet()) {
        final long local = registry.find(target.getKey())
            .map(db -> db.position().txid()).orElse(0L);
        if (local < target.getValue()) {
          return;
        }
      }
      caughtUp = true;
      onCaughtUp.run();
    }
  }
}
