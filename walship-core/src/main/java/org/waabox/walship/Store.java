package org.waabox.walship;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.walship.lease.Lease;
import org.waabox.walship.lease.LeaseConnectionException;
import org.waabox.walship.lease.LeaseHeldException;
import org.waabox.walship.lease.LeaseLostException;
import org.waabox.walship.lease.Leaser;
import org.waabox.walship.lease.NoPrimaryException;
import org.waabox.walship.metrics.NoopWalshipMetrics;
import org.waabox.walship.metrics.WalshipMetrics;
import org.waabox.walship.replication.ReplicaStreamer;
import org.waabox.walship.replication.ReplicationClient;
import org.waabox.walship.replication.ReplicationServer;
import org.waabox.walship.replication.SessionRegistry;
import org.waabox.walship.replication.SnapshotHandler;
import org.waabox.walship.retention.RetentionMonitor;
import org.waabox.walship.retention.RetentionPolicy;
import org.waabox.walship.storage.FrameStore;

/**
 * The entry point of walship: elects this node as primary or follows the
 * current primary, and keeps the local databases replicated.
 *
 * <p>A dedicated monitor thread drives the election. A candidate tries to
 * acquire the lease; on success it becomes {@link StoreState#PRIMARY},
 * starts a new generation for every database and renews the lease until
 * it is lost. Otherwise the node asks the {@link Leaser} for the current
 * primary and becomes a {@link StoreState#REPLICA} streaming from it.
 * Coordination failures move the store to
 * {@link StoreState#DISCONNECTED} and are retried with backoff; they are
 * never fatal.
 *
 * <p>Commits are only admitted while this node holds an unexpired lease.
 * They hold the read side of a role lock, and demotion takes the write
 * side, so no commit can complete after the node stepped down.
 *
 * <p>Usage:
 * <pre>{@code
 * Store store = Store.builder()
 *     .node(new Node("a", "http://a:20202", true))
 *     .leaser(leaser)
 *     .client(client)
 *     .build();
 * store.open();
 * store.ready().await();
 * Position position = store.commit("app.db", payload);
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Store {

  private static final Logger log = LoggerFactory.getLogger(Store.class);

  /** How long {@link #close()} waits for the monitor thread. */
  private static final Duration JOIN_TIMEOUT = Duration.ofSeconds(10);

  /** This node. */
  private final Node node;

  /** The lease backend. */
  private final Leaser leaser;

  /** Durable frame storage. */
  private final FrameStore frameStore;

  /** The retention policy. */
  private final RetentionPolicy retentionPolicy;

  /** The backoff applied to failed election rounds. */
  private final RetryPolicy retryPolicy;

  /** The interval between lease renewals. */
  private final Duration renewInterval;

  /** Operational metrics. */
  private final WalshipMetrics metrics;

  /** The clock. */
  private final Clock clock;

  /** The local databases. */
  private final DatabaseRegistry registry = new DatabaseRegistry();

  /** The replication sessions served by this node. */
  private final SessionRegistry sessions = new SessionRegistry();

  /** The producing side of replication. */
  private final ReplicationServer server;

  /** The consuming side of replication. */
  private final ReplicaStreamer streamer;

  /** The retention monitor. */
  private final RetentionMonitor retention;

  /** Runs retention sweeps and the stream watchdog. */
  private final ScheduledExecutorService scheduler;

  /** Fires once the node can serve reads. */
  private final ReadySignal ready = new ReadySignal();

  /** Commits hold the read lock, role changes the write lock. */
  private final ReentrantReadWriteLock roleLock =
      new ReentrantReadWriteLock();

  /** Released on close to interrupt backoff and renewal sleeps. */
  private final CountDownLatch closeLatch = new CountDownLatch(1);

  /** The state listeners. */
  private final List<StoreStateListener> listeners =
      new CopyOnWriteArrayList<>();

  /** The current state. */
  private volatile StoreState state = StoreState.INITIALIZING;

  /** The current primary, null when unknown. */
  private volatile Node primary;

  /** The lease held by this node, null when not primary. */
  private volatile Lease lease;

  /** Set once close started. */
  private volatile boolean closed = false;

  /** The election thread, null until opened. */
  private Thread monitor;

  private Store(final Builder builder) {
    node = builder.node;
    leaser = builder.leaser;
    frameStore = builder.frameStore;
    retentionPolicy = builder.retentionPolicy;
    retryPolicy = builder.retryPolicy;
    renewInterval = builder.renewInterval;
    metrics = builder.metrics;
    clock = builder.clock;

    scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      final Thread thread = new Thread(r, "walship-timer");
      thread.setDaemon(true);
      return thread;
    });
    server = new ReplicationServer(registry, sessions, this::isPrimary,
        builder.snapshotHandler, builder.heartbeatInterval, clock);
    streamer = new ReplicaStreamer(node.hostname(), registry, builder.client,
        builder.invalidator, builder.snapshotHandler, frameStore, metrics,
        scheduler, builder.heartbeatInterval.multipliedBy(3), clock);
    retention = new RetentionMonitor(registry, sessions, frameStore,
        retentionPolicy, metrics, clock);
  }

  /**
   * Creates a new builder.
   *
   * @return the builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Loads the stored frames and starts the election and retention
   * threads. Returns immediately; use {@link #ready()} to wait until the
   * node can serve reads.
   *
   * @throws IllegalStateException if the store was already opened
   * @throws WalshipException      if the stored frames cannot be loaded
   */
  public synchronized void open() {
    if (monitor != null || closed) {
      throw new IllegalStateException("Store already opened");
    }
    for (final String name : frameStore.databases()) {
      final Database database = registry.getOrCreate(name);
      database.recover(frameStore.base(name), frameStore.load(name));
      log.info("Recovered database '{}' at {}", name, database.position());
    }
    retention.start(scheduler);
    monitor = new Thread(this::monitorLoop, "walship-monitor");
    monitor.setDaemon(true);
    monitor.start();
    log.info("Store opened on {} (candidate={})", node.hostname(),
        node.candidate());
  }

  /**
   * Commits a payload to the database, creating the database if needed.
   *
   * @param database the database name, never null
   * @param payload  the opaque bytes to replicate, never null
   *
   * @return the position of the committed frame, never null
   *
   * @throws NotPrimaryException if this node does not hold a valid lease
   * @throws WalshipException    if the frame cannot be stored
   */
  public Position commit(final String database, final byte[] payload) {
    Objects.requireNonNull(database, "database must not be null");
    Objects.requireNonNull(payload, "payload must not be null");
    roleLock.readLock().lock();
    try {
      final Lease current = lease;
      if (state != StoreState.PRIMARY || current == null) {
        throw new NotPrimaryException("Node '" + node.hostname()
            + "' is not the primary, current state is " + state);
      }
      if (current.isExpired(clock.instant())) {
        throw new NotPrimaryException("Lease of node '" + node.hostname()
            + "' expired at " + current.expiresAt().orElse(null));
      }
      final Database target = registry.getOrCreate(database,
          this::newPrimaryDatabase);
      final Frame frame = target.append(payload, clock.instant(),
          frameStore::append);
      registry.signalChange();
      metrics.frameCommitted(database, frame.txid());
      return frame.position();
    } finally {
      roleLock.readLock().unlock();
    }
  }

  /**
   * Stops replication, releases a held lease and closes the leaser.
   * Calling it again has no effect.
   */
  public void close() {
    synchronized (this) {
      if (closed) {
        return;
      }
      closed = true;
    }
    log.info("Closing store on {}", node.hostname());
    closeLatch.countDown();
    retention.stop();
    streamer.close();
    server.closeSessions(true);

    final Thread thread = monitor;
    if (thread != null) {
      try {
        thread.join(JOIN_TIMEOUT.toMillis());
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }

    final Lease held = lease;
    lease = null;
    if (held != null) {
      try {
        leaser.release(held);
        log.info("Released lease of {}", node.hostname());
      } catch (final RuntimeException e) {
        log.warn("Could not release lease, it will expire", e);
      }
    }
    roleLock.writeLock().lock();
    try {
      changeState(StoreState.CLOSED, null);
    } finally {
      roleLock.writeLock().unlock();
    }
    try {
      leaser.close();
    } catch (final RuntimeException e) {
      log.warn("Error closing leaser", e);
    }
    scheduler.shutdownNow();
  }

  /**
   * Returns the current state.
   *
   * @return the state, never null
   */
  public StoreState state() {
    return state;
  }

  /**
   * Tells whether this node currently is the primary. A closing store is
   * never primary.
   *
   * @return true when primary
   */
  public boolean isPrimary() {
    return !closed && state == StoreState.PRIMARY;
  }

  /**
   * Returns the current primary.
   *
   * @return the primary, or empty while unknown
   */
  public Optional<Node> primaryNode() {
    return Optional.ofNullable(primary);
  }

  /**
   * Returns the lease held by this node.
   *
   * @return the lease, or empty when not primary
   */
  public Optional<Lease> lease() {
    return Optional.ofNullable(lease);
  }

  /**
   * Returns this node.
   *
   * @return the node, never null
   */
  public Node node() {
    return node;
  }

  /**
   * Returns the signal fired once this node is primary, or a replica that
   * caught up with the primary's position at connect time.
   *
   * @return the ready signal, never null
   */
  public ReadySignal ready() {
    return ready;
  }

  /**
   * Returns the position of a database.
   *
   * @param database the database name, never null
   * @return the position, or empty if the database does not exist
   */
  public Optional<Position> position(final String database) {
    return registry.find(database).map(Database::position);
  }

  /**
   * Returns the local databases.
   *
   * @return the databases, never null
   */
  public Collection<Database> databases() {
    return registry.databases();
  }

  /**
   * Returns the producing side of replication, for transports to serve.
   *
   * @return the server, never null
   */
  public ReplicationServer replicationServer() {
    return server;
  }

  /**
   * Returns the retention monitor.
   *
   * @return the monitor, never null
   */
  public RetentionMonitor retentionMonitor() {
    return retention;
  }

  /**
   * Registers a listener notified on every state change.
   *
   * @param listener the listener, never null
   */
  public void onStateChange(final StoreStateListener listener) {
    Objects.requireNonNull(listener, "listener must not be null");
    listeners.add(listener);
  }

  /**
   * Returns a diagnostic view of this store.
   *
   * @return the status, never null
   */
  public StoreStatus status() {
    final Node current = primary;
    final Map<String, Position> positions = registry.positions();
    return new StoreStatus(node.hostname(), state,
        current == null ? null : current.hostname(), ready.isReady(),
        server.sessionCount(), positions);
  }

  private void monitorLoop() {
    int failures = 0;
    boolean leaserOpen = false;
    while (!closed) {
      try {
        if (!leaserOpen) {
          leaser.open();
          leaserOpen = true;
        }
        if (node.candidate()) {
          final Lease acquired = tryAcquire();
          if (acquired != null) {
            failures = 0;
            runAsPrimary(acquired);
            continue;
          }
        }
        final Node current = leaser.primary();
        if (current.sameHost(node)) {
          throw new NoPrimaryException();
        }
        runAsReplica(current);
        failures = 0;
      } catch (final NoPrimaryException e) {
        failures++;
        log.info("No primary available, retrying");
        changeState(StoreState.INITIALIZING, null);
        sleep(retryPolicy.backoff(failures));
      } catch (final LeaseConnectionException e) {
        failures++;
        log.warn("Lost connection to lease backend: {}", e.getMessage());
        changeState(StoreState.DISCONNECTED, null);
        sleep(retryPolicy.backoff(failures));
      } catch (final NotPrimaryException e) {
        failures++;
        log.info("Primary stepped down: {}", e.getMessage());
        sleep(retryPolicy.backoff(failures));
      } catch (final IOException e) {
        failures++;
        if (!closed) {
          log.warn("Replication stream failed: {}", e.getMessage());
          sleep(retryPolicy.backoff(failures));
        }
      } catch (final RuntimeException e) {
        failures++;
        if (!closed) {
          log.error("Unexpected error in election loop", e);
          sleep(retryPolicy.backoff(failures));
        }
      }
    }
    log.debug("Election loop stopped");
  }

  private Lease tryAcquire() {
    try {
      return leaser.acquire(node);
    } catch (final LeaseHeldException e) {
      log.debug("Lease held elsewhere: {}", e.getMessage());
      return null;
    }
  }

  private void runAsPrimary(final Lease acquired) {
    roleLock.writeLock().lock();
    try {
      if (closed) {
        lease = acquired;
        return;
      }
      for (final Database database : registry.databases()) {
        database.startGeneration(newGeneration());
      }
      lease = acquired;
      changeState(StoreState.PRIMARY, node);
    } finally {
      roleLock.writeLock().unlock();
    }
    log.info("Node {} became primary, {}", node.hostname(), acquired);
    ready.fire();

    final Duration interval = renewInterval(acquired);
    while (!closed) {
      if (sleep(interval)) {
        return;
      }
      final Lease current = lease;
      if (current == null) {
        return;
      }
      try {
        lease = leaser.renew(current);
      } catch (final LeaseLostException e) {
        log.warn("Lease lost: {}", e.getMessage());
        demote();
        return;
      } catch (final LeaseConnectionException e) {
        if (current.isExpired(clock.instant())) {
          log.warn("Lease expired while the backend was unreachable");
          demote();
          return;
        }
        log.debug("Lease renewal failed, retrying: {}", e.getMessage());
      }
    }
  }

  /**
   * Returns how often the lease is renewed. A configured interval that
   * would let the lease expire between renewals is replaced by half the
   * TTL.
   */
  private Duration renewInterval(final Lease acquired) {
    final Duration half = acquired.ttl().map(ttl -> ttl.dividedBy(2))
        .orElse(Duration.ofSeconds(1));
    if (renewInterval == null) {
      return half;
    }
    if (acquired.ttl().isPresent()
        && renewInterval.compareTo(acquired.ttl().get()) >= 0) {
      log.warn("Renew interval {} is not lower than the lease TTL {},"
          + " renewing every {}", renewInterval, acquired.ttl().get(), half);
      return half;
    }
    return renewInterval;
  }

  private void demote() {
    lease = null;
    roleLock.writeLock().lock();
    try {
      changeState(StoreState.INITIALIZING, null);
    } finally {
      roleLock.writeLock().unlock();
    }
    server.closeSessions(false);
    log.info("Node {} stepped down", node.hostname());
  }

  private void runAsReplica(final Node current) throws IOException {
    primary = current;
    if (state != StoreState.REPLICA) {
      log.info("Node {} following primary {} at {}", node.hostname(),
          current.hostname(), current.advertiseUrl());
    }
    changeState(StoreState.REPLICA, current);
    streamer.run(current, () -> {
      if (ready.fire()) {
        log.info("Replica {} caught up with primary {}", node.hostname(),
            current.hostname());
      }
    });
  }

  private Database newPrimaryDatabase(final String name) {
    final Database database = new Database(name);
    database.startGeneration(newGeneration());
    log.info("Created database '{}'", name);
    return database;
  }

  private static long newGeneration() {
    long generation = 0;
    while (generation == 0) {
      generation = ThreadLocalRandom.current().nextLong();
    }
    return generation;
  }

  private void changeState(final StoreState newState, final Node newPrimary) {
    final StoreState previous = state;
    final Node previousPrimary = primary;
    state = newState;
    primary = newPrimary;
    if (previous == newState && Objects.equals(previousPrimary, newPrimary)) {
      return;
    }
    log.debug("State {} -> {}", previous, newState);
    metrics.stateChanged(newState);
    for (final StoreStateListener listener : listeners) {
      try {
        listener.onStateChange(newState, newPrimary);
      } catch (final Exception e) {
        log.error("Error notifying state listener: {}", e.getMessage(), e);
      }
    }
  }

  /**
   * Sleeps for the given duration unless the store is closed.
   *
   * @return true if the store was closed
   */
  private boolean sleep(final Duration duration) {
    try {
      return closeLatch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return true;
    }
  }

  /** Builder for {@link Store}. */
  public static final class Builder {

    /** This node, required. */
    private Node node;

    /** The lease backend, required. */
    private Leaser leaser;

    /** The transport, required. */
    private ReplicationClient client;

    /** The invalidator. */
    private Invalidator invalidator = Invalidator.NONE;

    /** The snapshot collaborator, optional. */
    private SnapshotHandler snapshotHandler;

    /** The frame store. */
    private FrameStore frameStore = FrameStore.NONE;

    /** The retention policy. */
    private RetentionPolicy retentionPolicy = RetentionPolicy.defaultPolicy();

    /** The election backoff. */
    private RetryPolicy retryPolicy = RetryPolicy.defaultPolicy();

    /** The renewal interval, defaults to half the lease TTL. */
    private Duration renewInterval;

    /** The idle heartbeat interval of served streams. */
    private Duration heartbeatInterval = Duration.ofSeconds(1);

    /** The metrics. */
    private WalshipMetrics metrics = new NoopWalshipMetrics();

    /** The clock. */
    private Clock clock = Clock.systemUTC();

    private Builder() {
    }

    /**
     * Sets this node.
     *
     * @param theNode the node, never null
     * @return this builder, never null
     */
    public Builder node(final Node theNode) {
      node = Objects.requireNonNull(theNode, "node must not be null");
      return this;
    }

    /**
     * Sets the lease backend.
     *
     * @param theLeaser the leaser, never null
     * @return this builder, never null
     */
    public Builder leaser(final Leaser theLeaser) {
      leaser = Objects.requireNonNull(theLeaser, "leaser must not be null");
      return this;
    }

    /**
     * Sets the transport replicas use to reach the primary.
     *
     * @param theClient the client, never null
     * @return this builder, never null
     */
    public Builder client(final ReplicationClient theClient) {
      client = Objects.requireNonNull(theClient, "client must not be null");
      return this;
    }

    /**
     * Sets the invalidator notified after every applied frame.
     *
     * <p>If not set, nothing is notified.
     *
     * @param theInvalidator the invalidator, never null
     * @return this builder, never null
     */
    public Builder invalidator(final Invalidator theInvalidator) {
      invalidator = Objects.requireNonNull(theInvalidator,
          "invalidator must not be null");
      return this;
    }

    /**
     * Sets the snapshot collaborator used for resyncs.
     *
     * <p>If not set, a replica that falls out of the retained window keeps
     * retrying instead of resyncing.
     *
     * @param theSnapshotHandler the handler, never null
     * @return this builder, never null
     */
    public Builder snapshotHandler(final SnapshotHandler theSnapshotHandler) {
      snapshotHandler = Objects.requireNonNull(theSnapshotHandler,
          "snapshotHandler must not be null");
      return this;
    }

    /**
     * Sets the durable frame store.
     *
     * <p>If not set, frames are kept in memory only.
     *
     * @param theFrameStore the frame store, never null
     * @return this builder, never null
     */
    public Builder frameStore(final FrameStore theFrameStore) {
      frameStore = Objects.requireNonNull(theFrameStore,
          "frameStore must not be null");
      return this;
    }

    /**
     * Sets the retention policy.
     *
     * @param thePolicy the policy, never null
     * @return this builder, never null
     */
    public Builder retentionPolicy(final RetentionPolicy thePolicy) {
      retentionPolicy = Objects.requireNonNull(thePolicy,
          "retentionPolicy must not be null");
      return this;
    }

    /**
     * Sets the backoff of failed election rounds.
     *
     * @param thePolicy the policy, never null
     * @return this builder, never null
     */
    public Builder retryPolicy(final RetryPolicy thePolicy) {
      retryPolicy = Objects.requireNonNull(thePolicy,
          "retryPolicy must not be null");
      return this;
    }

    /**
     * Sets the lease renewal interval. Must be lower than the lease TTL.
     *
     * <p>If not set, or if it is not lower than the TTL of the acquired
     * lease, half that TTL is used, or one second for leases without TTL.
     *
     * @param theInterval the interval, never null
     * @return this builder, never null
     */
    public Builder renewInterval(final Duration theInterval) {
      Objects.requireNonNull(theInterval, "renewInterval must not be null");
      if (theInterval.isZero() || theInterval.isNegative()) {
        throw new IllegalArgumentException(
            "renewInterval must be positive, got: " + theInterval);
      }
      renewInterval = theInterval;
      return this;
    }

    /**
     * Sets the heartbeat interval of served streams. Replicas drop a
     * stream silent for three times this interval.
     *
     * @param theInterval the interval, never null
     * @return this builder, never null
     */
    public Builder heartbeatInterval(final Duration theInterval) {
      Objects.requireNonNull(theInterval,
          "heartbeatInterval must not be null");
      if (theInterval.isZero() || theInterval.isNegative()) {
        throw new IllegalArgumentException(
            "heartbeatInterval must be positive, got: " + theInterval);
      }
      heartbeatInterval = theInterval;
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * @param theMetrics the metrics, never null
     * @return this builder, never null
     */
    public Builder metrics(final WalshipMetrics theMetrics) {
      metrics = Objects.requireNonNull(theMetrics,
          "metrics must not be null");
      return this;
    }

    /**
     * Sets the clock.
     *
     * @param theClock the clock, never null
     * @return this builder, never null
     */
    public Builder clock(final Clock theClock) {
      clock = Objects.requireNonNull(theClock, "clock must not be null");
      return this;
    }

    /**
     * Builds the store.
     *
     * @return a new, unopened store, never null
     *
     * @throws NullPointerException if the node, leaser or client is unset
     */
    public Store build() {
      Objects.requireNonNull(node, "node must be set");
      Objects.requireNonNull(leaser, "leaser must be set");
      Objects.requireNonNull(client, "client must be set");
      return new Store(this);
    }
  }
}
