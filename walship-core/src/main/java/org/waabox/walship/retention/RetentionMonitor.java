package org.waabox.walship.retention;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.walship.Database;
import org.waabox.walship.DatabaseRegistry;
import org.waabox.walship.metrics.WalshipMetrics;
import org.waabox.walship.replication.SessionRegistry;
import org.waabox.walship.storage.FrameStore;

/**
 * Periodically prunes the frames the {@link RetentionPolicy} no longer
 * wants and no replica still needs.
 *
 * <p>Each sweep holds the session registry lock, so no session can
 * register with a resume position that is being pruned. Sweeps are best
 * effort: a failure is logged and the next sweep tries again.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RetentionMonitor {

  private static final Logger log =
      LoggerFactory.getLogger(RetentionMonitor.class);

  /** The databases to prune. */
  private final DatabaseRegistry registry;

  /** The sessions whose positions are protected. */
  private final SessionRegistry sessions;

  /** The durable frame storage. */
  private final FrameStore frameStore;

  /** The retention policy. */
  private final RetentionPolicy policy;

  /** Operational metrics. */
  private final WalshipMetrics metrics;

  /** The clock. */
  private final Clock clock;

  /** The scheduled sweep, null when stopped. */
  private ScheduledFuture<?> task;

  /**
   * Creates a new monitor.
   *
   * @param theRegistry   the databases, never null
   * @param theSessions   the sessions, never null
   * @param theFrameStore the frame store, never null
   * @param thePolicy     the retention policy, never null
   * @param theMetrics    the metrics, never null
   * @param theClock      the clock, never null
   */
  public RetentionMonitor(final DatabaseRegistry theRegistry,
      final SessionRegistry theSessions, final FrameStore theFrameStore,
      final RetentionPolicy thePolicy, final WalshipMetrics theMetrics,
      final Clock theClock) {
    registry = Objects.requireNonNull(theRegistry,
        "registry must not be null");
    sessions = Objects.requireNonNull(theSessions,
        "sessions must not be null");
    frameStore = Objects.requireNonNull(theFrameStore,
        "frameStore must not be null");
    policy = Objects.requireNonNull(thePolicy, "policy must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
    clock = Objects.requireNonNull(theClock, "clock must not be null");
  }

  /**
   * Schedules the sweep at the policy's monitor interval.
   *
   * @param scheduler the scheduler to run sweeps on, never null
   */
  public synchronized void start(final ScheduledExecutorService scheduler) {
    Objects.requireNonNull(scheduler, "scheduler must not be null");
    if (task != null) {
      return;
    }
    final long interval = policy.monitorInterval().toMillis();
    task = scheduler.scheduleWithFixedDelay(() -> {
      try {
        sweep();
      } catch (final Exception e) {
        log.warn("Retention sweep failed", e);
      }
    }, interval, interval, TimeUnit.MILLISECONDS);
    log.info("Retention monitor started with {}", policy);
  }

  /** Cancels the scheduled sweep. */
  public synchronized void stop() {
    if (task != null) {
      task.cancel(false);
      task = null;
    }
  }

  /**
   * Prunes every database once.
   *
   * @return the total number of frames pruned
   */
  public int sweep() {
    return sessions.withLock(() -> {
      final Instant now = clock.instant();
      sessions.expireDisconnected(now, policy.duration());
      int total = 0;
      for (final Database database : registry.databases()) {
        total += prune(database, now);
      }
      return total;
    });
  }

  private int prune(final Database database, final Instant now) {
    final long cutoff = database.retentionCutoff(policy, now);
    final long required = sessions.requiredTxid(database.name(), now,
        policy.duration());
    final int removed = database.prune(Math.min(cutoff, required));
    if (removed == 0) {
      return 0;
    }
    try {
      frameStore.prune(database.name(), database.retainedFrom());
    } catch (final RuntimeException e) {
      log.warn("Could not prune stored frames of database '{}'",
          database.name(), e);
    }
    metrics.framesPruned(database.name(), removed);
    log.debug("Pruned {} frames of database '{}', retained from txid {}",
        removed, database.name(), database.retainedFrom());
    return removed;
  }
}
