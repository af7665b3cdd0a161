package org.waabox.walship.leader.k8s;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.waabox.walship.Node;
import org.waabox.walship.lease.Lease;
import org.waabox.walship.lease.LeaseConnectionException;
import org.waabox.walship.lease.LeaseHeldException;
import org.waabox.walship.lease.LeaseLostException;
import org.waabox.walship.lease.Leaser;
import org.waabox.walship.lease.NoPrimaryException;

import io.kubernetes.client.extended.leaderelection.LeaderElectionRecord;
import io.kubernetes.client.extended.leaderelection.Lock;
import io.kubernetes.client.extended.leaderelection.resourcelock.LeaseLock;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.util.Config;

/**
 * Leaser backed by the Kubernetes Lease coordination API.
 *
 * <p>The lease record is read and written through the client's
 * {@link LeaseLock}, which applies optimistic concurrency on the resource
 * version: when two nodes race for the record only one update wins. The
 * holder identity stores the owning node as a JSON document carrying its
 * hostname and advertise URL, so replicas can find the primary by reading
 * the record alone.
 *
 * <p>A lease that was released stays unavailable until
 * {@code renewTime + lockDelay}. A lease that expired stays unavailable
 * until {@code renewTime + ttl + lockDelay}.
 *
 * <p>Usage:
 * <pre>{@code
 * K8sLeaseConfig config = K8sLeaseConfig.create(
 *     "walship-primary", "pod-a", "http://pod-a:20202");
 * Leaser leaser = new K8sLeaser(config);
 * Store store = Store.builder().leaser(leaser)...build();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class K8sLeaser implements Leaser {

  /** The logger for this class. */
  private static final Logger log = LoggerFactory.getLogger(K8sLeaser.class);

  /** Shared ObjectMapper for the holder identity documents. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** The HTTP status the API server answers for a missing Lease. */
  private static final int NOT_FOUND = 404;

  /** The configuration for the Kubernetes lease. */
  private final K8sLeaseConfig config;

  /** The clock used to stamp and expire leases. */
  private final Clock clock;

  /** The lock over the Lease resource, created on open when not given. */
  private volatile Lock lock;

  /** The lease this node holds, null when it holds none. */
  private volatile Lease current;

  /**
   * Creates a new leaser talking to the cluster the process runs in.
   *
   * @param theConfig the Kubernetes lease configuration, never null
   */
  public K8sLeaser(final K8sLeaseConfig theConfig) {
    this(theConfig, null, Clock.systemUTC());
  }

  /**
   * Creates a new leaser over the given lock.
   *
   * @param theConfig the Kubernetes lease configuration, never null
   * @param theLock   the lock over the Lease resource, null to create a
   *                  {@link LeaseLock} on open
   * @param theClock  the clock, never null
   */
  K8sLeaser(final K8sLeaseConfig theConfig, final Lock theLock,
      final Clock theClock) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    clock = Objects.requireNonNull(theClock, "clock must not be null");
    lock = theLock;
  }

  /**
   * Creates the API client, when needed, and reads the Lease once to
   * check the API server is reachable.
   *
   * @throws LeaseConnectionException if the client cannot be created or
   *                                  the API server cannot be reached
   */
  @Override
  public void open() {
    if (lock == null) {
      try {
        final ApiClient apiClient = Config.defaultClient();
        lock = new LeaseLock(config.namespace(), config.leaseName(),
            config.hostname(), apiClient);
      } catch (final IOException e) {
        throw new LeaseConnectionException(
            "Failed to create the Kubernetes client", e);
      }
    }
    read();
    log.info("Using Kubernetes lease '{}' in namespace '{}' as '{}'"
        + " (ttl={}, lock-delay={})", config.leaseName(),
        config.namespace(), config.hostname(), config.ttl(),
        config.lockDelay());
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    current = null;
  }

  /**
   * Returns whether this node holds a lease that did not expire yet.
   *
   * @return true if the last acquire or renew succeeded within the TTL
   */
  @Override
  public boolean isPrimary() {
    final Lease lease = current;
    return lease != null && !lease.isExpired(clock.instant());
  }

  /** {@inheritDoc} */
  @Override
  public Node primary() {
    final LeaderElectionRecord record = read();
    if (record == null || !isHeld(record)
        || isExpired(record, clock.instant())) {
      throw new NoPrimaryException();
    }
    return holder(record);
  }

  /** {@inheritDoc} */
  @Override
  public Lease acquire(final Node candidate) {
    Objects.requireNonNull(candidate, "candidate must not be null");
    final Instant now = clock.instant();
    final LeaderElectionRecord record = read();

    if (record == null) {
      if (!requiredLock().create(newRecord(candidate, now, now, 0))) {
        throw new LeaseHeldException("Lease '" + config.leaseName()
            + "' was created concurrently by another node");
      }
      return held(candidate, now);
    }

    // An expired lease waits out the lock-delay even for its last holder.
    final boolean ours = isHeld(record)
        && holder(record).sameHost(candidate)
        && !isExpired(record, now);
    if (!ours) {
      final Instant availableAt = availableAt(record);
      if (now.isBefore(availableAt)) {
        throw new LeaseHeldException("Lease '" + config.leaseName()
            + "' is unavailable until " + availableAt
            + (isHeld(record) ? ", held by '" + holder(record).hostname()
                + "'" : ", lock-delay after release"));
      }
    }

    final int transitions = ours ? transitions(record)
        : transitions(record) + 1;
    if (!requiredLock().update(newRecord(candidate, now, now,
        transitions))) {
      throw new LeaseHeldException("Lease '" + config.leaseName()
          + "' was updated concurrently by another node");
    }
    return held(candidate, now);
  }

  /** {@inheritDoc} */
  @Override
  public Lease renew(final Lease lease) {
    Objects.requireNonNull(lease, "lease must not be null");
    final Instant now = clock.instant();
    final LeaderElectionRecord record = read();

    if (record == null || !isHeld(record)
        || !holder(record).sameHost(lease.owner())) {
      current = null;
      throw new LeaseLostException("Lease '" + config.leaseName()
          + "' is no longer held by '" + lease.owner().hostname() + "'");
    }
    if (isExpired(record, now)) {
      current = null;
      throw new LeaseLostException("Lease '" + config.leaseName()
          + "' expired before renewal");
    }

    final Date acquired = record.getAcquireTime() != null
        ? record.getAcquireTime() : Date.from(lease.termStart());
    final LeaderElectionRecord renewed = new LeaderElectionRecord(
        record.getHolderIdentity(), ttlSeconds(), acquired, Date.from(now),
        transitions(record));
    if (!requiredLock().update(renewed)) {
      current = null;
      throw new LeaseLostException("Lease '" + config.leaseName()
          + "' renewal was rejected");
    }
    final Lease result = lease.renewedAt(now);
    current = result;
    return result;
  }

  /**
   * Writes an empty holder on the Lease, starting the lock-delay.
   *
   * <p>Failures are logged and never propagated; the lease then expires
   * on its own.
   */
  @Override
  public void release(final Lease lease) {
    Objects.requireNonNull(lease, "lease must not be null");
    current = null;
    try {
      final LeaderElectionRecord record = read();
      if (record == null || !isHeld(record)
          || !holder(record).sameHost(lease.owner())) {
        log.debug("Lease '{}' not held by '{}', nothing to release",
            config.leaseName(), lease.owner().hostname());
        return;
      }
      final LeaderElectionRecord released = new LeaderElectionRecord("",
          ttlSeconds(), record.getAcquireTime(),
          Date.from(clock.instant()), transitions(record));
      if (requiredLock().update(released)) {
        log.info("Released lease '{}'", config.leaseName());
      } else {
        log.warn("Lease '{}' release was rejected, it will expire",
            config.leaseName());
      }
    } catch (final RuntimeException e) {
      log.warn("Failed to release lease '{}', it will expire",
          config.leaseName(), e);
    }
  }

  /**
   * Reads the lease record.
   *
   * @return the record, null if the Lease does not exist
   *
   * @throws LeaseConnectionException if the API server cannot be reached
   */
  private LeaderElectionRecord read() {
    try {
      return requiredLock().get();
    } catch (final ApiException e) {
      if (e.getCode() == NOT_FOUND) {
        return null;
      }
      throw new LeaseConnectionException("Failed to read lease '"
          + config.leaseName() + "' (code " + e.getCode() + ")", e);
    }
  }

  private Lock requiredLock() {
    final Lock theLock = lock;
    if (theLock == null) {
      throw new IllegalStateException("Leaser is not open");
    }
    return theLock;
  }

  private Lease held(final Node owner, final Instant now) {
    final Lease lease = Lease.of(owner, now, config.ttl(),
        config.lockDelay());
    current = lease;
    log.info("Acquired lease '{}' for '{}'", config.leaseName(),
        owner.hostname());
    return lease;
  }

  private LeaderElectionRecord newRecord(final Node owner,
      final Instant acquired, final Instant renewed, final int transitions) {
    return new LeaderElectionRecord(identity(owner), ttlSeconds(),
        Date.from(acquired), Date.from(renewed), transitions);
  }

  private Instant availableAt(final LeaderElectionRecord record) {
    final Instant renewed = renewTime(record);
    if (!isHeld(record)) {
      return renewed.plus(config.lockDelay());
    }
    return renewed.plus(recordTtl(record)).plus(config.lockDelay());
  }

  private boolean isExpired(final LeaderElectionRecord record,
      final Instant now) {
    return !now.isBefore(renewTime(record).plus(recordTtl(record)));
  }

  private Duration recordTtl(final LeaderElectionRecord record) {
    final int seconds = record.getLeaseDurationSeconds();
    return seconds > 0 ? Duration.ofSeconds(seconds) : config.ttl();
  }

  private int ttlSeconds() {
    return (int) config.ttl().toSeconds();
  }

  private static Instant renewTime(final LeaderElectionRecord record) {
    final Date renewed = record.getRenewTime();
    return renewed == null ? Instant.EPOCH : renewed.toInstant();
  }

  private static int transitions(final LeaderElectionRecord record) {
    return record.getLeaderTransitions();
  }

  private static boolean isHeld(final LeaderElectionRecord record) {
    final String identity = record.getHolderIdentity();
    return identity != null && !identity.isEmpty();
  }

  /**
   * Serializes a node into the holder identity document.
   *
   * @param node the node, never null
   *
   * @return the JSON document, never null
   */
  static String identity(final Node node) {
    final ObjectNode json = MAPPER.createObjectNode();
    json.put("hostname", node.hostname());
    json.put("advertiseUrl", node.advertiseUrl());
    return json.toString();
  }

  /**
   * Parses the holder identity of a record.
   *
   * <p>Holders that were not written by this class, like a plain pod name
   * left by another elector, are returned as a node without advertise
   * URL.
   *
   * @param record the record, holding a non empty identity
   *
   * @return the holder, never null
   */
  static Node holder(final LeaderElectionRecord record) {
    final String identity = record.getHolderIdentity();
    try {
      final JsonNode json = MAPPER.readTree(identity);
      final JsonNode hostname = json.get("hostname");
      final JsonNode advertiseUrl = json.get("advertiseUrl");
      if (hostname != null && advertiseUrl != null) {
        return new Node(hostname.asText(), advertiseUrl.asText(), true);
      }
    } catch (final IOException e) {
      log.debug("Lease holder '{}' is not a JSON identity", identity);
    }
    return new Node(identity, "", true);
  }
}
