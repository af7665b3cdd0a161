package org.waabox.walship.lease;

import java.time.Clock;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.walship.Node;

/**
 * A leaser for statically configured fleets.
 *
 * <p>There is no contention and no backend round-trip: one node is
 * configured as the permanent primary and every other node is a permanent
 * replica pointed at the primary's advertise URL. The hostname and
 * advertise URL given to this class always describe the primary, also on
 * replica nodes. Lock-delay does not apply.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StaticLeaser implements Leaser {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(StaticLeaser.class);

  /** Whether the local node is the configured primary. */
  private final boolean primary;

  /** The configured primary node. */
  private final Node primaryNode;

  /** The clock used to stamp acquired leases. */
  private final Clock clock;

  /**
   * Creates a new static leaser.
   *
   * @param isPrimary    whether the local node is the primary
   * @param hostname     the hostname of the primary, never null
   * @param advertiseUrl the advertise URL of the primary, never null
   */
  public StaticLeaser(final boolean isPrimary, final String hostname,
      final String advertiseUrl) {
    this(isPrimary, hostname, advertiseUrl, Clock.systemUTC());
  }

  /**
   * Creates a new static leaser with the given clock.
   *
   * @param isPrimary    whether the local node is the primary
   * @param hostname     the hostname of the primary, never null
   * @param advertiseUrl the advertise URL of the primary, never null
   * @param theClock     the clock used to stamp leases, never null
   */
  public StaticLeaser(final boolean isPrimary, final String hostname,
      final String advertiseUrl, final Clock theClock) {
    primary = isPrimary;
    primaryNode = new Node(hostname, advertiseUrl, true);
    clock = Objects.requireNonNull(theClock, "clock must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public void open() {
    log.info("Using static primary: is-primary={} hostname={}"
        + " advertise-url={}", primary, primaryNode.hostname(),
        primaryNode.advertiseUrl());
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    // Nothing to release without a backend.
  }

  /**
   * Returns whether the local node is the configured primary.
   *
   * @return the configured flag
   */
  @Override
  public boolean isPrimary() {
    return primary;
  }

  /**
   * Returns the configured primary.
   *
   * @return the primary node, never null
   */
  @Override
  public Node primary() {
    return primaryNode;
  }

  /**
   * Hands out a permanent lease on the configured primary.
   *
   * @throws LeaseHeldException if the local node is a configured replica
   */
  @Override
  public Lease acquire(final Node candidate) {
    Objects.requireNonNull(candidate, "candidate must not be null");
    if (!primary) {
      throw new LeaseHeldException("Static primary is '"
          + primaryNode.hostname() + "'");
    }
    return Lease.permanent(candidate, clock.instant());
  }

  /**
   * Returns the given lease unchanged; static leases never expire.
   */
  @Override
  public Lease renew(final Lease lease) {
    Objects.requireNonNull(lease, "lease must not be null");
    return lease;
  }

  /** {@inheritDoc} */
  @Override
  public void release(final Lease lease) {
    Objects.requireNonNull(lease, "lease must not be null");
  }
}
