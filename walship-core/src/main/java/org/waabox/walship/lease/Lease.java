package org.waabox.walship.lease;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import org.waabox.walship.Node;

/**
 * The right to act as primary, held by one node for a bounded term.
 *
 * <p>A lease is valid until {@code renewedAt + ttl}. Permanent leases,
 * handed out by the {@link StaticLeaser}, have no TTL and never expire.
 * Instances are immutable; renewal produces a new instance.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Lease {

  /** The node holding the lease. */
  private final Node owner;

  /** The instant the lease was acquired. */
  private final Instant termStart;

  /** The instant of the last successful renewal. */
  private final Instant renewedAt;

  /** The time to live after each renewal, null for permanent leases. */
  private final Duration ttl;

  /** The cooldown enforced after release or expiry. */
  private final Duration lockDelay;

  /** Private constructor; use the static factory methods. */
  private Lease(final Node theOwner, final Instant theTermStart,
      final Instant theRenewedAt, final Duration theTtl,
      final Duration theLockDelay) {
    owner = Objects.requireNonNull(theOwner, "owner must not be null");
    termStart = Objects.requireNonNull(theTermStart,
        "termStart must not be null");
    renewedAt = Objects.requireNonNull(theRenewedAt,
        "renewedAt must not be null");
    lockDelay = Objects.requireNonNull(theLockDelay,
        "lockDelay must not be null");
    ttl = theTtl;
  }

  /**
   * Creates a lease that expires unless renewed within the given TTL.
   *
   * @param owner     the node holding the lease, never null
   * @param termStart the acquisition instant, never null
   * @param ttl       the time to live, must be positive
   * @param lockDelay the cooldown after release or expiry, never null
   *
   * @return a new lease, never null
   *
   * @throws IllegalArgumentException if ttl is zero or negative
   */
  public static Lease of(final Node owner, final Instant termStart,
      final Duration ttl, final Duration lockDelay) {
    Objects.requireNonNull(ttl, "ttl must not be null");
    if (ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be positive, got: " + ttl);
    }
    return new Lease(owner, termStart, termStart, ttl, lockDelay);
  }

  /**
   * Creates a lease without expiry.
   *
   * @param owner     the node holding the lease, never null
   * @param termStart the acquisition instant, never null
   *
   * @return a new permanent lease, never null
   */
  public static Lease permanent(final Node owner, final Instant termStart) {
    return new Lease(owner, termStart, termStart, null, Duration.ZERO);
  }

  /**
   * Returns a copy of this lease renewed at the given instant.
   *
   * @param now the renewal instant, never null
   *
   * @return the renewed lease, never null
   */
  public Lease renewedAt(final Instant now) {
    return new Lease(owner, termStart, now, ttl, lockDelay);
  }

  /**
   * Returns whether the lease has expired at the given instant.
   *
   * @param now the instant to check against, never null
   *
   * @return true if the TTL elapsed since the last renewal
   */
  public boolean isExpired(final Instant now) {
    return expiresAt().map(expiry -> !now.isBefore(expiry)).orElse(false);
  }

  /**
   * Returns the expiry instant.
   *
   * @return the expiry, or empty for a permanent lease
   */
  public Optional<Instant> expiresAt() {
    if (ttl == null) {
      return Optional.empty();
    }
    return Optional.of(renewedAt.plus(ttl));
  }

  /**
   * Returns the node holding the lease.
   *
   * @return the owner, never null
   */
  public Node owner() {
    return owner;
  }

  /**
   * Returns the URL where replicas reach the owner.
   *
   * @return the advertise URL, never null
   */
  public String advertiseUrl() {
    return owner.advertiseUrl();
  }

  /**
   * Returns the instant the lease was acquired.
   *
   * @return the term start, never null
   */
  public Instant termStart() {
    return termStart;
  }

  /**
   * Returns the instant of the last successful renewal.
   *
   * @return the renewal instant, never null
   */
  public Instant renewedAt() {
    return renewedAt;
  }

  /**
   * Returns the time to live.
   *
   * @return the TTL, or empty for a permanent lease
   */
  public Optional<Duration> ttl() {
    return Optional.ofNullable(ttl);
  }

  /**
   * Returns the lock-delay enforced after this lease ends.
   *
   * @return the lock-delay, never null
   */
  public Duration lockDelay() {
    return lockDelay;
  }

  @Override
  public String toString() {
    return "Lease[owner=" + owner.hostname() + ", termStart=" + termStart
        + ", expiresAt=" + expiresAt().map(Instant::toString)
            .orElse("never") + "]";
  }
}
