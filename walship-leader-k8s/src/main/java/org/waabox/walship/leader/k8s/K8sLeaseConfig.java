package org.waabox.walship.leader.k8s;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for the Kubernetes Lease backed {@link K8sLeaser}.
 *
 * <p>Holds the coordinates of the Lease resource, the identity this node
 * advertises while holding it, and the timing of the lease. Instances are
 * created via static factory methods and are immutable.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class K8sLeaseConfig {

  /** The default Kubernetes namespace. */
  private static final String DEFAULT_NAMESPACE = "default";

  /** The default lease time to live (10 seconds). */
  private static final Duration DEFAULT_TTL = Duration.ofSeconds(10);

  /** The default lock-delay (5 seconds). */
  private static final Duration DEFAULT_LOCK_DELAY = Duration.ofSeconds(5);

  /** The name of the Lease resource in Kubernetes. */
  private final String leaseName;

  /** The Kubernetes namespace where the Lease resource lives. */
  private final String namespace;

  /** The hostname of this node, typically the pod name. */
  private final String hostname;

  /** The URL replicas use to reach this node while it is primary. */
  private final String advertiseUrl;

  /** How long the lease is valid after each renewal. */
  private final Duration ttl;

  /** How long a released or expired lease stays unavailable. */
  private final Duration lockDelay;

  /** Private constructor; use static factory methods. */
  private K8sLeaseConfig(final String theLeaseName,
      final String theNamespace,
      final String theHostname,
      final String theAdvertiseUrl,
      final Duration theTtl,
      final Duration theLockDelay) {
    leaseName = Objects.requireNonNull(theLeaseName,
        "leaseName must not be null");
    namespace = Objects.requireNonNull(theNamespace,
        "namespace must not be null");
    hostname = Objects.requireNonNull(theHostname,
        "hostname must not be null");
    advertiseUrl = Objects.requireNonNull(theAdvertiseUrl,
        "advertiseUrl must not be null");
    ttl = Objects.requireNonNull(theTtl, "ttl must not be null");
    lockDelay = Objects.requireNonNull(theLockDelay,
        "lockDelay must not be null");
    if (ttl.compareTo(Duration.ofSeconds(1)) < 0) {
      throw new IllegalArgumentException(
          "ttl must be at least one second, got: " + ttl);
    }
    if (lockDelay.isNegative()) {
      throw new IllegalArgumentException(
          "lockDelay must not be negative, got: " + lockDelay);
    }
  }

  /**
   * Creates a new configuration with all parameters specified.
   *
   * @param theLeaseName    the name of the Lease resource, never null
   * @param theNamespace    the Kubernetes namespace, never null
   * @param theHostname     the hostname of this node, never null
   * @param theAdvertiseUrl the advertise URL of this node, never null
   * @param theTtl          the lease time to live, at least one second
   * @param theLockDelay    the lock-delay, never negative
   *
   * @return a new {@link K8sLeaseConfig}, never null
   */
  public static K8sLeaseConfig create(final String theLeaseName,
      final String theNamespace,
      final String theHostname,
      final String theAdvertiseUrl,
      final Duration theTtl,
      final Duration theLockDelay) {
    return new K8sLeaseConfig(theLeaseName, theNamespace, theHostname,
        theAdvertiseUrl, theTtl, theLockDelay);
  }

  /**
   * Creates a new configuration with the default namespace, TTL and
   * lock-delay.
   *
   * <p>Defaults:
   * <ul>
   *   <li>namespace: "default"</li>
   *   <li>ttl: 10 seconds</li>
   *   <li>lockDelay: 5 seconds</li>
   * </ul>
   *
   * @param theLeaseName    the name of the Lease resource, never null
   * @param theHostname     the hostname of this node, never null
   * @param theAdvertiseUrl the advertise URL of this node, never null
   *
   * @return a new {@link K8sLeaseConfig} with default values, never null
   */
  public static K8sLeaseConfig create(final String theLeaseName,
      final String theHostname, final String theAdvertiseUrl) {
    return new K8sLeaseConfig(theLeaseName, DEFAULT_NAMESPACE, theHostname,
        theAdvertiseUrl, DEFAULT_TTL, DEFAULT_LOCK_DELAY);
  }

  /**
   * Returns the name of the Lease resource.
   *
   * @return the lease name, never null
   */
  public String leaseName() {
    return leaseName;
  }

  /**
   * Returns the Kubernetes namespace.
   *
   * @return the namespace, never null
   */
  public String namespace() {
    return namespace;
  }

  /**
   * Returns the hostname of this node.
   *
   * @return the hostname, never null
   */
  public String hostname() {
    return hostname;
  }

  /**
   * Returns the advertise URL of this node.
   *
   * @return the advertise URL, never null
   */
  public String advertiseUrl() {
    return advertiseUrl;
  }

  /**
   * Returns the lease time to live.
   *
   * @return the TTL, never null
   */
  public Duration ttl() {
    return ttl;
  }

  /**
   * Returns the lock-delay.
   *
   * @return the lock-delay, never null
   */
  public Duration lockDelay() {
    return lockDelay;
  }
}
