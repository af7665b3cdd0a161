package org.waabox.walship.spring;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import org.waabox.walship.ConfigurationException;

/**
 * Configuration properties for walship, mapped from the {@code walship.*}
 * prefix in application.yml or application.properties.
 *
 * <p>Exactly one lease mode must be configured:
 * <ul>
 *   <li>{@code walship.static.*} - a fixed primary, no coordination
 *       backend.</li>
 *   <li>{@code walship.k8s.*} - a Kubernetes Lease, enabled by setting
 *       {@code walship.k8s.lease-name}.</li>
 * </ul>
 *
 * <p>Example:
 * <pre>
 * walship:
 *   data-dir: /var/lib/walship
 *   mount-dir: /mnt/walship
 *   http:
 *     port: 20202
 *   k8s:
 *     lease-name: walship-primary
 *     namespace: prod
 * </pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "walship")
public class WalshipProperties {

  /** The directory holding the durable frame log. */
  private Path dataDir;

  /** The directory applications read the replicated databases from. */
  private Path mountDir;

  /** Whether this node may become primary. */
  private boolean candidate = true;

  /** The retention settings. */
  private final Retention retention = new Retention();

  /** The replication endpoint settings. */
  private final Http http = new Http();

  /** The static lease settings. */
  private final Static staticLease = new Static();

  /** The Kubernetes lease settings. */
  private final K8s k8s = new K8s();

  /**
   * Checks the properties describe a runnable node.
   *
   * @throws ConfigurationException if exactly one lease mode is not
   *                                configured, the directories are missing
   *                                or equal, the renew interval is not
   *                                below the TTL or a retention value is
   *                                not positive
   */
  public void validate() {
    final boolean staticMode = staticLease.isConfigured();
    final boolean k8sMode = k8s.isConfigured();
    if (staticMode == k8sMode) {
      throw new ConfigurationException("Exactly one lease mode must be"
          + " configured (walship.static.* or walship.k8s.*), found "
          + (staticMode ? "both" : "none"));
    }
    if (dataDir == null) {
      throw new ConfigurationException("walship.data-dir is required");
    }
    if (mountDir == null) {
      throw new ConfigurationException("walship.mount-dir is required");
    }
    if (dataDir.toAbsolutePath().normalize().equals(
        mountDir.toAbsolutePath().normalize())) {
      throw new ConfigurationException(
          "walship.data-dir and walship.mount-dir must be different");
    }
    if (staticMode && !staticLease.isLocalPrimary()
        && (isBlank(staticLease.getHostname())
            || isBlank(staticLease.getAdvertiseUrl()))) {
      throw new ConfigurationException("walship.static.hostname and"
          + " walship.static.advertise-url are required on replicas");
    }
    if (staticMode && staticLease.isLocalPrimary() && !candidate) {
      throw new ConfigurationException("walship.static.primary=true needs"
          + " walship.candidate=true, a non candidate never takes the lease");
    }
    if (k8sMode) {
      requirePositive(k8s.getTtl(), "walship.k8s.ttl");
      if (k8s.getLockDelay() == null || k8s.getLockDelay().isNegative()) {
        throw new ConfigurationException(
            "walship.k8s.lock-delay must not be negative");
      }
      if (k8s.getRenewInterval() != null) {
        requirePositive(k8s.getRenewInterval(), "walship.k8s.renew-interval");
        if (k8s.getRenewInterval().compareTo(k8s.getTtl()) >= 0) {
          throw new ConfigurationException("walship.k8s.renew-interval ("
              + k8s.getRenewInterval() + ") must be below walship.k8s.ttl ("
              + k8s.getTtl() + ")");
        }
      }
    }
    requirePositive(retention.getDuration(), "walship.retention.duration");
    requirePositive(retention.getMonitorInterval(),
        "walship.retention.monitor-interval");
    if (retention.getMaxFrames() < 0) {
      throw new ConfigurationException(
          "walship.retention.max-frames must not be negative");
    }
    if (http.getPort() < 0 || http.getPort() > 65535) {
      throw new ConfigurationException("walship.http.port out of range: "
          + http.getPort());
    }
  }

  /**
   * Returns the hostname of this node.
   *
   * <p>A static primary is known by {@code walship.static.hostname}, a
   * Kubernetes node by {@code walship.k8s.hostname}. Falls back to the
   * operating system hostname.
   *
   * @return the hostname, never null
   */
  public String resolveHostname() {
    final String configured;
    if (staticLease.isConfigured()) {
      configured = staticLease.isLocalPrimary()
          ? staticLease.getHostname() : null;
    } else {
      configured = k8s.getHostname();
    }
    if (!isBlank(configured)) {
      return configured;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (final UnknownHostException e) {
      throw new ConfigurationException("Cannot resolve the local hostname,"
          + " set it explicitly: " + e.getMessage());
    }
  }

  /**
   * Returns the URL replicas use to reach this node, defaulting to
   * {@code http://{hostname}:{http.port}}.
   *
   * @param hostname the resolved hostname of this node, never null
   *
   * @return the advertise URL, never null
   */
  public String resolveAdvertiseUrl(final String hostname) {
    final String configured;
    if (staticLease.isConfigured()) {
      configured = staticLease.isLocalPrimary()
          ? staticLease.getAdvertiseUrl() : null;
    } else {
      configured = k8s.getAdvertiseUrl();
    }
    if (!isBlank(configured)) {
      return configured;
    }
    return "http://" + hostname + ":" + http.getPort();
  }

  private static void requirePositive(final Duration value,
      final String name) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new ConfigurationException(name + " must be positive, got: "
          + value);
    }
  }

  private static boolean isBlank(final String value) {
    return value == null || value.isBlank();
  }

  /**
   * Returns the data directory.
   *
   * @return the directory holding the frame log, null if not set
   */
  public Path getDataDir() {
    return dataDir;
  }

  /**
   * Sets the data directory.
   *
   * @param dataDir the directory holding the frame log
   */
  public void setDataDir(final Path dataDir) {
    this.dataDir = dataDir;
  }

  /**
   * Returns the mount directory.
   *
   * @return the directory applications read from, null if not set
   */
  public Path getMountDir() {
    return mountDir;
  }

  /**
   * Sets the mount directory.
   *
   * @param mountDir the directory applications read from
   */
  public void setMountDir(final Path mountDir) {
    this.mountDir = mountDir;
  }

  /**
   * Returns whether this node may become primary.
   *
   * @return true by default
   */
  public boolean isCandidate() {
    return candidate;
  }

  /**
   * Sets whether this node may become primary.
   *
   * @param candidate false for a replica-only node
   */
  public void setCandidate(final boolean candidate) {
    this.candidate = candidate;
  }

  /** @return the retention settings, never null */
  public Retention getRetention() {
    return retention;
  }

  /** @return the replication endpoint settings, never null */
  public Http getHttp() {
    return http;
  }

  /** @return the static lease settings, never null */
  public Static getStatic() {
    return staticLease;
  }

  /** @return the Kubernetes lease settings, never null */
  public K8s getK8s() {
    return k8s;
  }

  /** Settings under {@code walship.retention.*}. */
  public static class Retention {

    /** How long frames stay after they were committed. */
    private Duration duration = Duration.ofHours(24);

    /** The number of frames kept per database, 0 for no cap. */
    private int maxFrames;

    /** How often retention is enforced. */
    private Duration monitorInterval = Duration.ofMinutes(1);

    public Duration getDuration() {
      return duration;
    }

    public void setDuration(final Duration duration) {
      this.duration = duration;
    }

    public int getMaxFrames() {
      return maxFrames;
    }

    public void setMaxFrames(final int maxFrames) {
      this.maxFrames = maxFrames;
    }

    public Duration getMonitorInterval() {
      return monitorInterval;
    }

    public void setMonitorInterval(final Duration monitorInterval) {
      this.monitorInterval = monitorInterval;
    }
  }

  /** Settings under {@code walship.http.*}. */
  public static class Http {

    /** The port of the replication endpoints, 0 for an ephemeral one. */
    private int port = 20202;

    public int getPort() {
      return port;
    }

    public void setPort(final int port) {
      this.port = port;
    }
  }

  /** Settings under {@code walship.static.*}. */
  public static class Static {

    /** Whether this node is the primary, null when not configured. */
    private Boolean primary;

    /** The hostname of the primary. */
    private String hostname;

    /** The advertise URL of the primary. */
    private String advertiseUrl;

    /**
     * Tells whether any static setting was given.
     *
     * @return true if static mode is requested
     */
    boolean isConfigured() {
      return primary != null || hostname != null || advertiseUrl != null;
    }

    /**
     * Returns whether this node is the static primary.
     *
     * @return false when not set
     */
    boolean isLocalPrimary() {
      return Boolean.TRUE.equals(primary);
    }

    public Boolean getPrimary() {
      return primary;
    }

    public void setPrimary(final Boolean primary) {
      this.primary = primary;
    }

    public String getHostname() {
      return hostname;
    }

    public void setHostname(final String hostname) {
      this.hostname = hostname;
    }

    public String getAdvertiseUrl() {
      return advertiseUrl;
    }

    public void setAdvertiseUrl(final String advertiseUrl) {
      this.advertiseUrl = advertiseUrl;
    }
  }

  /** Settings under {@code walship.k8s.*}. */
  public static class K8s {

    /** The name of the Lease resource; enables the Kubernetes mode. */
    private String leaseName;

    /** The namespace of the Lease resource. */
    private String namespace = "default";

    /** The hostname of this node, defaults to the OS hostname. */
    private String hostname;

    /** The advertise URL of this node. */
    private String advertiseUrl;

    /** The lease time to live. */
    private Duration ttl = Duration.ofSeconds(10);

    /** How long a released or expired lease stays unavailable. */
    private Duration lockDelay = Duration.ofSeconds(5);

    /** How often the primary renews, defaults to half the TTL. */
    private Duration renewInterval;

    /**
     * Tells whether the Kubernetes mode is requested.
     *
     * @return true if a lease name was given
     */
    boolean isConfigured() {
      return leaseName != null && !leaseName.isBlank();
    }

    public String getLeaseName() {
      return leaseName;
    }

    public void setLeaseName(final String leaseName) {
      this.leaseName = leaseName;
    }

    public String getNamespace() {
      return namespace;
    }

    public void setNamespace(final String namespace) {
      this.namespace = namespace;
    }

    public String getHostname() {
      return hostname;
    }

    public void setHostname(final String hostname) {
      this.hostname = hostname;
    }

    public String getAdvertiseUrl() {
      return advertiseUrl;
    }

    public void setAdvertiseUrl(final String advertiseUrl) {
      this.advertiseUrl = advertiseUrl;
    }

    public Duration getTtl() {
      return ttl;
    }

    public void setTtl(final Duration ttl) {
      this.ttl = ttl;
    }

    public Duration getLockDelay() {
      return lockDelay;
    }

    public void setLockDelay(final Duration lockDelay) {
      this.lockDelay = lockDelay;
    }

    public Duration getRenewInterval() {
      return renewInterval;
    }

    public void setRenewInterval(final Duration renewInterval) {
      this.renewInterval = renewInterval;
    }
  }
}
