package org.waabox.walship;

import java.util.Objects;

/**
 * A member of the replication fleet.
 *
 * @param hostname     the identity of the node, never null
 * @param advertiseUrl the URL where replicas reach this node's replication
 *                     endpoints, never null
 * @param candidate    whether the node may become primary; replica-only
 *                     nodes never attempt to acquire the lease
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Node(String hostname, String advertiseUrl, boolean candidate) {

  /**
   * Validates the record components.
   *
   * @throws NullPointerException     if hostname or advertiseUrl is null
   * @throws IllegalArgumentException if hostname is blank
   */
  public Node {
    Objects.requireNonNull(hostname, "hostname must not be null");
    Objects.requireNonNull(advertiseUrl, "advertiseUrl must not be null");
    if (hostname.isBlank()) {
      throw new IllegalArgumentException("hostname must not be blank");
    }
  }

  /**
   * Returns whether this node and the given one share the same identity.
   *
   * @param other the node to compare with, never null
   * @return true if both nodes have the same hostname
   */
  public boolean sameHost(final Node other) {
    return hostname.equals(other.hostname());
  }
}
