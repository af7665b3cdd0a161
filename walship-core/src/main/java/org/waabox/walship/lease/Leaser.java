package org.waabox.walship.lease;

import org.waabox.walship.Node;

/**
 * A strategy for acquiring, renewing and releasing the primary lease
 * against some coordination backend.
 *
 * <p>The election algorithm in {@link org.waabox.walship.Store} only
 * reasons about acquisition, renewal failure and lock-delay; it never
 * branches on the concrete backend. Implementations are selected once at
 * startup (e.g. Kubernetes Lease API, static configuration).
 *
 * <p>Lock-delay, where the backend supports contention, is enforced by the
 * implementation itself: a lease that was just released or expired cannot
 * be acquired again before the delay elapsed.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface Leaser {

  /**
   * Establishes connectivity with the backend.
   *
   * @throws LeaseConnectionException if the backend is unreachable
   */
  void open();

  /**
   * Releases the resources held by this leaser. Does not release the
   * lease itself.
   */
  void close();

  /**
   * Returns whether this node holds a valid lease, according to the last
   * interaction with the backend.
   *
   * @return true if this node is the primary
   */
  boolean isPrimary();

  /**
   * Returns the node currently holding the lease.
   *
   * @return the primary, never null
   *
   * @throws NoPrimaryException       if no node holds a valid lease
   * @throws LeaseConnectionException if the backend is unreachable
   */
  Node primary();

  /**
   * Attempts to make the given node the primary.
   *
   * @param candidate the node asking for the lease, never null
   *
   * @return the acquired lease, never null
   *
   * @throws LeaseHeldException       if another node holds a valid lease or
   *                                  the lock-delay has not elapsed
   * @throws LeaseConnectionException if the backend is unreachable
   */
  Lease acquire(Node candidate);

  /**
   * Extends the TTL of a held lease.
   *
   * @param lease the lease to renew, never null
   *
   * @return the renewed lease, never null
   *
   * @throws LeaseLostException       if the backend reports the lease is no
   *                                  longer held by its owner
   * @throws LeaseConnectionException if the backend is unreachable
   */
  Lease renew(Lease lease);

  /**
   * Voluntarily relinquishes a held lease. Best effort: failures are
   * logged and never propagated.
   *
   * @param lease the lease to release, never null
   */
  void release(Lease lease);
}
