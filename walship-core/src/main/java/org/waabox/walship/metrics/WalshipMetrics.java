package org.waabox.walship.metrics;

import org.waabox.walship.StoreState;

/**
 * An abstraction for recording operational metrics of a walship store.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer, Prometheus, or Datadog. Use {@link NoopWalshipMetrics}
 * when metrics collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface WalshipMetrics {

  /**
   * Records a role transition.
   *
   * @param state the state the store entered, never null
   */
  void stateChanged(StoreState state);

  /**
   * Records a frame committed on the primary.
   *
   * @param database the database name, never null
   * @param txid     the committed transaction id
   */
  void frameCommitted(String database, long txid);

  /**
   * Records a frame applied on a replica.
   *
   * @param database the database name, never null
   * @param txid     the applied transaction id
   */
  void frameApplied(String database, long txid);

  /**
   * Records a full resynchronization of a database from a snapshot.
   *
   * @param database the database name, never null
   */
  void resynced(String database);

  /**
   * Records frames removed by the retention monitor.
   *
   * @param database the database name, never null
   * @param count    the number of frames removed, greater than zero
   */
  void framesPruned(String database, int count);
}
