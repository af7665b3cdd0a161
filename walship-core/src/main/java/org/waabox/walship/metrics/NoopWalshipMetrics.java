package org.waabox.walship.metrics;

import org.waabox.walship.StoreState;

/**
 * A no-operation implementation of {@link WalshipMetrics}.
 *
 * <p>All methods in this class are intentionally empty. Use this
 * implementation when metrics collection is not required or during
 * testing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopWalshipMetrics implements WalshipMetrics {

  /** {@inheritDoc} */
  @Override
  public void stateChanged(final StoreState state) {
  }

  /** {@inheritDoc} */
  @Override
  public void frameCommitted(final String database, final long txid) {
  }

  /** {@inheritDoc} */
  @Override
  public void frameApplied(final String database, final long txid) {
  }

  /** {@inheritDoc} */
  @Override
  public void resynced(final String database) {
  }

  /** {@inheritDoc} */
  @Override
  public void framesPruned(final String database, final int count) {
  }
}
