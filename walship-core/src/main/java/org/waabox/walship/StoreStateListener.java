package org.waabox.walship;

/**
 * A listener notified when the role of a {@link Store} changes.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface StoreStateListener {

  /**
   * Called after the store entered a new state.
   *
   * @param state   the new state, never null
   * @param primary the known primary, null unless the state is
   *                {@link StoreState#PRIMARY} or {@link StoreState#REPLICA}
   */
  void onStateChange(StoreState state, Node primary);
}
