package org.waabox.walship;

/**
 * The role of a {@link Store} in the fleet.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum StoreState {

  /** Opened, still determining its role. */
  INITIALIZING,

  /** Holds the lease and admits commits. */
  PRIMARY,

  /** Applies the frames streamed by the primary. */
  REPLICA,

  /** Cannot reach the lease backend; retrying. */
  DISCONNECTED,

  /** Closed; terminal. */
  CLOSED
}
