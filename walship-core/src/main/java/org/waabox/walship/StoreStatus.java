package org.waabox.walship;

import java.util.Map;

/**
 * A point in time view of a {@link Store}, for diagnostics.
 *
 * @param hostname  this node's hostname
 * @param state     the current state
 * @param primary   the primary's hostname, null when unknown
 * @param ready     whether the ready signal fired
 * @param sessions  the number of connected replicas
 * @param positions the position of every database
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record StoreStatus(String hostname, StoreState state, String primary,
    boolean ready, int sessions, Map<String, Position> positions) {
}
