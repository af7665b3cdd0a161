package org.waabox.walship.replication;

import java.util.Map;
import java.util.Objects;

import org.waabox.walship.Position;

/**
 * What a replica asks for when it opens a replication stream.
 *
 * @param node      the requesting node's hostname, never null
 * @param positions the last applied position per database, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record StreamRequest(String node, Map<String, Position> positions) {

  /**
   * Validates the record components and copies the positions.
   *
   * @throws NullPointerException if any component is null
   */
  public StreamRequest {
    Objects.requireNonNull(node, "node must not be null");
    Objects.requireNonNull(positions, "positions must not be null");
    positions = Map.copyOf(positions);
  }
}
