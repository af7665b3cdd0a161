package org.waabox.walship.replication;

import java.util.Map;

import org.waabox.walship.Frame;
import org.waabox.walship.Position;

/**
 * Receives the records read from a replication stream, see
 * {@link StreamReader#next(StreamHandler)}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface StreamHandler {

  /**
   * Called once, first, with the primary's positions at connect time.
   *
   * @param positions the position per database, never null
   */
  void onHandshake(Map<String, Position> positions);

  /**
   * Called for every frame, in txid order per database.
   *
   * @param frame the frame, never null
   */
  void onFrame(Frame frame);

  /**
   * Called when the primary reports an error for a database or for the
   * whole stream.
   *
   * @param code     the error, never null
   * @param database the database, empty when it concerns the stream
   * @param message  the detail message, never null
   */
  void onError(ErrorCode code, String database, String message);

  /** Called when the primary has nothing to send. */
  default void onHeartbeat() {
  }
}
