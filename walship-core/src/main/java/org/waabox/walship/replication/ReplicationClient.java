package org.waabox.walship.replication;

import java.io.IOException;
import java.io.InputStream;

import org.waabox.walship.Node;

/**
 * Opens byte streams to a primary. Implemented by a transport, e.g. HTTP.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ReplicationClient {

  /**
   * Opens a replication stream.
   *
   * @param primary the primary to connect to, never null
   * @param request the request to send, never null
   *
   * @return the stream of records written by {@link StreamWriter}, never
   *         null; closing it ends the session
   *
   * @throws IOException if the primary cannot be reached
   */
  InputStream stream(Node primary, StreamRequest request) throws IOException;

  /**
   * Fetches a snapshot record of the database.
   *
   * @param primary  the primary to connect to, never null
   * @param database the database name, never null
   *
   * @return a stream holding a single snapshot or error record, never null
   *
   * @throws IOException if the primary cannot be reached
   */
  InputStream snapshot(Node primary, String database) throws IOException;
}
