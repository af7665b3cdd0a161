package org.waabox.walship.replication;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.waabox.walship.Frame;
import org.waabox.walship.Position;

/**
 * Reads the records written by {@link StreamWriter}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StreamReader {

  /** The largest payload or image accepted, 64MB. */
  static final int MAX_PAYLOAD = 64 * 1024 * 1024;

  /** The underlying stream. */
  private final DataInputStream in;

  /**
   * Creates a new reader.
   *
   * @param input the stream to read from, never null
   */
  public StreamReader(final InputStream input) {
    Objects.requireNonNull(input, "input must not be null");
    in = new DataInputStream(new BufferedInputStream(input));
  }

  /**
   * Reads the next record and dispatches it to the handler.
   *
   * @param handler receives the record, never null
   *
   * @return false once the end of stream record was read, true otherwise
   *
   * @throws EOFException if the stream ends without an end record
   * @throws IOException  if the stream fails or is malformed
   */
  public boolean next(final StreamHandler handler) throws IOException {
    final int type = in.read();
    switch (type) {
      case -1 -> throw new EOFException("Stream closed without end record");
      case StreamWriter.HANDSHAKE -> handler.onHandshake(readPositions());
      case StreamWriter.FRAME -> handler.onFrame(readFrame());
      case StreamWriter.ERROR -> {
        final ErrorCode code = ErrorCode.fromCode(in.readUnsignedByte());
        final String database = in.readUTF();
        handler.onError(code, database, in.readUTF());
      }
      case StreamWriter.HEARTBEAT -> handler.onHeartbeat();
      case StreamWriter.END -> {
        return false;
      }
      default -> throw new IOException("Unknown record type: " + type);
    }
    return true;
  }

  /**
   * Reads a snapshot record.
   *
   * @return the snapshot, never null
   *
   * @throws IOException if the stream fails or holds another record
   */
  public Snapshot readSnapshot() throws IOException {
    final int type = in.read();
    if (type == StreamWriter.ERROR) {
      final ErrorCode code = ErrorCode.fromCode(in.readUnsignedByte());
      final String database = in.readUTF();
      throw new IOException(code + " for '" + database + "': "
          + in.readUTF());
    }
    if (type != StreamWriter.SNAPSHOT) {
      throw new IOException("Expected a snapshot record, got: " + type);
    }
    final String database = in.readUTF();
    final Position position = readPosition();
    return new Snapshot(database, position, readBytes());
  }

  private Map<String, Position> readPositions() throws IOException {
    final int count = in.readInt();
    if (count < 0) {
      throw new IOException("Invalid handshake size: " + count);
    }
    final Map<String, Position> positions = new LinkedHashMap<>();
    for (int i = 0; i < count; i++) {
      positions.put(in.readUTF(), readPosition());
    }
    return positions;
  }

  private Frame readFrame() throws IOException {
    final String database = in.readUTF();
    final Position position = readPosition();
    final Instant committedAt = Instant.ofEpochMilli(in.readLong());
    return new Frame(database, position, committedAt, readBytes());
  }

  private Position readPosition() throws IOException {
    final long generation = in.readLong();
    final long txid = in.readLong();
    if (txid < 0) {
      throw new IOException("Invalid txid: " + txid);
    }
    return new Position(generation, txid);
  }

  private byte[] readBytes() throws IOException {
    final int length = in.readInt();
    if (length < 0 || length > MAX_PAYLOAD) {
      throw new IOException("Invalid payload length: " + length);
    }
    final byte[] bytes = new byte[length];
    in.readFully(bytes);
    return bytes;
  }
}
