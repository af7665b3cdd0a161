package org.waabox.walship.replication;

import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Map;
import java.util.Objects;

import org.waabox.walship.Frame;
import org.waabox.walship.Position;

/**
 * Writes replication stream records.
 *
 * <p>Every record starts with a one byte type. Strings are written as
 * modified UTF-8, positions as two longs and payloads as a length
 * prefixed byte array. Each record is flushed as soon as it is written.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StreamWriter {

  /** Record type: the primary's positions at connect time. */
  static final int HANDSHAKE = 1;

  /** Record type: a committed frame. */
  static final int FRAME = 2;

  /** Record type: an error. */
  static final int ERROR = 3;

  /** Record type: keep-alive. */
  static final int HEARTBEAT = 4;

  /** Record type: graceful end of stream. */
  static final int END = 5;

  /** Record type: a full database image. */
  static final int SNAPSHOT = 6;

  /** The underlying stream. */
  private final DataOutputStream out;

  /**
   * Creates a new writer.
   *
   * @param output the stream to write to, never null
   */
  public StreamWriter(final OutputStream output) {
    Objects.requireNonNull(output, "output must not be null");
    out = new DataOutputStream(new BufferedOutputStream(output));
  }

  /**
   * Writes the handshake record.
   *
   * @param positions the position per database, never null
   * @throws IOException if the stream fails
   */
  public void handshake(final Map<String, Position> positions)
      throws IOException {
    out.writeByte(HANDSHAKE);
    out.writeInt(positions.size());
    for (final Map.Entry<String, Position> entry : positions.entrySet()) {
      out.writeUTF(entry.getKey());
      writePosition(entry.getValue());
    }
    out.flush();
  }

  /**
   * Writes a frame record.
   *
   * @param frame the frame, never null
   * @throws IOException if the stream fails
   */
  public void frame(final Frame frame) throws IOException {
    out.writeByte(FRAME);
    out.writeUTF(frame.database());
    writePosition(frame.position());
    out.writeLong(frame.committedAt().toEpochMilli());
    writeBytes(frame.payload());
    out.flush();
  }

  /**
   * Writes an error record.
   *
   * @param code     the error, never null
   * @param database the database, or an empty string
   * @param message  the detail message, never null
   * @throws IOException if the stream fails
   */
  public void error(final ErrorCode code, final String database,
      final String message) throws IOException {
    out.writeByte(ERROR);
    out.writeByte(code.code());
    out.writeUTF(database);
    out.writeUTF(message);
    out.flush();
  }

  /**
   * Writes a heartbeat record.
   *
   * @throws IOException if the stream fails
   */
  public void heartbeat() throws IOException {
    out.writeByte(HEARTBEAT);
    out.flush();
  }

  /**
   * Writes the end of stream record.
   *
   * @throws IOException if the stream fails
   */
  public void end() throws IOException {
    out.writeByte(END);
    out.flush();
  }

  /**
   * Writes a snapshot record.
   *
   * @param snapshot the snapshot, never null
   * @throws IOException if the stream fails
   */
  public void snapshot(final Snapshot snapshot) throws IOException {
    out.writeByte(SNAPSHOT);
    out.writeUTF(snapshot.database());
    writePosition(snapshot.position());
    writeBytes(snapshot.image());
    out.flush();
  }

  private void writePosition(final Position position) throws IOException {
    out.writeLong(position.generation());
    out.writeLong(position.txid());
  }

  private void writeBytes(final byte[] bytes) throws IOException {
    out.writeInt(bytes.length);
    out.write(bytes);
  }
}
