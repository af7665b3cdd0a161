package org.waabox.walship.replication;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.waabox.walship.Frame;
import org.waabox.walship.Position;

/**
 * Tests for {@link StreamWriter} and {@link StreamReader}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class StreamCodecTest {

  /** Records every callback as a string. */
  private static final class RecordingHandler implements StreamHandler {

    private final List<String> events = new ArrayList<>();

    private final List<Frame> frames = new ArrayList<>();

    @Override
    public void onHandshake(final Map<String, Position> positions) {
      events.add("handshake " + positions);
    }

    @Override
    public void onFrame(final Frame frame) {
      frames.add(frame);
      events.add("frame " + frame.txid());
    }

    @Override
    public void onError(final ErrorCode code, final String database,
        final String message) {
      events.add("error " + code + " " + database);
    }

    @Override
    public void onHeartbeat() {
      events.add("heartbeat");
    }
  }

  @Test
  void whenReading_givenFullSession_shouldDispatchRecordsInOrder()
      throws IOException {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    final StreamWriter writer = new StreamWriter(out);
    final Map<String, Position> positions = new LinkedHashMap<>();
    positions.put("app.db", new Position(3, 2));
    final Instant committedAt = Instant.parse("2024-01-01T00:00:00.123Z");

    writer.handshake(positions);
    writer.error(ErrorCode.UNKNOWN_DATABASE, "x.db", "unknown");
    writer.frame(new Frame("app.db", new Position(3, 1), committedAt,
        new byte[] {1, 2, 3}));
    writer.heartbeat();
    writer.end();

    final StreamReader reader = new StreamReader(
        new ByteArrayInputStream(out.toByteArray()));
    final RecordingHandler handler = new RecordingHandler();
    while (reader.next(handler)) {
      // drain
    }

    assertEquals(List.of("handshake {app.db=0000000000000003/2}",
        "error UNKNOWN_DATABASE x.db", "frame 1", "heartbeat"),
        handler.events);
    final Frame frame = handler.frames.get(0);
    assertEquals(committedAt, frame.committedAt());
    assertArrayEquals(new byte[] {1, 2, 3}, frame.payload());
  }

  @Test
  void whenReading_givenStreamWithoutEnd_shouldThrowEof() throws IOException {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    new StreamWriter(out).heartbeat();

    final StreamReader reader = new StreamReader(
        new ByteArrayInputStream(out.toByteArray()));
    final RecordingHandler handler = new RecordingHandler();

    assertTrue(reader.next(handler));
    assertThrows(EOFException.class, () -> reader.next(handler));
  }

  @Test
  void whenReading_givenOversizedPayload_shouldThrow() throws IOException {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    final DataOutputStream data = new DataOutputStream(out);
    data.writeByte(StreamWriter.FRAME);
    data.writeUTF("app.db");
    data.writeLong(1);
    data.writeLong(1);
    data.writeLong(0);
    data.writeInt(StreamReader.MAX_PAYLOAD + 1);
    data.flush();

    final StreamReader reader = new StreamReader(
        new ByteArrayInputStream(out.toByteArray()));

    final IOException error = assertThrows(IOException.class,
        () -> reader.next(new RecordingHandler()));
    assertTrue(error.getMessage().contains("payload length"));
  }

  @Test
  void whenReadingSnapshot_givenSnapshotRecord_shouldReturnIt()
      throws IOException {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    new StreamWriter(out).snapshot(new Snapshot("app.db",
        new Position(3, 9), new byte[] {9}));

    final Snapshot snapshot = new StreamReader(
        new ByteArrayInputStream(out.toByteArray())).readSnapshot();

    assertEquals("app.db", snapshot.database());
    assertEquals(new Position(3, 9), snapshot.position());
    assertArrayEquals(new byte[] {9}, snapshot.image());
  }

  @Test
  void whenReadingSnapshot_givenErrorRecord_shouldThrow() throws IOException {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    new StreamWriter(out).error(ErrorCode.NOT_PRIMARY, "app.db", "nope");

    final StreamReader reader = new StreamReader(
        new ByteArrayInputStream(out.toByteArray()));

    final IOException error = assertThrows(IOException.class,
        reader::readSnapshot);
    assertTrue(error.getMessage().contains("NOT_PRIMARY"));
  }

  @Test
  void whenReading_givenEndRecord_shouldReturnFalse() throws IOException {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    new StreamWriter(out).end();

    assertFalse(new StreamReader(new ByteArrayInputStream(out.toByteArray()))
        .next(new RecordingHandler()));
  }
}
