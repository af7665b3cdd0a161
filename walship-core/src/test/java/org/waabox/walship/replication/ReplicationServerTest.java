package org.waabox.walship.replication;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.junit.jupiter.api.Test;
import org.waabox.walship.Database;
import org.waabox.walship.DatabaseRegistry;
import org.waabox.walship.Frame;
import org.waabox.walship.MutableClock;
import org.waabox.walship.Position;
import org.waabox.walship.metrics.NoopWalshipMetrics;
import org.waabox.walship.retention.RetentionMonitor;
import org.waabox.walship.retention.RetentionPolicy;
import org.waabox.walship.storage.FrameStore;

/**
 * Tests for {@link ReplicationServer}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ReplicationServerTest {

  private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

  private final DatabaseRegistry registry = new DatabaseRegistry();

  private final SessionRegistry sessions = new SessionRegistry();

  private final AtomicBoolean primary = new AtomicBoolean(true);

  private final MutableClock clock = new MutableClock(NOW);

  private ReplicationServer server(final SnapshotHandler handler) {
    return new ReplicationServer(registry, sessions, primary::get, handler,
        Duration.ofMillis(50), clock);
  }

  private Database database(final String name, final int frames) {
    final Database database = registry.getOrCreate(name);
    database.startGeneration(7);
    for (int i = 1; i <= frames; i++) {
      database.append(new byte[] {(byte) i}, NOW, f -> { });
    }
    return database;
  }

  /** Collects records and runs a callback on each of them. */
  private static final class Collector implements StreamHandler {

    private final List<String> events = new ArrayList<>();

    private final Consumer<Collector> onRecord;

    private Map<String, Position> handshake;

    private Collector(final Consumer<Collector> theOnRecord) {
      onRecord = theOnRecord;
    }

    @Override
    public void onHandshake(final Map<String, Position> positions) {
      handshake = positions;
      onRecord.accept(this);
    }

    @Override
    public void onFrame(final Frame frame) {
      events.add(frame.database() + ":" + frame.txid());
      onRecord.accept(this);
    }

    @Override
    public void onError(final ErrorCode code, final String database,
        final String message) {
      events.add(code + ":" + database);
      onRecord.accept(this);
    }
  }

  private void serve(final ReplicationServer server,
      final StreamRequest request, final Collector collector)
      throws Exception {
    final PipedInputStream in = new PipedInputStream(64 * 1024);
    final PipedOutputStream out = new PipedOutputStream(in);
    final Thread thread = new Thread(() -> {
      try (out) {
        server.serve(request, out);
      } catch (final IOException e) {
        throw new IllegalStateException(e);
      }
    });
    thread.start();
    final StreamReader reader = new StreamReader(in);
    while (reader.next(collector)) {
      // drain until the end record
    }
    thread.join(5000);
    assertFalse(thread.isAlive());
  }

  @Test
  void whenServing_givenNotPrimary_shouldRejectWithNotPrimary()
      throws IOException {
    primary.set(false);
    final ByteArrayOutputStream out = new ByteArrayOutputStream();

    server(null).serve(new StreamRequest("b", Map.of()), out);

    final Collector collector = new Collector(c -> { });
    final StreamReader reader = new StreamReader(
        new ByteArrayInputStream(out.toByteArray()));
    assertTrue(reader.next(collector));
    assertFalse(reader.next(collector));
    assertEquals(List.of("NOT_PRIMARY:"), collector.events);
    assertTrue(sessions.sessions().isEmpty());
  }

  @Test
  void whenServing_givenResumePosition_shouldStreamOnlyLaterFrames()
      throws Exception {
    database("app.db", 5);
    final ReplicationServer server = server(null);
    final Collector collector = new Collector(c -> {
      if (c.events.contains("app.db:5")) {
        server.closeSessions(true);
      }
    });

    serve(server, new StreamRequest("b",
        Map.of("app.db", new Position(7, 3))), collector);

    assertEquals(new Position(7, 5), collector.handshake.get("app.db"));
    assertEquals(List.of("app.db:4", "app.db:5"), collector.events);
    assertTrue(sessions.sessions().isEmpty());
  }

  @Test
  void whenServing_givenPrunedPosition_shouldReportTooOldAndStreamOthers()
      throws Exception {
    database("app.db", 5).prune(4);
    database("other.db", 1);
    final ReplicationServer server = server(null);
    final Collector collector = new Collector(c -> {
      if (c.events.contains("other.db:1")) {
        server.closeSessions(true);
      }
    });

    serve(server, new StreamRequest("b",
        Map.of("app.db", Position.ZERO)), collector);

    assertEquals(List.of("POSITION_TOO_OLD:app.db", "other.db:1"),
        collector.events);
  }

  @Test
  void whenDatabaseAppears_givenReplicaWithOtherHistory_shouldReportTooOld()
      throws Exception {
    final ReplicationServer server = server(null);
    final Collector collector = new Collector(c -> {
      if (c.events.equals(List.of("UNKNOWN_DATABASE:app.db"))) {
        database("app.db", 3);
        registry.signalChange();
      }
      if (c.events.contains("POSITION_TOO_OLD:app.db")) {
        server.closeSessions(true);
      }
    });

    serve(server, new StreamRequest("b",
        Map.of("app.db", new Position(77, 5))), collector);

    assertEquals(List.of("UNKNOWN_DATABASE:app.db",
        "POSITION_TOO_OLD:app.db"), collector.events);
  }

  @Test
  void whenDatabaseAppears_givenEmptyReplica_shouldStreamFromFirstFrame()
      throws Exception {
    final ReplicationServer server = server(null);
    final Collector collector = new Collector(c -> {
      if (c.events.equals(List.of("UNKNOWN_DATABASE:app.db"))) {
        database("app.db", 2);
        registry.signalChange();
      }
      if (c.events.contains("app.db:2")) {
        server.closeSessions(true);
      }
    });

    serve(server, new StreamRequest("b",
        Map.of("app.db", Position.ZERO)), collector);

    assertEquals(List.of("UNKNOWN_DATABASE:app.db", "app.db:1", "app.db:2"),
        collector.events);
  }

  @Test
  void whenServing_givenRetentionOfTwoFrames_shouldOnlyResumeRecentPositions()
      throws Exception {
    database("app.db", 5);
    new RetentionMonitor(registry, sessions, FrameStore.NONE,
        RetentionPolicy.create(Duration.ofHours(24), 2,
            Duration.ofMinutes(1)),
        new NoopWalshipMetrics(), clock).sweep();
    final ReplicationServer server = server(null);

    final Collector tooOld = new Collector(c -> server.closeSessions(true));
    serve(server, new StreamRequest("b",
        Map.of("app.db", new Position(7, 1))), tooOld);
    assertEquals(List.of("POSITION_TOO_OLD:app.db"), tooOld.events);

    final Collector recent = new Collector(c -> {
      if (c.events.contains("app.db:5")) {
        server.closeSessions(true);
      }
    });
    serve(server, new StreamRequest("c",
        Map.of("app.db", new Position(7, 4))), recent);
    assertEquals(List.of("app.db:5"), recent.events);
  }

  @Test
  void whenServing_givenUnknownDatabase_shouldStreamItOnceCreated()
      throws Exception {
    final ReplicationServer server = server(null);
    final Collector collector = new Collector(c -> {
      if (c.events.contains("UNKNOWN_DATABASE:new.db")
          && registry.find("new.db").isEmpty()) {
        database("new.db", 2);
        registry.signalChange();
      }
      if (c.events.contains("new.db:2")) {
        server.closeSessions(true);
      }
    });

    serve(server, new StreamRequest("b",
        Map.of("new.db", Position.ZERO)), collector);

    assertEquals(List.of("UNKNOWN_DATABASE:new.db", "new.db:1", "new.db:2"),
        collector.events);
  }

  @Test
  void whenServing_givenSessionDisconnects_shouldRememberItsCursor()
      throws Exception {
    database("app.db", 3);
    final ReplicationServer server = server(null);
    final Collector collector = new Collector(c -> {
      if (c.events.contains("app.db:3")) {
        server.closeSessions(true);
      }
    });

    serve(server, new StreamRequest("b", Map.of()), collector);

    assertEquals(4, sessions.requiredTxid("app.db", NOW,
        Duration.ofMinutes(1)));
  }

  @Test
  void whenSnapshotting_givenHandler_shouldWriteSnapshotRecord()
      throws IOException {
    database("app.db", 2);
    final SnapshotHandler handler = createMock(SnapshotHandler.class);
    expect(handler.capture("app.db")).andReturn(new byte[] {5});
    replay(handler);
    final ByteArrayOutputStream out = new ByteArrayOutputStream();

    server(handler).snapshot("app.db", out);

    final Snapshot snapshot = new StreamReader(
        new ByteArrayInputStream(out.toByteArray())).readSnapshot();
    assertEquals(new Position(7, 2), snapshot.position());
    verify(handler);
  }
}
