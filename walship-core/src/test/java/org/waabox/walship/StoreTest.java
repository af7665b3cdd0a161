package org.waabox.walship;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.waabox.walship.lease.InMemoryLeaser;
import org.waabox.walship.lease.Leaser;
import org.waabox.walship.lease.StaticLeaser;
import org.waabox.walship.replication.LocalReplicationClient;
import org.waabox.walship.replication.ReplicationClient;
import org.waabox.walship.replication.SnapshotHandler;
import org.waabox.walship.replication.StreamRequest;
import org.waabox.walship.replication.StreamWriter;
import org.waabox.walship.retention.RetentionPolicy;
import org.waabox.walship.storage.InMemoryFrameStore;

/**
 * Tests for {@link Store}, running several stores connected through an
 * in-process transport.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class StoreTest {

  private static final Node A = new Node("a", "local://a", true);

  private static final Node B = new Node("b", "local://b", true);

  private static final Duration TIMEOUT = Duration.ofSeconds(10);

  private final LocalReplicationClient client = new LocalReplicationClient();

  private final List<Store> stores = new ArrayList<>();

  @AfterEach
  void tearDown() {
    stores.forEach(Store::close);
  }

  private Store.Builder builder(final Node node, final Leaser leaser) {
    return Store.builder()
        .node(node)
        .leaser(leaser)
        .client(client)
        .retryPolicy(RetryPolicy.of(Duration.ofMillis(20),
            Duration.ofMillis(200)))
        .heartbeatInterval(Duration.ofMillis(50))
        .renewInterval(Duration.ofMillis(100));
  }

  private Store start(final Store.Builder builder) {
    final Store store = builder.build();
    client.register(store.node().advertiseUrl(), store.replicationServer());
    stores.add(store);
    store.open();
    return store;
  }

  private static StaticLeaser staticLeaser(final boolean primary) {
    return new StaticLeaser(primary, A.hostname(), A.advertiseUrl());
  }

  private static byte[] bytes(final String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }

  private static void waitUntil(final BooleanSupplier condition)
      throws InterruptedException {
    final long deadline = System.nanoTime() + TIMEOUT.toNanos();
    while (!condition.getAsBoolean() && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }
    assertTrue(condition.getAsBoolean(), "condition not met in " + TIMEOUT);
  }

  private static long txid(final Store store, final String database) {
    return store.position(database).map(Position::txid).orElse(0L);
  }

  /** A primary side handler whose image is the database name. */
  private static SnapshotHandler imagesOf() {
    return new SnapshotHandler() {
      @Override
      public byte[] capture(final String database) {
        return bytes("image-of-" + database);
      }

      @Override
      public void restore(final String database, final Position position,
          final byte[] image) {
        throw new UnsupportedOperationException();
      }
    };
  }

  /** A replica side handler recording what it restored. */
  private static SnapshotHandler restoringInto(final List<Position> restored,
      final List<byte[]> images) {
    return new SnapshotHandler() {
      @Override
      public byte[] capture(final String database) {
        throw new UnsupportedOperationException();
      }

      @Override
      public void restore(final String database, final Position position,
          final byte[] image) {
        restored.add(position);
        images.add(image);
      }
    };
  }

  @Test
  void whenCommitting_givenStaticPrimary_shouldAssignGapFreePositions()
      throws Exception {
    final Store primary = start(builder(A, staticLeaser(true)));
    assertTrue(primary.ready().await(TIMEOUT));

    final Position first = primary.commit("app.db", bytes("one"));
    final Position second = primary.commit("app.db", bytes("two"));

    assertEquals(StoreState.PRIMARY, primary.state());
    assertEquals(1, first.txid());
    assertEquals(2, second.txid());
    assertEquals(first.generation(), second.generation());
    assertNotEquals(0, first.generation());
  }

  @Test
  void whenCommitting_givenReplica_shouldThrowNotPrimary() throws Exception {
    start(builder(A, staticLeaser(true)));
    final Store replica = start(builder(B, staticLeaser(false)));
    assertTrue(replica.ready().await(TIMEOUT));

    assertEquals(StoreState.REPLICA, replica.state());
    assertEquals("a", replica.primaryNode().orElseThrow().hostname());
    assertThrows(NotPrimaryException.class,
        () -> replica.commit("app.db", bytes("nope")));
  }

  @Test
  void whenReplicating_givenFiveCommits_shouldInvalidateEachFrameOnce()
      throws Exception {
    final List<Position> invalidated =
        Collections.synchronizedList(new ArrayList<>());
    final Store primary = start(builder(A, staticLeaser(true)));
    assertTrue(primary.ready().await(TIMEOUT));
    final Store replica = start(builder(B, staticLeaser(false))
        .invalidator((database, position) -> invalidated.add(position)));
    assertTrue(replica.ready().await(TIMEOUT));

    for (int i = 1; i <= 5; i++) {
      primary.commit("app.db", bytes("frame-" + i));
    }

    waitUntil(() -> invalidated.size() >= 5);
    Thread.sleep(200);
    assertEquals(5, invalidated.size());
    for (int i = 0; i < 5; i++) {
      assertEquals(i + 1, invalidated.get(i).txid());
    }
    assertEquals(primary.position("app.db"), replica.position("app.db"));
  }

  @Test
  void whenOpening_givenPrimaryWithHistory_shouldBeReadyOnlyAfterCatchUp()
      throws Exception {
    final Store primary = start(builder(A, staticLeaser(true)));
    assertTrue(primary.ready().await(TIMEOUT));
    for (int i = 1; i <= 3; i++) {
      primary.commit("app.db", bytes("frame-" + i));
    }

    final Store replica = start(builder(B, staticLeaser(false)));

    assertTrue(replica.ready().await(TIMEOUT));
    assertEquals(3, txid(replica, "app.db"));
  }

  @Test
  void whenLeaseIsLost_givenPrimary_shouldRejectCommits() throws Exception {
    final InMemoryLeaser.Backend backend = new InMemoryLeaser.Backend(
        Clock.systemUTC(), Duration.ofSeconds(5));
    final Store primary = start(builder(A, new InMemoryLeaser(backend)));
    assertTrue(primary.ready().await(TIMEOUT));
    primary.commit("app.db", bytes("one"));

    backend.steal(new Node("z", "local://z", true));

    waitUntil(() -> !primary.isPrimary());
    assertTrue(primary.lease().isEmpty());
    assertThrows(NotPrimaryException.class,
        () -> primary.commit("app.db", bytes("two")));
  }

  @Test
  void whenBackendIsUnreachable_givenPrimary_shouldDemoteOnceLeaseExpires()
      throws Exception {
    final InMemoryLeaser.Backend backend = new InMemoryLeaser.Backend(
        Clock.systemUTC(), Duration.ofMillis(500));
    final Store primary = start(builder(A, new InMemoryLeaser(backend)));
    assertTrue(primary.ready().await(TIMEOUT));

    backend.reachable(false);

    waitUntil(() -> primary.state() == StoreState.DISCONNECTED);
    assertThrows(NotPrimaryException.class,
        () -> primary.commit("app.db", bytes("late")));
  }

  @Test
  void whenPrimaryCloses_givenCandidateReplica_shouldTakeOver()
      throws Exception {
    final InMemoryLeaser.Backend backend = new InMemoryLeaser.Backend(
        Clock.systemUTC(), Duration.ofSeconds(1));
    final Store first = start(builder(A, new InMemoryLeaser(backend)));
    assertTrue(first.ready().await(TIMEOUT));
    final Store second = start(builder(B, new InMemoryLeaser(backend)));
    waitUntil(() -> second.state() == StoreState.REPLICA);

    for (int i = 1; i <= 3; i++) {
      first.commit("app.db", bytes("frame-" + i));
    }
    waitUntil(() -> txid(second, "app.db") == 3);
    final long oldGeneration = first.position("app.db").orElseThrow()
        .generation();

    first.close();
    client.unregister(A.advertiseUrl());

    waitUntil(second::isPrimary);
    final Position next = second.commit("app.db", bytes("frame-4"));

    assertEquals(4, next.txid());
    assertNotEquals(oldGeneration, next.generation());
    assertEquals("b", backend.holder().hostname());
    assertEquals(StoreState.CLOSED, first.state());
  }

  @Test
  void whenReplicaFallsOutOfRetention_givenSnapshotHandler_shouldResync()
      throws Exception {
    final List<Position> restored =
        Collections.synchronizedList(new ArrayList<>());
    final List<byte[]> images = Collections.synchronizedList(
        new ArrayList<>());
    final SnapshotHandler replicaImages = restoringInto(restored, images);

    final Store primary = start(builder(A, staticLeaser(true))
        .snapshotHandler(imagesOf())
        .retentionPolicy(RetentionPolicy.create(Duration.ofHours(1), 2,
            Duration.ofHours(1))));
    assertTrue(primary.ready().await(TIMEOUT));
    for (int i = 1; i <= 5; i++) {
      primary.commit("app.db", bytes("frame-" + i));
    }
    assertEquals(3, primary.retentionMonitor().sweep());

    final Store replica = start(builder(B, staticLeaser(false))
        .snapshotHandler(replicaImages));

    assertTrue(replica.ready().await(TIMEOUT));
    assertEquals(5, txid(replica, "app.db"));
    assertEquals(1, restored.size());
    assertEquals(5, restored.get(0).txid());
    assertArrayEquals(bytes("image-of-app.db"), images.get(0));

    primary.commit("app.db", bytes("frame-6"));
    waitUntil(() -> txid(replica, "app.db") == 6);
    assertFalse(replica.isPrimary());
  }

  @Test
  void whenStreamDrops_givenFramesStillRetained_shouldResumeWithoutDuplicates()
      throws Exception {
    final List<Position> invalidated =
        Collections.synchronizedList(new ArrayList<>());
    final Store primary = start(builder(A, staticLeaser(true)));
    assertTrue(primary.ready().await(TIMEOUT));
    final Store replica = start(builder(B, staticLeaser(false))
        .invalidator((database, position) -> invalidated.add(position)));
    assertTrue(replica.ready().await(TIMEOUT));
    for (int i = 1; i <= 3; i++) {
      primary.commit("app.db", bytes("frame-" + i));
    }
    waitUntil(() -> txid(replica, "app.db") == 3);

    primary.replicationServer().closeSessions(false);
    for (int i = 4; i <= 6; i++) {
      primary.commit("app.db", bytes("frame-" + i));
    }

    waitUntil(() -> invalidated.size() >= 6);
    Thread.sleep(200);
    final List<Long> txids = new ArrayList<>();
    synchronized (invalidated) {
      invalidated.forEach(position -> txids.add(position.txid()));
    }
    assertEquals(List.of(1L, 2L, 3L, 4L, 5L, 6L), txids);
    assertEquals(primary.position("app.db"), replica.position("app.db"));
  }

  @Test
  void whenStreamHasGap_givenSnapshotHandler_shouldResyncAndResume()
      throws Exception {
    final List<Position> restored =
        Collections.synchronizedList(new ArrayList<>());
    final List<byte[]> images = Collections.synchronizedList(
        new ArrayList<>());
    final Store primary = start(builder(A, staticLeaser(true))
        .snapshotHandler(imagesOf()));
    assertTrue(primary.ready().await(TIMEOUT));
    for (int i = 1; i <= 3; i++) {
      primary.commit("app.db", bytes("frame-" + i));
    }
    final Position head = primary.position("app.db").orElseThrow();

    final AtomicBoolean firstStream = new AtomicBoolean(true);
    final ReplicationClient skipsSecondFrame = new ReplicationClient() {
      @Override
      public InputStream stream(final Node target,
          final StreamRequest request) throws IOException {
        if (!firstStream.getAndSet(false)) {
          return client.stream(target, request);
        }
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        final StreamWriter writer = new StreamWriter(out);
        writer.handshake(Map.of("app.db", head));
        writer.frame(frameAt(head.generation(), 1));
        writer.frame(frameAt(head.generation(), 3));
        return new ByteArrayInputStream(out.toByteArray());
      }

      @Override
      public InputStream snapshot(final Node target, final String database)
          throws IOException {
        return client.snapshot(target, database);
      }
    };

    final Store replica = start(builder(B, staticLeaser(false))
        .client(skipsSecondFrame)
        .snapshotHandler(restoringInto(restored, images)));

    assertTrue(replica.ready().await(TIMEOUT));
    assertEquals(head, replica.position("app.db").orElseThrow());
    assertEquals(List.of(head), restored);

    primary.commit("app.db", bytes("frame-4"));
    waitUntil(() -> txid(replica, "app.db") == 4);
    assertEquals(primary.position("app.db"), replica.position("app.db"));
  }

  @Test
  void whenPrimaryCreatesDatabase_givenReplicaWithForeignHistory_shouldResync()
      throws Exception {
    final InMemoryFrameStore replicaFrames = new InMemoryFrameStore();
    for (int i = 1; i <= 5; i++) {
      replicaFrames.append(new Frame("app.db", new Position(77, i),
          Instant.now(), bytes("b-" + i)));
    }
    final List<Position> restored =
        Collections.synchronizedList(new ArrayList<>());
    final List<byte[]> images = Collections.synchronizedList(
        new ArrayList<>());
    final Store primary = start(builder(A, staticLeaser(true))
        .snapshotHandler(imagesOf()));
    assertTrue(primary.ready().await(TIMEOUT));
    final Store replica = start(builder(B, staticLeaser(false))
        .frameStore(replicaFrames)
        .snapshotHandler(restoringInto(restored, images)));
    assertTrue(replica.ready().await(TIMEOUT));
    assertEquals(new Position(77, 5), replica.position("app.db")
        .orElseThrow());

    for (int i = 1; i <= 7; i++) {
      primary.commit("app.db", bytes("a-" + i));
    }

    final Position head = primary.position("app.db").orElseThrow();
    waitUntil(() -> head.equals(replica.position("app.db").orElse(null)));
    assertFalse(restored.isEmpty());
    for (final Frame frame : replicaFrames.load("app.db")) {
      assertEquals(head.generation(), frame.position().generation());
    }
  }

  @Test
  void whenRenewing_givenIntervalAboveTtl_shouldKeepTheLease()
      throws Exception {
    final InMemoryLeaser.Backend backend = new InMemoryLeaser.Backend(
        Clock.systemUTC(), Duration.ofMillis(400));
    final Store primary = start(builder(A, new InMemoryLeaser(backend))
        .renewInterval(Duration.ofSeconds(5)));
    assertTrue(primary.ready().await(TIMEOUT));

    Thread.sleep(1000);

    assertTrue(primary.isPrimary());
    assertEquals(1, primary.commit("app.db", bytes("one")).txid());
  }

  private static Frame frameAt(final long generation, final long txid) {
    return new Frame("app.db", new Position(generation, txid),
        Instant.now(), bytes("frame-" + txid));
  }

  @Test
  void whenReadingStatus_givenPrimary_shouldDescribeIt() throws Exception {
    final Store primary = start(builder(A, staticLeaser(true)));
    assertTrue(primary.ready().await(TIMEOUT));
    primary.commit("app.db", bytes("one"));

    final StoreStatus status = primary.status();

    assertEquals("a", status.hostname());
    assertEquals(StoreState.PRIMARY, status.state());
    assertEquals("a", status.primary());
    assertTrue(status.ready());
    assertEquals(1, status.positions().get("app.db").txid());
  }

  @Test
  void whenClosing_givenListener_shouldNotifyClosedState() throws Exception {
    final List<StoreState> states =
        Collections.synchronizedList(new ArrayList<>());
    final Store.Builder builder = builder(A, staticLeaser(true));
    final Store store = builder.build();
    store.onStateChange((state, primary) -> states.add(state));
    store.open();
    assertTrue(store.ready().await(TIMEOUT));

    store.close();
    store.close();

    assertEquals(List.of(StoreState.PRIMARY, StoreState.CLOSED), states);
  }
}
