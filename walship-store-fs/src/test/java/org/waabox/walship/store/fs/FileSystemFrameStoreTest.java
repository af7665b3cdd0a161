package org.waabox.walship.store.fs;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.waabox.walship.Database;
import org.waabox.walship.Frame;
import org.waabox.walship.Position;

/**
 * Tests for {@link FileSystemFrameStore}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class FileSystemFrameStoreTest {

  private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

  @TempDir
  Path dataDir;

  private static Frame frame(final String database, final long txid) {
    return new Frame(database, new Position(-3, txid), NOW.plusSeconds(txid),
        new byte[] {(byte) txid, 1, 2});
  }

  @Test
  void whenLoading_givenAppendedFrames_shouldReturnThemInTxidOrder() {
    final FileSystemFrameStore store = new FileSystemFrameStore(dataDir);
    for (long txid = 1; txid <= 17; txid++) {
      store.append(frame("app.db", txid));
    }

    final List<Frame> frames = new FileSystemFrameStore(dataDir)
        .load("app.db");

    assertEquals(17, frames.size());
    assertEquals(16, frames.get(15).txid());
    assertEquals(new Position(-3, 17), frames.get(16).position());
    assertEquals(NOW.plusSeconds(17), frames.get(16).committedAt());
    assertArrayEquals(new byte[] {17, 1, 2}, frames.get(16).payload());
  }

  @Test
  void whenListing_givenDatabasesWithUnsafeNames_shouldDecodeNames() {
    final FileSystemFrameStore store = new FileSystemFrameStore(dataDir);
    store.append(frame("app.db", 1));
    store.append(frame("tenants/a b.db", 1));

    assertEquals(Set.of("app.db", "tenants/a b.db"), store.databases());
    assertEquals(1, store.load("tenants/a b.db").size());
  }

  @Test
  void whenPruning_givenTxid_shouldDeleteOlderFramesOnly() {
    final FileSystemFrameStore store = new FileSystemFrameStore(dataDir);
    for (long txid = 1; txid <= 5; txid++) {
      store.append(frame("app.db", txid));
    }

    store.prune("app.db", 4);

    final List<Frame> frames = store.load("app.db");
    assertEquals(2, frames.size());
    assertEquals(4, frames.get(0).txid());
  }

  @Test
  void whenResetting_givenBase_shouldDropFramesAndKeepBase() {
    final FileSystemFrameStore store = new FileSystemFrameStore(dataDir);
    store.append(frame("app.db", 1));
    store.append(frame("app.db", 2));

    store.reset("app.db", new Position(-3, 10));

    final FileSystemFrameStore reopened = new FileSystemFrameStore(dataDir);
    assertTrue(reopened.load("app.db").isEmpty());
    assertEquals(new Position(-3, 10), reopened.base("app.db"));
    assertEquals(Position.ZERO, reopened.base("other.db"));
  }

  @Test
  void whenRecovering_givenStoredState_shouldRebuildDatabase() {
    final FileSystemFrameStore store = new FileSystemFrameStore(dataDir);
    store.reset("app.db", new Position(-3, 10));
    store.append(frame("app.db", 11));
    store.append(frame("app.db", 12));

    final Database database = new Database("app.db");
    database.recover(store.base("app.db"), store.load("app.db"));

    assertEquals(new Position(-3, 12), database.position());
    assertEquals(11, database.retainedFrom());
  }

  @Test
  void whenAppending_givenFrame_shouldLeaveNoTemporaryFiles()
      throws Exception {
    final FileSystemFrameStore store = new FileSystemFrameStore(dataDir);
    store.append(frame("app.db", 1));

    try (Stream<Path> files = Files.walk(dataDir)) {
      assertTrue(files.noneMatch(f -> f.toString().endsWith(".tmp")));
    }
  }
}
