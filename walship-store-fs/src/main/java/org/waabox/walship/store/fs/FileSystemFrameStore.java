package org.waabox.walship.store.fs;

import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.walship.Frame;
import org.waabox.walship.Position;
import org.waabox.walship.WalshipException;
import org.waabox.walship.storage.FrameStore;

/**
 * A {@link FrameStore} that keeps frames in the local data directory.
 *
 * <p>Every frame is a file of its own, named after its txid in fixed
 * width hex so that names sort in txid order. Database names are URL
 * encoded to be safe as directory names. The base position a database was
 * last reset to is kept in a small key=value file.
 *
 * <p>Writes use an atomic pattern: data is written to a temporary file and
 * then renamed, so a crash never leaves a partial frame behind.
 *
 * <p>Storage layout:
 * <pre>
 * {dataDir}/
 *   dbs/
 *     {database}/
 *       base.meta
 *       frames/
 *         0000000000000001.frame
 *         0000000000000002.frame
 * </pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FileSystemFrameStore implements FrameStore {

  private static final Logger log =
      LoggerFactory.getLogger(FileSystemFrameStore.class);

  /** The directory holding one subdirectory per database. */
  private static final String DATABASES_DIR = "dbs";

  /** The directory holding the frames of a database. */
  private static final String FRAMES_DIR = "frames";

  /** The frame file extension. */
  private static final String FRAME_SUFFIX = ".frame";

  /** The name of the base position file. */
  private static final String BASE_FILE = "base.meta";

  /** The base file key for the generation. */
  private static final String META_KEY_GENERATION = "generation";

  /** The base file key for the txid. */
  private static final String META_KEY_TXID = "txid";

  /** The directory holding every database. */
  private final Path databasesDir;

  /**
   * Creates a new store in the given data directory, creating it if
   * needed.
   *
   * @param dataDir the data directory, never null
   *
   * @throws WalshipException if the directory cannot be created
   */
  public FileSystemFrameStore(final Path dataDir) {
    Objects.requireNonNull(dataDir, "dataDir must not be null");
    databasesDir = dataDir.resolve(DATABASES_DIR);
    try {
      Files.createDirectories(databasesDir);
    } catch (final IOException e) {
      throw new WalshipException("Failed to create data directory: "
          + databasesDir, e);
    }
  }

  @Override
  public void append(final Frame frame) {
    Objects.requireNonNull(frame, "frame must not be null");
    final Path framesDir = framesDir(frame.database());
    try {
      Files.createDirectories(framesDir);
      final Path target = framesDir.resolve(frameName(frame.txid()));
      final Path temp = framesDir.resolve(frameName(frame.txid()) + ".tmp");
      Files.write(temp, encode(frame));
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
    } catch (final IOException e) {
      throw new WalshipException("Failed to store frame " + frame, e);
    }
  }

  @Override
  public List<Frame> load(final String database) {
    Objects.requireNonNull(database, "database must not be null");
    final List<Frame> frames = new ArrayList<>();
    for (final Path file : frameFiles(database)) {
      try (InputStream in = Files.newInputStream(file)) {
        frames.add(decode(database, in));
      } catch (final IOException e) {
        throw new WalshipException("Failed to read frame " + file, e);
      }
    }
    return frames;
  }

  @Override
  public Position base(final String database) {
    Objects.requireNonNull(database, "database must not be null");
    final Path file = databaseDir(database).resolve(BASE_FILE);
    if (!Files.exists(file)) {
      return Position.ZERO;
    }
    try (InputStream in = Files.newInputStream(file)) {
      final Properties meta = new Properties();
      meta.load(in);
      return new Position(
          Long.parseLong(requireKey(meta, META_KEY_GENERATION, file)),
          Long.parseLong(requireKey(meta, META_KEY_TXID, file)));
    } catch (final IOException e) {
      throw new WalshipException("Failed to read " + file, e);
    }
  }

  @Override
  public Set<String> databases() {
    final Set<String> names = new TreeSet<>();
    try (Stream<Path> dirs = Files.list(databasesDir)) {
      dirs.filter(Files::isDirectory).forEach(dir -> names.add(
          URLDecoder.decode(dir.getFileName().toString(),
              StandardCharsets.UTF_8)));
    } catch (final IOException e) {
      throw new WalshipException("Failed to list " + databasesDir, e);
    }
    return names;
  }

  @Override
  public void prune(final String database, final long beforeTxid) {
    Objects.requireNonNull(database, "database must not be null");
    int removed = 0;
    for (final Path file : frameFiles(database)) {
      if (txidOf(file) >= beforeTxid) {
        break;
      }
      delete(file);
      removed++;
    }
    log.debug("Removed {} stored frames of database '{}'", removed,
        database);
  }

  @Override
  public void reset(final String database, final Position base) {
    Objects.requireNonNull(database, "database must not be null");
    Objects.requireNonNull(base, "base must not be null");
    final Path dir = databaseDir(database);
    try {
      Files.createDirectories(dir);
      final String content = META_KEY_GENERATION + "=" + base.generation()
          + "\n" + META_KEY_TXID + "=" + base.txid() + "\n";
      final Path temp = dir.resolve(BASE_FILE + ".tmp");
      Files.writeString(temp, content);
      Files.move(temp, dir.resolve(BASE_FILE),
          StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
    } catch (final IOException e) {
      throw new WalshipException("Failed to reset database '" + database
          + "'", e);
    }
    for (final Path file : frameFiles(database)) {
      delete(file);
    }
    log.info("Reset stored database '{}' at {}", database, base);
  }

  private Path databaseDir(final String database) {
    return databasesDir.resolve(URLEncoder.encode(database,
        StandardCharsets.UTF_8));
  }

  private Path framesDir(final String database) {
    return databaseDir(database).resolve(FRAMES_DIR);
  }

  /** Returns the frame files of the database, sorted by txid. */
  private List<Path> frameFiles(final String database) {
    final Path dir = framesDir(database);
    if (!Files.isDirectory(dir)) {
      return List.of();
    }
    try (Stream<Path> files = Files.list(dir)) {
      return files
          .filter(f -> f.getFileName().toString().endsWith(FRAME_SUFFIX))
          .sorted()
          .toList();
    } catch (final IOException e) {
      throw new WalshipException("Failed to list " + dir, e);
    }
  }

  private void delete(final Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (final IOException e) {
      throw new WalshipException("Failed to delete " + file, e);
    }
  }

  private static String frameName(final long txid) {
    return String.format("%016x", txid) + FRAME_SUFFIX;
  }

  private static long txidOf(final Path file) {
    final String name = file.getFileName().toString();
    return Long.parseUnsignedLong(
        name.substring(0, name.length() - FRAME_SUFFIX.length()), 16);
  }

  private static byte[] encode(final Frame frame) throws IOException {
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream(
        frame.payload().length + 32);
    final DataOutputStream out = new DataOutputStream(bytes);
    out.writeLong(frame.position().generation());
    out.writeLong(frame.txid());
    out.writeLong(frame.committedAt().toEpochMilli());
    out.writeInt(frame.payload().length);
    out.write(frame.payload());
    out.flush();
    return bytes.toByteArray();
  }

  private static Frame decode(final String database, final InputStream input)
      throws IOException {
    final DataInputStream in = new DataInputStream(input);
    final Position position = new Position(in.readLong(), in.readLong());
    final Instant committedAt = Instant.ofEpochMilli(in.readLong());
    final byte[] payload = new byte[in.readInt()];
    in.readFully(payload);
    return new Frame(database, position, committedAt, payload);
  }

  private static String requireKey(final Properties meta, final String key,
      final Path file) {
    final String value = meta.getProperty(key);
    if (value == null) {
      throw new WalshipException("Missing key '" + key + "' in " + file);
    }
    return value;
  }
}
