package org.waabox.walship;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * The databases known to this node, keyed by name.
 *
 * <p>Databases are created lazily and never removed. The registry also
 * carries a change signal: writers call {@link #signalChange()} after a
 * frame becomes visible, and serving sessions block in
 * {@link #awaitChange(long, Duration)} until there is something new.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DatabaseRegistry {

  /** The databases, sorted by name. */
  private final ConcurrentSkipListMap<String, Database> databases =
      new ConcurrentSkipListMap<>();

  /** Guards the change counter. */
  private final ReentrantLock changeLock = new ReentrantLock();

  /** Signalled on every change. */
  private final Condition changed = changeLock.newCondition();

  /** The number of changes so far, guarded by changeLock. */
  private long changes = 0;

  /**
   * Returns the named database, creating it if needed.
   *
   * @param name the database name, never null
   * @return the database, never null
   */
  public Database getOrCreate(final String name) {
    return getOrCreate(name, Database::new);
  }

  /**
   * Returns the named database, creating it with the given factory if
   * needed. Creating a database counts as a change.
   *
   * @param name    the database name, never null
   * @param factory creates the database, never null
   * @return the database, never null
   */
  public Database getOrCreate(final String name,
      final Function<String, Database> factory) {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(factory, "factory must not be null");
    final Database existing = databases.get(name);
    if (existing != null) {
      return existing;
    }
    final Database created = databases.computeIfAbsent(name, factory);
    signalChange();
    return created;
  }

  /**
   * Finds a database by name.
   *
   * @param name the database name, never null
   * @return the database, or empty if unknown
   */
  public Optional<Database> find(final String name) {
    Objects.requireNonNull(name, "name must not be null");
    return Optional.ofNullable(databases.get(name));
  }

  /**
   * Returns all databases, sorted by name.
   *
   * @return an immutable snapshot, never null
   */
  public Collection<Database> databases() {
    return List.copyOf(databases.values());
  }

  /**
   * Returns the current position of every database.
   *
   * @return an immutable map of name to position, never null
   */
  public Map<String, Position> positions() {
    final Map<String, Position> result = new LinkedHashMap<>();
    for (final Database database : databases.values()) {
      result.put(database.name(), database.position());
    }
    return Collections.unmodifiableMap(result);
  }

  /**
   * Returns the number of changes signalled so far.
   *
   * @return the change count
   */
  public long changeCount() {
    changeLock.lock();
    try {
      return changes;
    } finally {
      changeLock.unlock();
    }
  }

  /** Wakes up every thread waiting for a change. */
  public void signalChange() {
    changeLock.lock();
    try {
      changes++;
      changed.signalAll();
    } finally {
      changeLock.unlock();
    }
  }

  /**
   * Waits until the change count moves past the given value.
   *
   * @param seen    the change count the caller already observed
   * @param timeout the maximum time to wait, never null
   *
   * @return true if a change happened, false on timeout
   *
   * @throws InterruptedException if the thread is interrupted
   */
  public boolean awaitChange(final long seen, final Duration timeout)
      throws InterruptedException {
    long nanos = timeout.toNanos();
    changeLock.lock();
    try {
      while (changes == seen) {
        if (nanos <= 0) {
          return false;
        }
        nanos = changed.awaitNanos(nanos);
      }
      return true;
    } finally {
      changeLock.unlock();
    }
  }

  /**
   * Returns the number of known databases.
   *
   * @return the count
   */
  public int size() {
    return databases.size();
  }
}
