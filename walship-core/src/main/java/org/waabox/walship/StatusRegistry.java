package org.waabox.walship;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Supplier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Named status values published for diagnostics.
 *
 * <p>The registry is owned by whoever wires the application, and each
 * name can be registered once. Values are computed when the status is
 * rendered.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StatusRegistry {

  /** Shared ObjectMapper for rendering. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** The registered suppliers, sorted by name. */
  private final Map<String, Supplier<?>> entries = new TreeMap<>();

  /**
   * Registers a status value.
   *
   * @param name     the name, never null
   * @param supplier computes the value, never null
   *
   * @throws IllegalStateException if the name is already registered
   */
  public synchronized void register(final String name,
      final Supplier<?> supplier) {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(supplier, "supplier must not be null");
    if (entries.containsKey(name)) {
      throw new IllegalStateException("Status '" + name
          + "' is already registered");
    }
    entries.put(name, supplier);
  }

  /**
   * Tells whether a name is registered.
   *
   * @param name the name, never null
   * @return true if registered
   */
  public synchronized boolean isRegistered(final String name) {
    return entries.containsKey(name);
  }

  /**
   * Computes every registered value.
   *
   * @return the values by name, never null
   */
  public Map<String, Object> snapshot() {
    final Map<String, Supplier<?>> copy;
    synchronized (this) {
      copy = new TreeMap<>(entries);
    }
    final Map<String, Object> values = new TreeMap<>();
    copy.forEach((name, supplier) -> values.put(name, supplier.get()));
    return values;
  }

  /**
   * Renders every registered value as a JSON object.
   *
   * @return the JSON document, never null
   */
  public String toJson() {
    try {
      return MAPPER.writeValueAsString(snapshot());
    } catch (final JsonProcessingException e) {
      throw new WalshipException("Cannot render status", e);
    }
  }
}
