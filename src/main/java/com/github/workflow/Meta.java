package com.github.workflow;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Ordered application metadata attached to a {@link State} or an {@link Event}. Keys and values are
 * opaque to the engine. Callers only get read access; entries are written while a specification is
 * being built.
 */
public final class Meta implements Iterable<Map.Entry<Object, Object>> {
  private static final Meta EMPTY = new Meta();

  private final Map<Object, Object> entries = new LinkedHashMap<>();

  private Meta() {}

  public static Meta empty() {
    return EMPTY;
  }

  /**
   * Snapshot of the given map, preserving its iteration order.
   */
  public static Meta of(final Map<?, ?> entries) {
    final Meta meta = new Meta();
    meta.putAll(entries);
    return meta;
  }

  public Object get(final Object key) {
    return entries.get(key);
  }

  /**
   * Typed lookup, so {@code meta.get("label", String.class)} reads like a property access.
   *
   * @throws ClassCastException if the stored value is not of the requested type
   */
  public <T> T get(final Object key, final Class<T> type) {
    return type.cast(entries.get(key));
  }

  public Object getOrDefault(final Object key, final Object defaultValue) {
    return entries.getOrDefault(key, defaultValue);
  }

  public boolean containsKey(final Object key) {
    return entries.containsKey(key);
  }

  public Set<Object> keys() {
    return Collections.unmodifiableSet(entries.keySet());
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public Map<Object, Object> asMap() {
    return Collections.unmodifiableMap(entries);
  }

  @Override
  public Iterator<Map.Entry<Object, Object>> iterator() {
    return asMap().entrySet().iterator();
  }

  // builder and merge path only
  void putAll(final Map<?, ?> more) {
    if (more != null && !more.isEmpty()) {
      for (Map.Entry<?, ?> entry : more.entrySet()) {
        entries.put(entry.getKey(), entry.getValue());
      }
    }
  }

  Meta copy() {
    return of(entries);
  }

  @Override
  public String toString() {
    return "Meta " + entries;
  }
}
