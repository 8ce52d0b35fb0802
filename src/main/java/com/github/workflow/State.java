package com.github.workflow;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A named node of a {@link Specification}. Owns its events, keyed by name in declaration order, its
 * entry/exit hooks and its metadata. States compare by declaration order within their
 * specification.
 */
public final class State implements Comparable<State> {
  private final String name;
  private final Map<String, Event> events = new LinkedHashMap<>();
  private final Meta meta = Meta.of(Collections.emptyMap());
  private EntryHook onEntry;
  private ExitHook onExit;

  // position in the owning specification, assigned on registration
  private int position = -1;

  State(final String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public Collection<Event> getEvents() {
    return Collections.unmodifiableCollection(events.values());
  }

  public List<String> getEventNames() {
    return Collections.unmodifiableList(new ArrayList<>(events.keySet()));
  }

  /**
   * Returns null if this state declares no such event.
   */
  public Event getEvent(final String eventName) {
    return events.get(eventName);
  }

  public boolean hasEvent(final String eventName) {
    return events.containsKey(eventName);
  }

  public Optional<EntryHook> getOnEntry() {
    return Optional.ofNullable(onEntry);
  }

  public Optional<ExitHook> getOnExit() {
    return Optional.ofNullable(onExit);
  }

  public Meta getMeta() {
    return meta;
  }

  public int getPosition() {
    return position;
  }

  void putEvent(final Event event) {
    events.put(event.getName(), event);
  }

  void setOnEntry(final EntryHook onEntry) {
    this.onEntry = onEntry;
  }

  void setOnExit(final ExitHook onExit) {
    this.onExit = onExit;
  }

  void setPosition(final int position) {
    this.position = position;
  }

  @Override
  public int compareTo(final State other) {
    return Integer.compare(position, other.position);
  }

  @Override
  public String toString() {
    return "State [name=" + name + ", events=" + events.keySet() + "]";
  }
}
