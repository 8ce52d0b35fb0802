package com.github.workflow;

import java.util.Optional;

/**
 * Immutable definition of an event owned by exactly one {@link State}. The target is kept as a name
 * and only looked up when the event fires, since the target state may be declared by a later
 * re-opening of the specification.
 */
public final class Event {
  private final String name;
  private final String transitionsTo;
  private final Action action;
  private final Meta meta;

  Event(final String name, final String transitionsTo, final Action action, final Meta meta) {
    this.name = name;
    this.transitionsTo = transitionsTo;
    this.action = action;
    this.meta = meta == null ? Meta.empty() : meta;
  }

  public String getName() {
    return name;
  }

  /**
   * Name of the target state. Not validated against the specification.
   */
  public String getTransitionsTo() {
    return transitionsTo;
  }

  public Optional<Action> getAction() {
    return Optional.ofNullable(action);
  }

  public Meta getMeta() {
    return meta;
  }

  @Override
  public String toString() {
    return "Event [name=" + name + ", transitionsTo=" + transitionsTo + ", action="
        + (action != null) + ", meta=" + meta + "]";
  }
}
