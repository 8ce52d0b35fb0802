package com.github.workflow;

import java.util.Optional;

/**
 * This object encapsulates the outcome of firing an event on a {@link Workflow}.
 *
 * Successful transitions report {@link #isSuccessful()} as true and carry both states. Halted
 * transitions report {@link #isHalted()} as true, carry the state the workflow stayed in as both
 * {@link #getFromState()} and {@link #getToState()}, and the halt reason if one was given.
 *
 * Users should not try to sub-class and extend this, it would serve little purpose.
 */
public final class TransitionResult {
  private final String eventName;
  private final State fromState;
  private final State toState;
  private final boolean halted;
  private final String haltedReason;

  private TransitionResult(final String eventName, final State fromState, final State toState,
      final boolean halted, final String haltedReason) {
    this.eventName = eventName;
    this.fromState = fromState;
    this.toState = toState;
    this.halted = halted;
    this.haltedReason = haltedReason;
  }

  static TransitionResult transitioned(final String eventName, final State fromState,
      final State toState) {
    return new TransitionResult(eventName, fromState, toState, false, null);
  }

  static TransitionResult halted(final String eventName, final State state, final String reason) {
    return new TransitionResult(eventName, state, state, true, reason);
  }

  public boolean isSuccessful() {
    return !halted;
  }

  public boolean isHalted() {
    return halted;
  }

  public Optional<String> getHaltedBecause() {
    return Optional.ofNullable(haltedReason);
  }

  public String getEventName() {
    return eventName;
  }

  public State getFromState() {
    return fromState;
  }

  public State getToState() {
    return toState;
  }

  @Override
  public String toString() {
    return "TransitionResult [eventName=" + eventName + ", fromState=" + fromState.getName()
        + ", toState=" + toState.getName() + ", halted=" + halted + ", haltedReason="
        + haltedReason + "]";
  }
}
