package com.github.workflow;

import java.util.Optional;

/**
 * Raised by {@link Workflow#fireOrThrow(String, Object...)} when the event action halted the
 * transition. The workflow stays in {@link #getStateName()} and still reports
 * {@link Workflow#isHalted()} afterwards.
 */
public final class HaltedException extends WorkflowException {
  private static final long serialVersionUID = 1L;
  private final String stateName;
  private final String eventName;
  private final String reason;

  public HaltedException(final String stateName, final String eventName, final String reason) {
    super(Code.HALTED, reason == null
        ? String.format("Event '%s' was halted in state '%s'", eventName, stateName)
        : String.format("Event '%s' was halted in state '%s': %s", eventName, stateName, reason));
    this.stateName = stateName;
    this.eventName = eventName;
    this.reason = reason;
  }

  public String getStateName() {
    return stateName;
  }

  public String getEventName() {
    return eventName;
  }

  public Optional<String> getReason() {
    return Optional.ofNullable(reason);
  }
}
