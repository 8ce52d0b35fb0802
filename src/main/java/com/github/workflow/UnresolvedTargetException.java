package com.github.workflow;

/**
 * Thrown when a fired event names a target state that is still missing from its specification.
 * This is an authoring defect in the specification, not a caller error.
 */
public final class UnresolvedTargetException extends WorkflowException {
  private static final long serialVersionUID = 1L;
  private final String specificationName;
  private final String stateName;
  private final String eventName;
  private final String targetName;

  public UnresolvedTargetException(final String specificationName, final String stateName,
      final String eventName, final String targetName) {
    super(Code.UNRESOLVED_TARGET,
        String.format(
            "Event '%s' of state '%s' transitions to '%s' which workflow '%s' does not declare",
            eventName, stateName, targetName, specificationName));
    this.specificationName = specificationName;
    this.stateName = stateName;
    this.eventName = eventName;
    this.targetName = targetName;
  }

  public String getSpecificationName() {
    return specificationName;
  }

  public String getStateName() {
    return stateName;
  }

  public String getEventName() {
    return eventName;
  }

  public String getTargetName() {
    return targetName;
  }
}
