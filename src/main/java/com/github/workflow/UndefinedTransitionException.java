package com.github.workflow;

import java.util.Collections;
import java.util.List;

/**
 * Thrown when an event is fired that the current state does not declare. Carries the current state
 * and the ordered list of events that are legal in it so callers can build a useful diagnostic.
 */
public final class UndefinedTransitionException extends WorkflowException {
  private static final long serialVersionUID = 1L;
  private final String specificationName;
  private final String stateName;
  private final String eventName;
  private final List<String> legalEvents;

  public UndefinedTransitionException(final String specificationName, final String stateName,
      final String eventName, final List<String> legalEvents) {
    super(Code.UNDEFINED_TRANSITION,
        describe(specificationName, stateName, eventName, legalEvents));
    this.specificationName = specificationName;
    this.stateName = stateName;
    this.eventName = eventName;
    this.legalEvents = Collections.unmodifiableList(legalEvents);
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

  /**
   * Events declared for {@link #getStateName()}, in declaration order.
   */
  public List<String> getLegalEvents() {
    return legalEvents;
  }

  private static String describe(final String specificationName, final String stateName,
      final String eventName, final List<String> legalEvents) {
    final StringBuilder message = new StringBuilder().append("There is no event '")
        .append(eventName).append("' defined for state '").append(stateName)
        .append("' of workflow '").append(specificationName).append("'. ");
    if (legalEvents.isEmpty()) {
      message.append("State '").append(stateName).append("' declares no events.");
    } else {
      message.append("Legal events: ").append(legalEvents);
    }
    return message.toString();
  }
}
