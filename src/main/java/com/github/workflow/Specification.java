package com.github.workflow;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named, compiled workflow graph: its states in declaration order and its transition hooks in
 * registration order. Specifications are created and re-opened through
 * {@link SpecificationBuilder} and shared read-only by every {@link Workflow} bound to them.
 *
 * Notes for users:<br>
 * 1. the initial state is the first state ever declared under this name. Re-opening the
 * specification never changes it.<br>
 *
 * 2. re-opening only ever adds to the graph, nothing is removed.<br>
 *
 * 3. there is no locking between re-opening a specification and firing events on workflows bound
 * to it. Declare specifications at setup time, or synchronize externally.<br>
 */
public final class Specification {
  private final String name;
  private final Map<String, State> states = new LinkedHashMap<>();
  private final List<TransitionHook> transitionHooks = new ArrayList<>();

  Specification(final String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public Collection<State> getStates() {
    return Collections.unmodifiableCollection(states.values());
  }

  public List<String> getStateNames() {
    return Collections.unmodifiableList(new ArrayList<>(states.keySet()));
  }

  /**
   * Returns null if no state of that name is declared.
   */
  public State getState(final String stateName) {
    return states.get(stateName);
  }

  public boolean hasState(final String stateName) {
    return states.containsKey(stateName);
  }

  /**
   * Returns null while the specification declares no states.
   */
  public State getInitialState() {
    return states.isEmpty() ? null : states.values().iterator().next();
  }

  public List<TransitionHook> getTransitionHooks() {
    return Collections.unmodifiableList(transitionHooks);
  }

  State stateFor(final String stateName) {
    State state = states.get(stateName);
    if (state == null) {
      state = new State(stateName);
      addState(state);
    }
    return state;
  }

  void addTransitionHook(final TransitionHook hook) {
    transitionHooks.add(hook);
  }

  private void addState(final State state) {
    state.setPosition(states.size());
    states.put(state.getName(), state);
  }

  /**
   * Fold a freshly compiled batch of declarations into this specification. New states are appended
   * in the batch's order, new events are appended to their state, transition hooks are appended.
   * With {@link RedefinitionPolicy#REJECT} every conflict is checked before anything is applied, so
   * a rejected batch leaves this specification untouched.
   */
  void merge(final Specification draft, final RedefinitionPolicy policy) throws WorkflowException {
    if (policy == RedefinitionPolicy.REJECT) {
      verifyNoRedefinition(draft);
    }
    for (final State incoming : draft.states.values()) {
      final State existing = states.get(incoming.getName());
      if (existing == null) {
        addState(incoming);
        continue;
      }
      for (final Event event : incoming.getEvents()) {
        existing.putEvent(event);
      }
      if (incoming.getOnEntry().isPresent()) {
        existing.setOnEntry(incoming.getOnEntry().get());
      }
      if (incoming.getOnExit().isPresent()) {
        existing.setOnExit(incoming.getOnExit().get());
      }
      existing.getMeta().putAll(incoming.getMeta().asMap());
    }
    transitionHooks.addAll(draft.transitionHooks);
  }

  private void verifyNoRedefinition(final Specification draft) throws WorkflowException {
    for (final State incoming : draft.states.values()) {
      final State existing = states.get(incoming.getName());
      if (existing == null) {
        continue;
      }
      for (final String eventName : incoming.getEventNames()) {
        if (existing.hasEvent(eventName)) {
          throw rejected("event '" + eventName + "' of state '" + existing.getName() + "'");
        }
      }
      if (incoming.getOnEntry().isPresent() && existing.getOnEntry().isPresent()) {
        throw rejected("on_entry hook of state '" + existing.getName() + "'");
      }
      if (incoming.getOnExit().isPresent() && existing.getOnExit().isPresent()) {
        throw rejected("on_exit hook of state '" + existing.getName() + "'");
      }
      for (final Object key : incoming.getMeta().keys()) {
        if (existing.getMeta().containsKey(key)) {
          throw rejected("meta key '" + key + "' of state '" + existing.getName() + "'");
        }
      }
    }
  }

  private WorkflowException rejected(final String what) {
    return new WorkflowException(WorkflowException.Code.REDEFINITION_REJECTED,
        "Workflow '" + name + "' already declares " + what);
  }

  @Override
  public String toString() {
    return "Specification [name=" + name + ", states=" + states.keySet() + ", transitionHooks="
        + transitionHooks.size() + "]";
  }
}
