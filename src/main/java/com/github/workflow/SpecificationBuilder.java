package com.github.workflow;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Compiles an ordered batch of declarations into a {@link Specification} and registers it. Building
 * under a name that is already registered re-opens that specification and merges the batch into
 * it, see {@link RedefinitionPolicy}.
 *
 * <pre>
 * Specification article = SpecificationBuilder.newBuilder("Article")
 *     .state("new", state -&gt; state.event("submit", "awaiting_review"))
 *     .state("awaiting_review", state -&gt; state.event("review", "being_reviewed"))
 *     .onTransition((workflow, from, to, event, args) -&gt; audit(from, to))
 *     .build();
 * </pre>
 *
 * Declarations are only checked when {@link #build()} runs. Event targets are never checked here,
 * since the target state may arrive with a later re-opening.
 */
public final class SpecificationBuilder {
  private final String name;
  private WorkflowConfiguration config = WorkflowConfiguration.defaults();
  private final List<Statement> statements = new ArrayList<>();

  public static SpecificationBuilder newBuilder(final String name) {
    return new SpecificationBuilder(name);
  }

  public SpecificationBuilder config(final WorkflowConfiguration config) {
    this.config = config;
    return this;
  }

  public SpecificationBuilder state(final String stateName) {
    statements.add((draft, policy) -> draft.stateFor(checkName("State", stateName)));
    return this;
  }

  /**
   * Declare a state and run its body. Declarations made in the body belong to this state.
   */
  public SpecificationBuilder state(final String stateName, final Consumer<StateBuilder> body) {
    state(stateName);
    if (body != null) {
      body.accept(new StateBuilder(stateName));
    }
    return this;
  }

  public SpecificationBuilder event(final String stateName, final String eventName,
      final String target, final Map<?, ?> meta, final Action action) {
    statements.add((draft, policy) -> {
      final State state = draft.stateFor(checkName("State", stateName));
      final Event event = new Event(checkName("Event", eventName),
          checkName("Target state", target), action, meta == null ? Meta.empty() : Meta.of(meta));
      if (policy == RedefinitionPolicy.REJECT && state.hasEvent(eventName)) {
        throw rejected("event '" + eventName + "' of state '" + stateName + "'");
      }
      state.putEvent(event);
    });
    return this;
  }

  public SpecificationBuilder onEntry(final String stateName, final EntryHook hook) {
    statements.add((draft, policy) -> {
      final State state = draft.stateFor(checkName("State", stateName));
      if (policy == RedefinitionPolicy.REJECT && state.getOnEntry().isPresent()) {
        throw rejected("on_entry hook of state '" + stateName + "'");
      }
      state.setOnEntry(hook);
    });
    return this;
  }

  public SpecificationBuilder onExit(final String stateName, final ExitHook hook) {
    statements.add((draft, policy) -> {
      final State state = draft.stateFor(checkName("State", stateName));
      if (policy == RedefinitionPolicy.REJECT && state.getOnExit().isPresent()) {
        throw rejected("on_exit hook of state '" + stateName + "'");
      }
      state.setOnExit(hook);
    });
    return this;
  }

  public SpecificationBuilder meta(final String stateName, final Map<?, ?> meta) {
    statements.add((draft, policy) -> {
      final State state = draft.stateFor(checkName("State", stateName));
      if (policy == RedefinitionPolicy.REJECT && meta != null) {
        for (final Object key : meta.keySet()) {
          if (state.getMeta().containsKey(key)) {
            throw rejected("meta key '" + key + "' of state '" + stateName + "'");
          }
        }
      }
      state.getMeta().putAll(meta);
    });
    return this;
  }

  /**
   * Attach metadata to an event declared earlier in this batch. Event definitions are immutable, so
   * this replaces the event with a copy carrying the merged metadata.
   */
  public SpecificationBuilder meta(final String stateName, final String eventName,
      final Map<?, ?> meta) {
    statements.add((draft, policy) -> {
      final State state = draft.stateFor(checkName("State", stateName));
      final Event event = state.getEvent(checkName("Event", eventName));
      if (event == null) {
        throw new WorkflowException(WorkflowException.Code.UNKNOWN_EVENT, String.format(
            "Cannot attach meta to event '%s' which state '%s' does not declare in this batch",
            eventName, stateName));
      }
      final Meta merged = event.getMeta().copy();
      if (policy == RedefinitionPolicy.REJECT && meta != null) {
        for (final Object key : meta.keySet()) {
          if (merged.containsKey(key)) {
            throw rejected("meta key '" + key + "' of event '" + eventName + "'");
          }
        }
      }
      merged.putAll(meta);
      state.putEvent(new Event(event.getName(), event.getTransitionsTo(),
          event.getAction().orElse(null), merged));
    });
    return this;
  }

  public SpecificationBuilder onTransition(final TransitionHook hook) {
    statements.add((draft, policy) -> {
      if (hook != null) {
        draft.addTransitionHook(hook);
      }
    });
    return this;
  }

  /**
   * Compile the declarations in the order they were made and register the result. Returns the
   * registered specification, which is the pre-existing one when the name was already taken.
   */
  public Specification build() throws WorkflowException {
    final Specification draft = new Specification(checkName("Workflow", name));
    final RedefinitionPolicy policy = config.getRedefinitionPolicy();
    for (final Statement statement : statements) {
      statement.applyTo(draft, policy);
    }
    return SpecificationRegistry.getInstance().define(draft, config);
  }

  private String checkName(final String kind, final String value) throws WorkflowException {
    return config.checkName(kind, value);
  }

  private WorkflowException rejected(final String what) {
    return new WorkflowException(WorkflowException.Code.REDEFINITION_REJECTED,
        "Workflow '" + name + "' declares " + what + " more than once");
  }

  private SpecificationBuilder(final String name) {
    this.name = name;
  }

  /**
   * Declarations scoped to one state, handed to the body of
   * {@link SpecificationBuilder#state(String, Consumer)}.
   */
  public final class StateBuilder {
    private final String stateName;

    private StateBuilder(final String stateName) {
      this.stateName = stateName;
    }

    public StateBuilder event(final String eventName, final String target) {
      return event(eventName, target, null, null);
    }

    public StateBuilder event(final String eventName, final String target, final Action action) {
      return event(eventName, target, null, action);
    }

    public StateBuilder event(final String eventName, final String target,
        final Map<?, ?> meta) {
      return event(eventName, target, meta, null);
    }

    public StateBuilder event(final String eventName, final String target, final Map<?, ?> meta,
        final Action action) {
      SpecificationBuilder.this.event(stateName, eventName, target, meta, action);
      return this;
    }

    public StateBuilder onEntry(final EntryHook hook) {
      SpecificationBuilder.this.onEntry(stateName, hook);
      return this;
    }

    public StateBuilder onExit(final ExitHook hook) {
      SpecificationBuilder.this.onExit(stateName, hook);
      return this;
    }

    public StateBuilder meta(final Map<?, ?> meta) {
      SpecificationBuilder.this.meta(stateName, meta);
      return this;
    }
  }

  @FunctionalInterface
  private interface Statement {
    void applyTo(final Specification draft, final RedefinitionPolicy policy)
        throws WorkflowException;
  }
}
