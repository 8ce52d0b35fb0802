package com.github.workflow;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A live binding of a {@link Specification} to one current state, optionally attached to a host
 * object. The current state only ever changes through {@link #fire(String, Object...)} or
 * {@link #fireOrThrow(String, Object...)}.
 *
 * Notes for users:<br>
 * 1. a workflow instance is NOT thread-safe. Firing events on the same instance from several
 * threads requires external synchronization. Separate instances sharing one specification are
 * independent.<br>
 *
 * 2. persistence is left to the host. To resume a stored workflow use
 * {@link #restore(Specification, Object, String)}; to save one, do it from a transition or entry
 * hook.<br>
 */
public final class Workflow {
  private static final TransitionExecutor executor = new TransitionExecutor();

  private final String id = UUID.randomUUID().toString();
  private final Specification specification;
  private final Object host;
  private final WorkflowStatistics statistics;

  private State currentState;
  private boolean halted;
  private String haltedReason;

  private Workflow(final Specification specification, final Object host, final State initial) {
    this.specification = specification;
    this.host = host;
    this.currentState = initial;
    this.statistics = new WorkflowStatistics(id);
  }

  public static Workflow bind(final Specification specification) throws WorkflowException {
    return bind(specification, null);
  }

  public static Workflow bind(final Specification specification, final Object host)
      throws WorkflowException {
    return restore(specification, host, null);
  }

  /**
   * Bind to the specification registered under the given name.
   */
  public static Workflow bind(final String specificationName) throws WorkflowException {
    return bind(SpecificationRegistry.getInstance().require(specificationName), null);
  }

  /**
   * Bind and resume from a state name read from the host's own storage. A null or blank stored
   * value means the workflow has not started yet and begins in the initial state.
   */
  public static Workflow restore(final Specification specification, final Object host,
      final String storedState) throws WorkflowException {
    if (specification == null) {
      throw new WorkflowException(WorkflowException.Code.UNKNOWN_SPECIFICATION,
          "Cannot bind a workflow to a null specification");
    }
    final State initial = specification.getInitialState();
    if (initial == null) {
      throw new WorkflowException(WorkflowException.Code.EMPTY_SPECIFICATION,
          "Workflow '" + specification.getName() + "' declares no states");
    }
    State current = initial;
    if (storedState != null && !storedState.trim().isEmpty()) {
      current = specification.getState(storedState);
      if (current == null) {
        throw new WorkflowException(WorkflowException.Code.UNKNOWN_STATE, String.format(
            "Stored state '%s' is not declared by workflow '%s', declared states: %s",
            storedState, specification.getName(), specification.getStateNames()));
      }
    }
    return new Workflow(specification, host, current);
  }

  /**
   * Fire an event. A halt raised by the event's action is reported through the returned result
   * and {@link #isHalted()}, never as an exception.
   *
   * @throws UndefinedTransitionException if the current state does not declare the event
   * @throws UnresolvedTargetException if the event's target state is not declared
   * @throws WorkflowException with code HOOK_FAILURE if the action or a hook failed
   */
  public TransitionResult fire(final String eventName, final Object... args)
      throws WorkflowException {
    return executor.execute(this, eventName, args == null ? new Object[0] : args);
  }

  /**
   * Same as {@link #fire(String, Object...)}, except that a halted transition is raised as a
   * {@link HaltedException}. {@link #isHalted()} and {@link #getHaltedBecause()} report the halt
   * either way.
   */
  public TransitionResult fireOrThrow(final String eventName, final Object... args)
      throws WorkflowException {
    final TransitionResult result = fire(eventName, args);
    if (result.isHalted()) {
      throw new HaltedException(currentState.getName(), eventName, haltedReason);
    }
    return result;
  }

  public boolean canFire(final String eventName) {
    return currentState.hasEvent(eventName);
  }

  public List<String> getAvailableEvents() {
    return currentState.getEventNames();
  }

  public State getCurrentState() {
    return currentState;
  }

  public String getCurrentStateName() {
    return currentState.getName();
  }

  public boolean isState(final String stateName) {
    return currentState.getName().equals(stateName);
  }

  /**
   * True iff the action of the last fired event halted the transition.
   */
  public boolean isHalted() {
    return halted;
  }

  public Optional<String> getHaltedBecause() {
    return Optional.ofNullable(haltedReason);
  }

  public String getId() {
    return id;
  }

  public Specification getSpecification() {
    return specification;
  }

  public Object getHost() {
    return host;
  }

  public <T> T getHost(final Class<T> type) {
    return type.cast(host);
  }

  public WorkflowStatistics getStatistics() {
    return statistics;
  }

  void resetHalt() {
    halted = false;
    haltedReason = null;
  }

  void recordHalt(final String reason) {
    halted = true;
    haltedReason = reason;
  }

  void moveTo(final State nextState) {
    currentState = nextState;
  }

  @Override
  public String toString() {
    return "Workflow [id=" + id + ", specification=" + specification.getName()
        + ", currentState=" + currentState.getName() + ", halted=" + halted + "]";
  }
}
