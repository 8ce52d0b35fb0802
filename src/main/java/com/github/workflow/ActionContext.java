package com.github.workflow;

/**
 * What an {@link Action} gets to see of the firing it runs in: the workflow, the event and the
 * event arguments. The argument array is the same instance every hook of this firing receives.
 *
 * Actions that catch {@link RuntimeException} broadly will also catch the halt signal; the halt is
 * still recorded and the transition still stops, but the rest of the action keeps running.
 */
public final class ActionContext {
  private final Workflow workflow;
  private final Event event;
  private final Object[] args;

  ActionContext(final Workflow workflow, final Event event, final Object[] args) {
    this.workflow = workflow;
    this.event = event;
    this.args = args;
  }

  public Workflow getWorkflow() {
    return workflow;
  }

  public Event getEvent() {
    return event;
  }

  public Object[] getArgs() {
    return args;
  }

  public int getArgCount() {
    return args.length;
  }

  /**
   * @throws IndexOutOfBoundsException if the event was fired with fewer arguments
   * @throws ClassCastException if the argument is not of the requested type
   */
  public <T> T getArg(final int index, final Class<T> type) {
    if (index < 0 || index >= args.length) {
      throw new IndexOutOfBoundsException(
          "Event '" + event.getName() + "' was fired with " + args.length + " argument(s)");
    }
    return type.cast(args[index]);
  }

  public void halt() {
    halt(null);
  }

  /**
   * Abort the transition. The workflow keeps its current state, reports itself as halted with the
   * given reason and none of the transition hooks fire. Never returns normally.
   */
  public void halt(final String reason) {
    workflow.recordHalt(reason);
    throw new HaltSignal(this, reason);
  }
}
