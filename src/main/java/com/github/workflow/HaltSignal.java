package com.github.workflow;

/**
 * Non-local exit out of an {@link Action}. Raised only by {@link ActionContext#halt(String)} and
 * caught only by the executor that created that context. The halt itself is already recorded on
 * the workflow when this is thrown.
 */
final class HaltSignal extends RuntimeException {
  private static final long serialVersionUID = 1L;
  private final transient ActionContext origin;

  HaltSignal(final ActionContext origin, final String reason) {
    super(reason, null, false, false);
    this.origin = origin;
  }

  boolean raisedBy(final ActionContext context) {
    return origin == context;
  }
}
