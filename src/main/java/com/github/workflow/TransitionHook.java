package com.github.workflow;

/**
 * Specification-wide hook fired for every transition that was not halted, regardless of the event
 * that triggered it. Hooks fire in registration order, before the source state's exit hook.
 */
@FunctionalInterface
public interface TransitionHook {

  void onTransition(final Workflow workflow, final State fromState, final State toState,
      final String eventName, final Object[] args) throws Exception;
}
