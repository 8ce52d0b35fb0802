package com.github.workflow;

/**
 * Fired right before a workflow leaves the state owning this hook. The workflow still reports the
 * old state while this runs.
 */
@FunctionalInterface
public interface ExitHook {

  void onExit(final Workflow workflow, final State nextState, final String eventName,
      final Object[] args) throws Exception;
}
