package com.github.workflow;

/**
 * Fired after a workflow has moved into the state owning this hook.
 */
@FunctionalInterface
public interface EntryHook {

  /**
   * @param priorState the state the workflow just left
   * @param eventName the event that caused the transition
   * @param args the arguments the event was fired with, shared with every other routine of the
   *        same firing
   */
  void onEntry(final Workflow workflow, final State priorState, final String eventName,
      final Object[] args) throws Exception;
}
