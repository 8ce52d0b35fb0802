package com.github.workflow;

/**
 * Routine run when an event fires, before any transition hook. An action may veto the transition
 * by calling {@link ActionContext#halt(String)}, which abandons the rest of the action.
 */
@FunctionalInterface
public interface Action {

  void execute(final ActionContext context) throws Exception;
}
