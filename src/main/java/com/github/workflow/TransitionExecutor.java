package com.github.workflow;

import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs one event firing against one workflow. The order below is fixed:
 *
 * 0. resolve the event in the current state and its target state in the specification<br>
 * 1. clear any halt left over from the previous firing<br>
 * 2. run the event's action, which may halt<br>
 * 3. stop here if halted: no hooks fire and the state does not change<br>
 * 4. fire the specification's transition hooks in registration order<br>
 * 5. fire the current state's exit hook<br>
 * 6. move the workflow to the target state<br>
 * 7. fire the target state's entry hook<br>
 *
 * Step 6 is the only place a workflow's state changes. A routine that fails aborts the sequence
 * where it stands, so a failing entry hook leaves the workflow already moved.
 *
 * The executor holds no state of its own and takes no locks.
 */
final class TransitionExecutor {
  private static final Logger logger =
      LogManager.getLogger(TransitionExecutor.class.getSimpleName());

  TransitionResult execute(final Workflow workflow, final String eventName, final Object[] args)
      throws WorkflowException {
    final Specification specification = workflow.getSpecification();
    final State fromState = workflow.getCurrentState();
    final WorkflowStatistics stats = workflow.getStatistics();

    final Event event = eventName == null ? null : fromState.getEvent(eventName);
    if (event == null) {
      stats.transitionFailures++;
      final UndefinedTransitionException undefined = new UndefinedTransitionException(
          specification.getName(), fromState.getName(), eventName, fromState.getEventNames());
      logWarning(workflow, undefined.getMessage());
      throw undefined;
    }
    final State toState = specification.getState(event.getTransitionsTo());
    if (toState == null) {
      stats.transitionFailures++;
      final UnresolvedTargetException unresolved = new UnresolvedTargetException(
          specification.getName(), fromState.getName(), eventName, event.getTransitionsTo());
      logWarning(workflow, unresolved.getMessage());
      throw unresolved;
    }

    // 1.
    workflow.resetHalt();

    // 2.
    final Optional<Action> action = event.getAction();
    if (action.isPresent()) {
      final ActionContext context = new ActionContext(workflow, event, args);
      try {
        logDebug(workflow, "Running action of event " + eventName);
        action.get().execute(context);
      } catch (HaltSignal signal) {
        if (!signal.raisedBy(context)) {
          throw signal;
        }
      } catch (WorkflowException problem) {
        stats.transitionFailures++;
        throw problem;
      } catch (Exception problem) {
        stats.transitionFailures++;
        throw failure(workflow, "action of event '" + eventName + "'", problem);
      }
    }

    // 3.
    if (workflow.isHalted()) {
      stats.transitionHalts++;
      logInfo(workflow, String.format("Halted %s in %s: %s", eventName, fromState.getName(),
          workflow.getHaltedBecause().orElse("no reason given")));
      return TransitionResult.halted(eventName, fromState,
          workflow.getHaltedBecause().orElse(null));
    }

    // 4.
    for (final TransitionHook hook : specification.getTransitionHooks()) {
      try {
        logDebug(workflow, "Firing on_transition hook " + hook);
        hook.onTransition(workflow, fromState, toState, eventName, args);
      } catch (WorkflowException problem) {
        stats.transitionFailures++;
        throw problem;
      } catch (Exception problem) {
        stats.transitionFailures++;
        throw failure(workflow, "on_transition hook", problem);
      }
    }

    // 5.
    if (fromState.getOnExit().isPresent()) {
      try {
        logDebug(workflow, "Firing on_exit hook of " + fromState.getName());
        fromState.getOnExit().get().onExit(workflow, toState, eventName, args);
      } catch (WorkflowException problem) {
        stats.transitionFailures++;
        throw problem;
      } catch (Exception problem) {
        stats.transitionFailures++;
        throw failure(workflow, "on_exit hook of state '" + fromState.getName() + "'", problem);
      }
    }

    // 6.
    workflow.moveTo(toState);
    stats.transitionSuccesses++;
    stats.lastTransitionMillis = System.currentTimeMillis();

    // 7.
    if (toState.getOnEntry().isPresent()) {
      try {
        logDebug(workflow, "Firing on_entry hook of " + toState.getName());
        toState.getOnEntry().get().onEntry(workflow, fromState, eventName, args);
      } catch (WorkflowException problem) {
        // the move already counted as a success
        throw problem;
      } catch (Exception problem) {
        throw failure(workflow, "on_entry hook of state '" + toState.getName() + "'", problem);
      }
    }

    logInfo(workflow, String.format("Successfully transitioned from %s->%s on %s",
        fromState.getName(), toState.getName(), eventName));
    return TransitionResult.transitioned(eventName, fromState, toState);
  }

  private static WorkflowException failure(final Workflow workflow, final String routine,
      final Exception problem) {
    final String message = String.format("Failed running %s in state %s", routine,
        workflow.getCurrentStateName());
    logError(workflow, message, problem);
    return new WorkflowException(WorkflowException.Code.HOOK_FAILURE, message, problem);
  }

  private static String prefix(final Workflow workflow) {
    return new StringBuilder().append("[s:").append(workflow.getSpecification().getName())
        .append("][w:").append(workflow.getId()).append("] ").toString();
  }

  private static void logError(final Workflow workflow, final String message,
      final Throwable error) {
    logger.error(prefix(workflow) + message, error);
  }

  private static void logWarning(final Workflow workflow, final String message) {
    logger.warn(prefix(workflow) + message);
  }

  private static void logInfo(final Workflow workflow, final String message) {
    logger.info(prefix(workflow) + message);
  }

  private static void logDebug(final Workflow workflow, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(prefix(workflow) + message);
    }
  }
}
