package com.github.workflow;

/**
 * Simple statistics holder for a workflow instance. Updated by the executor only, with the same
 * (lack of) thread-safety as the workflow itself.
 */
public final class WorkflowStatistics {
  private final long startMillis = System.currentTimeMillis();
  private final String workflowId;
  int transitionSuccesses;
  int transitionHalts;
  int transitionFailures;
  long lastTransitionMillis;

  WorkflowStatistics(final String workflowId) {
    this.workflowId = workflowId;
  }

  public String getWorkflowId() {
    return workflowId;
  }

  public int getTransitionSuccesses() {
    return transitionSuccesses;
  }

  public int getTransitionHalts() {
    return transitionHalts;
  }

  /**
   * Attempts that ended in an exception other than a halt: undefined events, unresolved targets
   * and failing hooks.
   */
  public int getTransitionFailures() {
    return transitionFailures;
  }

  public long getLastTransitionMillis() {
    return lastTransitionMillis;
  }

  public long getAliveTimeMillis() {
    return System.currentTimeMillis() - startMillis;
  }

  @Override
  public String toString() {
    return "WorkflowStatistics [workflowId=" + workflowId + ", transitionSuccesses="
        + transitionSuccesses + ", transitionHalts=" + transitionHalts + ", transitionFailures="
        + transitionFailures + ", lastTransitionMillis=" + lastTransitionMillis
        + ", aliveTimeMillis=" + getAliveTimeMillis() + "]";
  }
}
