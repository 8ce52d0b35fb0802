package com.github.workflow;

/**
 * Root of all exceptions thrown by the workflow engine. The code enum encapsulates the various
 * error conditions; subclasses exist only where the condition carries a payload callers are
 * expected to inspect (legal events, halt reason, missing target).
 */
public class WorkflowException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public WorkflowException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public WorkflowException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public WorkflowException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    UNDEFINED_TRANSITION("Event is not defined for the current state"),
    // 2.
    UNRESOLVED_TARGET("Event transitions to a state that the specification does not declare"),
    // 3.
    HALTED("Transition was halted by the event action"),
    // 4.
    UNKNOWN_SPECIFICATION("No specification is registered under the given name"),
    // 5.
    UNKNOWN_STATE("State is not declared by the specification"),
    // 6.
    UNKNOWN_EVENT("Event is not declared by the state"),
    // 7.
    EMPTY_SPECIFICATION("Specification declares no states and cannot be bound"),
    // 8.
    INVALID_NAME("Name cannot be null, blank or longer than the configured maximum"),
    // 9.
    REDEFINITION_REJECTED("Re-declaration of an existing definition is rejected by policy"),
    // 10.
    HOOK_FAILURE("Action or hook failed. Check exception cause for more details of the failure"),
    // 11.
    INVALID_CONFIG("Workflow configuration is invalid");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
