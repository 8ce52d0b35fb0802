package com.github.workflow;

/**
 * This class encapsulates the configuration used while compiling specifications. Use the
 * {@code WorkflowConfigurationBuilder} to build it, or {@link #defaults()}.
 *
 * Notes:<br>
 * 1. If no redefinition policy is set, {@link RedefinitionPolicy#OVERWRITE} is used.<br>
 * 2. If maxNameLength is not set or not positive, names of up to 64 characters are accepted.<br>
 */
public final class WorkflowConfiguration {
  static final int defaultMaxNameLength = 64;
  private static final WorkflowConfiguration DEFAULTS =
      new WorkflowConfiguration(RedefinitionPolicy.OVERWRITE, defaultMaxNameLength);

  private final RedefinitionPolicy redefinitionPolicy;
  private final int maxNameLength;

  public static WorkflowConfiguration defaults() {
    return DEFAULTS;
  }

  public RedefinitionPolicy getRedefinitionPolicy() {
    return redefinitionPolicy;
  }

  public int getMaxNameLength() {
    return maxNameLength;
  }

  public final static class WorkflowConfigurationBuilder {
    private RedefinitionPolicy redefinitionPolicy = RedefinitionPolicy.OVERWRITE;
    private int maxNameLength;

    public static WorkflowConfigurationBuilder newBuilder() {
      return new WorkflowConfigurationBuilder();
    }

    public WorkflowConfigurationBuilder redefinitionPolicy(
        final RedefinitionPolicy redefinitionPolicy) {
      this.redefinitionPolicy = redefinitionPolicy;
      return this;
    }

    public WorkflowConfigurationBuilder maxNameLength(final int maxNameLength) {
      this.maxNameLength = maxNameLength;
      return this;
    }

    public WorkflowConfiguration build() throws WorkflowException {
      final WorkflowConfiguration config =
          new WorkflowConfiguration(redefinitionPolicy, maxNameLength);
      config.validate();
      return config;
    }

    private WorkflowConfigurationBuilder() {}
  }

  /**
   * Throws {@link WorkflowException.Code#INVALID_NAME} for null, blank or over-long names.
   */
  String checkName(final String kind, final String name) throws WorkflowException {
    if (name == null || name.trim().isEmpty()) {
      throw new WorkflowException(WorkflowException.Code.INVALID_NAME,
          kind + " name cannot be null or blank");
    }
    if (name.length() > maxNameLength) {
      throw new WorkflowException(WorkflowException.Code.INVALID_NAME, String.format(
          "%s name '%s' is longer than %d characters", kind, name, maxNameLength));
    }
    return name;
  }

  private void validate() throws WorkflowException {
    StringBuilder messages = new StringBuilder();
    if (redefinitionPolicy == null) {
      messages.append("RedefinitionPolicy cannot be null. ");
    }
    if (messages.length() > 0) {
      throw new WorkflowException(WorkflowException.Code.INVALID_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "WorkflowConfiguration [redefinitionPolicy=" + redefinitionPolicy + ", maxNameLength="
        + maxNameLength + "]";
  }

  private WorkflowConfiguration(final RedefinitionPolicy redefinitionPolicy,
      final int maxNameLength) {
    this.redefinitionPolicy = redefinitionPolicy;
    if (maxNameLength <= 0) {
      this.maxNameLength = defaultMaxNameLength;
    } else {
      this.maxNameLength = maxNameLength;
    }
  }

}
