package work.mdwf.environment;

/**
 * A CLI environment paired with the context of the workflow it was opened for.
 */
public record WorkflowEnvironment(MergedEnvironment environment, WorkflowContext context) {}
