package work.mdwf.schema;

/**
 * A user-defined processor declared in {@code processors/<name>.yml}.
 */
public record ExternalProcessorDefinition(
    String name,
    String description,
    String version,
    CliDetection detection,
    CliExecution execution
) {
    public ExternalProcessorDefinition {
        SchemaChecks.requireText(name, "processor.name");
        SchemaChecks.requirePresent(detection, "processor.detection");
        SchemaChecks.requirePresent(execution, "processor.execution");
    }
}
