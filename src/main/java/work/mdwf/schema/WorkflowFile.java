package work.mdwf.schema;

/**
 * Root of a {@code workflow.yml} document.
 */
public record WorkflowFile(WorkflowDefinition workflow) {
    public WorkflowFile {
        SchemaChecks.requirePresent(workflow, "workflow");
    }

    public String name() {
        return workflow.name();
    }
}
