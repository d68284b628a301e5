package work.mdwf.schema;

/**
 * How an external tool is detected: a detection command and an optional content pattern.
 */
public record CliDetection(String command, String pattern) {
    public CliDetection {
        SchemaChecks.requireText(command, "detection.command");
    }
}
