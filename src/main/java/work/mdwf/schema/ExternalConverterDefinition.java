package work.mdwf.schema;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * A user-defined converter declared in {@code converters/<name>.yml}.
 */
public record ExternalConverterDefinition(
    String name,
    String description,
    String version,
    @JsonProperty("supported_formats") List<String> supportedFormats,
    CliDetection detection,
    CliExecution execution
) {
    public ExternalConverterDefinition {
        SchemaChecks.requireText(name, "converter.name");
        supportedFormats = SchemaChecks.listOrEmpty(supportedFormats);
        SchemaChecks.requirePresent(detection, "converter.detection");
        SchemaChecks.requirePresent(execution, "converter.execution");
    }
}
