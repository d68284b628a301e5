package work.mdwf.schema;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * How an external tool is invoked.
 */
public record CliExecution(
    @JsonProperty("command_template") String commandTemplate,
    String mode,
    Boolean backup,
    Integer timeout
) {
    public CliExecution {
        SchemaChecks.requireText(commandTemplate, "execution.command_template");
        SchemaChecks.requireOneOf(mode, "execution.mode", List.of("in-place", "output"));
    }
}
