package work.mdwf.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import work.mdwf.api.ValidationException;

/**
 * Parses and validates the YAML documents an environment serves. Every failure, whether
 * malformed YAML or a schema violation, is reported as a {@link ValidationException}.
 */
public final class ResourceSchemas {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ResourceSchemas() {}

    public static ProjectConfig parseProjectConfig(String content, String source) {
        return parse(content, ProjectConfig.class, "Invalid project config in " + source);
    }

    public static WorkflowFile parseWorkflow(String content, String workflowName) {
        return parse(content, WorkflowFile.class, "Invalid workflow definition for " + workflowName);
    }

    public static ExternalProcessorDefinition parseProcessor(String content, String source) {
        return parse(content, ProcessorFile.class, "Invalid processor definition in " + source).processor();
    }

    public static ExternalConverterDefinition parseConverter(String content, String source) {
        return parse(content, ConverterFile.class, "Invalid converter definition in " + source).converter();
    }

    private static <T> T parse(String content, Class<T> type, String context) {
        if (content == null || content.isBlank()) {
            throw new ValidationException(context + ": document is empty");
        }
        T value;
        try {
            value = YAML_MAPPER.readValue(content, type);
        } catch (JsonMappingException ex) {
            throw new ValidationException(context + ": " + describe(ex), ex);
        } catch (JsonProcessingException ex) {
            throw new ValidationException(context + ": " + ex.getOriginalMessage(), ex);
        }
        if (value == null) {
            throw new ValidationException(context + ": document is empty");
        }
        return value;
    }

    private static String describe(JsonMappingException ex) {
        Throwable root = ex;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        if (root instanceof IllegalArgumentException) {
            return root.getMessage();
        }
        return ex.getOriginalMessage();
    }

    record ProcessorFile(ExternalProcessorDefinition processor) {
        ProcessorFile {
            SchemaChecks.requirePresent(processor, "processor");
        }
    }

    record ConverterFile(ExternalConverterDefinition converter) {
        ConverterFile {
            SchemaChecks.requirePresent(converter, "converter");
        }
    }
}
