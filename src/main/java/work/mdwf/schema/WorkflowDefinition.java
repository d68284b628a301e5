package work.mdwf.schema;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Optional;

/**
 * A workflow: its stages, templates, statics, actions and collection rules.
 */
public record WorkflowDefinition(
    String name,
    String description,
    String version,
    List<Stage> stages,
    List<TemplateRef> templates,
    List<StaticRef> statics,
    List<Action> actions,
    Metadata metadata,
    @JsonProperty("collection_id") CollectionIdRule collectionId
) {
    private static final List<String> PARAMETER_TYPES = List.of("string", "number", "boolean", "enum", "array", "date");

    public WorkflowDefinition {
        SchemaChecks.requireText(name, "workflow.name");
        SchemaChecks.requireText(description, "workflow.description");
        SchemaChecks.requireText(version, "workflow.version");
        SchemaChecks.requirePresent(stages, "workflow.stages");
        stages = List.copyOf(stages);
        templates = SchemaChecks.listOrEmpty(templates);
        statics = SchemaChecks.listOrEmpty(statics);
        actions = SchemaChecks.listOrEmpty(actions);
        SchemaChecks.requirePresent(metadata, "workflow.metadata");
        SchemaChecks.requirePresent(collectionId, "workflow.collection_id");
    }

    public Optional<Action> action(String actionName) {
        return actions.stream().filter(action -> action.name().equals(actionName)).findFirst();
    }

    public record Stage(String name, String description, String color, List<String> next, Boolean terminal) {
        public Stage {
            SchemaChecks.requireText(name, "stage.name");
            SchemaChecks.requireText(description, "stage.description");
            SchemaChecks.requireText(color, "stage.color");
            next = SchemaChecks.listOrEmpty(next);
        }

        public boolean isTerminal() {
            return Boolean.TRUE.equals(terminal);
        }
    }

    public record TemplateRef(String name, String file, String output, String description) {
        public TemplateRef {
            SchemaChecks.requireText(name, "template.name");
            SchemaChecks.requireText(file, "template.file");
            SchemaChecks.requireText(output, "template.output");
        }
    }

    public record StaticRef(String name, String file, String description) {
        public StaticRef {
            SchemaChecks.requireText(name, "static.name");
            SchemaChecks.requireText(file, "static.file");
        }
    }

    public record Action(
        String name,
        String description,
        List<String> templates,
        String converter,
        List<String> formats,
        List<ActionProcessor> processors,
        List<ActionParameter> parameters,
        @JsonProperty("metadata_file") String metadataFile
    ) {
        public Action {
            SchemaChecks.requireText(name, "action.name");
            SchemaChecks.requireText(description, "action.description");
            templates = SchemaChecks.listOrEmpty(templates);
            formats = SchemaChecks.listOrEmpty(formats);
            processors = SchemaChecks.listOrEmpty(processors);
            parameters = SchemaChecks.listOrEmpty(parameters);
        }
    }

    public record ActionProcessor(String name, Boolean enabled) {
        public ActionProcessor {
            SchemaChecks.requireText(name, "processor.name");
        }

        public boolean isEnabled() {
            return !Boolean.FALSE.equals(enabled);
        }
    }

    public record ActionParameter(
        String name,
        String type,
        Boolean required,
        @JsonProperty("default") Object defaultValue,
        List<String> options,
        String description
    ) {
        public ActionParameter {
            SchemaChecks.requireText(name, "parameter.name");
            SchemaChecks.requireText(type, "parameter.type");
            SchemaChecks.requireOneOf(type, "parameter.type", PARAMETER_TYPES);
            options = SchemaChecks.listOrEmpty(options);
        }
    }

    public record Metadata(
        @JsonProperty("required_fields") List<String> requiredFields,
        @JsonProperty("optional_fields") List<String> optionalFields,
        @JsonProperty("auto_generated") List<String> autoGenerated
    ) {
        public Metadata {
            requiredFields = SchemaChecks.listOrEmpty(requiredFields);
            optionalFields = SchemaChecks.listOrEmpty(optionalFields);
            autoGenerated = SchemaChecks.listOrEmpty(autoGenerated);
        }
    }

    public record CollectionIdRule(String pattern, @JsonProperty("max_length") Integer maxLength) {
        public CollectionIdRule {
            SchemaChecks.requireText(pattern, "collection_id.pattern");
            SchemaChecks.requirePresent(maxLength, "collection_id.max_length");
        }
    }
}
