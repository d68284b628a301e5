package work.mdwf.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.mdwf.api.ValidationException;
import work.mdwf.support.EnvironmentFixtures;

class ResourceSchemasTest {
    @Test
    void parsesWorkflowDefinition() {
        WorkflowFile file = ResourceSchemas.parseWorkflow(EnvironmentFixtures.workflowYaml("blog"), "blog");
        WorkflowDefinition workflow = file.workflow();

        assertEquals("blog", file.name());
        assertEquals(2, workflow.stages().size());
        assertTrue(workflow.stages().get(1).isTerminal());
        assertEquals(List.of("published"), workflow.stages().get(0).next());
        assertEquals(50, workflow.collectionId().maxLength());
        assertEquals(List.of("date"), workflow.metadata().autoGenerated());

        var action = workflow.action("format").orElseThrow();
        assertEquals("pandoc", action.converter());
        assertTrue(action.processors().get(0).isEnabled());
        assertFalse(action.processors().get(1).isEnabled());
        assertTrue(workflow.action("publish").isEmpty());
        assertTrue(workflow.statics().isEmpty());
    }

    @Test
    void missingRequiredWorkflowFieldIsValidationError() {
        String yaml = """
            workflow:
              name: broken
              version: 1.0.0
            """;
        var error = assertThrows(ValidationException.class, () -> ResourceSchemas.parseWorkflow(yaml, "broken"));
        assertTrue(error.getMessage().startsWith("Invalid workflow definition for broken"));
        assertEquals(ValidationException.CODE, error.code());
    }

    @Test
    void malformedYamlIsValidationError() {
        var error = assertThrows(
            ValidationException.class,
            () -> ResourceSchemas.parseWorkflow("workflow: [unclosed", "job")
        );
        assertTrue(error.getMessage().contains("job"));
    }

    @Test
    void emptyDocumentIsValidationError() {
        assertThrows(ValidationException.class, () -> ResourceSchemas.parseWorkflow("   ", "job"));
        assertThrows(ValidationException.class, () -> ResourceSchemas.parseProjectConfig("", "config.yml"));
    }

    @Test
    void rejectsUnknownParameterType() {
        String yaml = EnvironmentFixtures.workflowYaml("job").replace(
            "  metadata:",
            "      parameters:\n        - name: size\n          type: blob\n  metadata:"
        );
        var error = assertThrows(ValidationException.class, () -> ResourceSchemas.parseWorkflow(yaml, "job"));
        assertTrue(error.getMessage().contains("parameter.type"));
    }

    @Test
    void parsesProjectConfig() {
        ProjectConfig config = ResourceSchemas.parseProjectConfig(EnvironmentFixtures.CONFIG_YAML, "config.yml");
        assertEquals("Jane", config.user().preferredName());
        assertEquals("wget", config.system().scraper());
        assertEquals(List.of("docx", "html"), config.system().outputFormats());
        assertTrue(config.workflows().isEmpty());
    }

    @Test
    void rejectsInvalidEmail() {
        String yaml = EnvironmentFixtures.CONFIG_YAML.replace("jane@example.com", "not-an-address");
        var error = assertThrows(ValidationException.class, () -> ResourceSchemas.parseProjectConfig(yaml, "config.yml"));
        assertTrue(error.getMessage().contains("user.email"));
    }

    @Test
    void rejectsUnsupportedScraper() {
        String yaml = EnvironmentFixtures.CONFIG_YAML.replace("scraper: wget", "scraper: lynx");
        assertThrows(ValidationException.class, () -> ResourceSchemas.parseProjectConfig(yaml, "config.yml"));
    }

    @Test
    void parsesProcessorAndConverterDefinitions() {
        ExternalProcessorDefinition processor = ResourceSchemas.parseProcessor(
            EnvironmentFixtures.processorYaml("mermaid"),
            "processors/mermaid.yml"
        );
        assertEquals("mermaid", processor.name());
        assertEquals("output", processor.execution().mode());
        assertEquals("mermaid --version", processor.detection().command());

        ExternalConverterDefinition converter = ResourceSchemas.parseConverter(
            EnvironmentFixtures.converterYaml("pandoc"),
            "converters/pandoc.yml"
        );
        assertEquals(List.of("docx", "html"), converter.supportedFormats());
    }

    @Test
    void processorWithoutDetectionIsRejected() {
        String yaml = """
            processor:
              name: lonely
              execution:
                command_template: lonely {{input}}
            """;
        var error = assertThrows(
            ValidationException.class,
            () -> ResourceSchemas.parseProcessor(yaml, "processors/lonely.yml")
        );
        assertTrue(error.getMessage().startsWith("Invalid processor definition in processors/lonely.yml"));
    }
}
