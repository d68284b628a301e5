package work.mdwf.environment;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.mdwf.api.Environment;
import work.mdwf.api.StaticRequest;
import work.mdwf.api.TemplateRequest;
import work.mdwf.schema.ExternalConverterDefinition;
import work.mdwf.schema.ExternalProcessorDefinition;
import work.mdwf.schema.ProjectConfig;
import work.mdwf.schema.WorkflowDefinition;
import work.mdwf.schema.WorkflowFile;

/**
 * Lazily loaded view of the resources one workflow needs. The first
 * {@link #loadResources()} call is memoized until {@link #reloadResources()}.
 */
public final class WorkflowContext {
    private static final Logger log = LoggerFactory.getLogger(WorkflowContext.class);

    private final Environment environment;
    private final String workflowName;
    private WorkflowResources resources;

    public WorkflowContext(Environment environment, String workflowName) {
        this.environment = Objects.requireNonNull(environment, "environment");
        this.workflowName = Objects.requireNonNull(workflowName, "workflowName");
    }

    public String workflowName() {
        return workflowName;
    }

    public Environment environment() {
        return environment;
    }

    public synchronized WorkflowResources loadResources() {
        if (resources != null) {
            return resources;
        }
        log.info("Loading resources for workflow {}", workflowName);
        WorkflowFile workflow = environment.getWorkflow(workflowName);
        Optional<ProjectConfig> config = environment.getConfig();
        List<String> requiredProcessors = requiredProcessors(workflow.workflow());
        List<String> requiredConverters = requiredConverters(workflow.workflow());
        log.debug("Workflow {} requires processors {} and converters {}", workflowName, requiredProcessors, requiredConverters);

        List<ExternalProcessorDefinition> processors = environment.getProcessorDefinitions().stream()
            .filter(definition -> requiredProcessors.contains(definition.name()))
            .toList();
        List<ExternalConverterDefinition> converters = environment.getConverterDefinitions().stream()
            .filter(definition -> requiredConverters.contains(definition.name()))
            .toList();

        resources = new WorkflowResources(workflow, config, requiredProcessors, requiredConverters, processors, converters);
        log.info(
            "Loaded resources for workflow {} ({} processor and {} converter definitions)",
            workflowName,
            processors.size(),
            converters.size()
        );
        return resources;
    }

    public synchronized WorkflowResources reloadResources() {
        resources = null;
        return loadResources();
    }

    public WorkflowFile getWorkflow() {
        return loadResources().workflow();
    }

    public Optional<ProjectConfig> getConfig() {
        return loadResources().config();
    }

    /**
     * @throws IllegalArgumentException when the workflow declares no action with that name
     */
    public WorkflowDefinition.Action getAction(String actionName) {
        WorkflowDefinition definition = getWorkflow().workflow();
        return definition.action(actionName).orElseThrow(() -> new IllegalArgumentException(
            "Action '" + actionName + "' not found in workflow '" + workflowName + "'. Available actions: "
                + definition.actions().stream().map(WorkflowDefinition.Action::name).collect(Collectors.joining(", "))
        ));
    }

    public String getTemplate(String templateName) {
        return environment.getTemplate(TemplateRequest.of(workflowName, templateName));
    }

    public String getTemplate(String templateName, String variant) {
        return environment.getTemplate(TemplateRequest.of(workflowName, templateName, variant));
    }

    public boolean hasTemplate(String templateName, String variant) {
        return environment.hasTemplate(TemplateRequest.of(workflowName, templateName, variant));
    }

    public byte[] getStatic(String staticName) {
        return environment.getStatic(StaticRequest.of(workflowName, staticName));
    }

    public boolean hasStatic(String staticName) {
        return environment.hasStatic(StaticRequest.of(workflowName, staticName));
    }

    private static List<String> requiredProcessors(WorkflowDefinition workflow) {
        Set<String> names = new LinkedHashSet<>();
        for (var action : workflow.actions()) {
            for (var processor : action.processors()) {
                if (processor.isEnabled()) {
                    names.add(processor.name());
                }
            }
        }
        return List.copyOf(names);
    }

    private static List<String> requiredConverters(WorkflowDefinition workflow) {
        Set<String> names = new LinkedHashSet<>();
        for (var action : workflow.actions()) {
            if (action.converter() != null && !action.converter().isBlank()) {
                names.add(action.converter());
            }
        }
        return List.copyOf(names);
    }

    /**
     * Everything loaded for one workflow. The definition lists hold only the processors and
     * converters the workflow's actions reference.
     */
    public record WorkflowResources(
        WorkflowFile workflow,
        Optional<ProjectConfig> config,
        List<String> requiredProcessors,
        List<String> requiredConverters,
        List<ExternalProcessorDefinition> processorDefinitions,
        List<ExternalConverterDefinition> converterDefinitions
    ) {}
}
