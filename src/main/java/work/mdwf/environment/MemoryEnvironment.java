package work.mdwf.environment;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.mdwf.api.Environment;
import work.mdwf.api.EnvironmentException;
import work.mdwf.api.EnvironmentManifest;
import work.mdwf.api.ResourceNotFoundException;
import work.mdwf.api.StaticRequest;
import work.mdwf.api.TemplateRequest;
import work.mdwf.schema.ExternalConverterDefinition;
import work.mdwf.schema.ExternalProcessorDefinition;
import work.mdwf.schema.ProjectConfig;
import work.mdwf.schema.WorkflowFile;

/**
 * Mutable in-process environment for tests and embedding. Not safe for concurrent mutation.
 */
public final class MemoryEnvironment implements Environment {
    private static final Logger log = LoggerFactory.getLogger(MemoryEnvironment.class);

    private ProjectConfig config;
    private final Map<String, WorkflowFile> workflows = new LinkedHashMap<>();
    private final Map<String, ExternalProcessorDefinition> processors = new LinkedHashMap<>();
    private final Map<String, ExternalConverterDefinition> converters = new LinkedHashMap<>();
    private final Map<TemplateRequest, String> templates = new LinkedHashMap<>();
    private final Map<StaticRequest, byte[]> statics = new LinkedHashMap<>();

    @Override
    public Optional<ProjectConfig> getConfig() {
        return Optional.ofNullable(config);
    }

    @Override
    public WorkflowFile getWorkflow(String name) {
        WorkflowFile workflow = workflows.get(name);
        if (workflow == null) {
            throw new ResourceNotFoundException("Workflow", name);
        }
        return workflow;
    }

    @Override
    public List<String> listWorkflows() {
        return new ArrayList<>(workflows.keySet());
    }

    @Override
    public boolean hasWorkflow(String name) {
        return workflows.containsKey(name);
    }

    @Override
    public List<ExternalProcessorDefinition> getProcessorDefinitions() {
        return new ArrayList<>(processors.values());
    }

    @Override
    public List<ExternalConverterDefinition> getConverterDefinitions() {
        return new ArrayList<>(converters.values());
    }

    @Override
    public String getTemplate(TemplateRequest request) {
        String content = templates.get(request);
        if (content == null) {
            content = templates.get(request.withoutVariant());
        }
        if (content == null) {
            throw new ResourceNotFoundException("Template", request.key());
        }
        return content;
    }

    @Override
    public boolean hasTemplate(TemplateRequest request) {
        return templates.containsKey(request) || templates.containsKey(request.withoutVariant());
    }

    @Override
    public byte[] getStatic(StaticRequest request) {
        byte[] content = statics.get(request);
        if (content == null) {
            throw new ResourceNotFoundException("Static", request.key());
        }
        return content.clone();
    }

    @Override
    public boolean hasStatic(StaticRequest request) {
        return statics.containsKey(request);
    }

    /**
     * Recomputed on every call since the backing maps are mutable.
     */
    @Override
    public EnvironmentManifest getManifest() {
        Set<String> withResources = new LinkedHashSet<>(workflows.keySet());
        templates.keySet().forEach(request -> withResources.add(request.workflow()));
        statics.keySet().forEach(request -> withResources.add(request.workflow()));

        Map<String, List<String>> templateNames = new LinkedHashMap<>();
        Map<String, List<String>> staticNames = new LinkedHashMap<>();
        for (String workflow : withResources) {
            Set<String> names = new LinkedHashSet<>();
            templates.keySet().stream()
                .filter(request -> request.workflow().equals(workflow))
                .forEach(request -> names.add(request.template()));
            templateNames.put(workflow, new ArrayList<>(names));
            staticNames.put(workflow, statics.keySet().stream()
                .filter(request -> request.workflow().equals(workflow))
                .map(StaticRequest::staticName)
                .toList());
        }
        return new EnvironmentManifest(
            listWorkflows(),
            new ArrayList<>(processors.keySet()),
            new ArrayList<>(converters.keySet()),
            templateNames,
            staticNames,
            config != null
        );
    }

    public MemoryEnvironment setConfig(ProjectConfig config) {
        this.config = config;
        return this;
    }

    public MemoryEnvironment setWorkflow(String name, WorkflowFile workflow) {
        workflows.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(workflow, "workflow"));
        return this;
    }

    /**
     * Adds a processor, replacing any existing one with the same name.
     */
    public MemoryEnvironment addProcessor(ExternalProcessorDefinition processor) {
        processors.put(processor.name(), processor);
        return this;
    }

    public MemoryEnvironment addConverter(ExternalConverterDefinition converter) {
        converters.put(converter.name(), converter);
        return this;
    }

    public MemoryEnvironment setTemplate(TemplateRequest request, String content) {
        templates.put(request, Objects.requireNonNull(content, "content"));
        return this;
    }

    public MemoryEnvironment setStatic(StaticRequest request, byte[] content) {
        statics.put(request, Objects.requireNonNull(content, "content").clone());
        return this;
    }

    public MemoryEnvironment setStatic(StaticRequest request, String content) {
        return setStatic(request, content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Removes a workflow together with its templates and static files.
     */
    public void removeWorkflow(String name) {
        workflows.remove(name);
        templates.keySet().removeIf(request -> request.workflow().equals(name));
        statics.keySet().removeIf(request -> request.workflow().equals(name));
    }

    public void removeTemplate(TemplateRequest request) {
        templates.remove(request);
    }

    public void removeStatic(StaticRequest request) {
        statics.remove(request);
    }

    public void clear() {
        config = null;
        workflows.clear();
        processors.clear();
        converters.clear();
        templates.clear();
        statics.clear();
    }

    /**
     * Independent copy of the current contents.
     */
    public MemoryEnvironment snapshot() {
        var copy = new MemoryEnvironment();
        copy.config = config;
        copy.workflows.putAll(workflows);
        copy.processors.putAll(processors);
        copy.converters.putAll(converters);
        copy.templates.putAll(templates);
        statics.forEach((request, content) -> copy.statics.put(request, content.clone()));
        return copy;
    }

    /**
     * Copies from {@code other} everything this environment does not have yet. Templates are
     * copied in their default rendering, since a manifest does not list variants.
     */
    public void mergeFrom(Environment other) {
        if (config == null) {
            config = other.getConfig().orElse(null);
        }
        for (String workflow : other.listWorkflows()) {
            if (!workflows.containsKey(workflow)) {
                workflows.put(workflow, other.getWorkflow(workflow));
            }
        }
        other.getProcessorDefinitions().forEach(processor -> processors.putIfAbsent(processor.name(), processor));
        other.getConverterDefinitions().forEach(converter -> converters.putIfAbsent(converter.name(), converter));

        EnvironmentManifest manifest = other.getManifest();
        Set<String> names = new LinkedHashSet<>(manifest.workflows());
        names.addAll(manifest.templates().keySet());
        names.addAll(manifest.statics().keySet());
        for (String workflow : names) {
            for (String template : manifest.templatesFor(workflow)) {
                var request = TemplateRequest.of(workflow, template);
                if (templates.containsKey(request)) {
                    continue;
                }
                try {
                    templates.put(request, other.getTemplate(request));
                } catch (EnvironmentException ex) {
                    log.debug("Failed to copy template {}: {}", request.key(), ex.getMessage());
                }
            }
            for (String staticName : manifest.staticsFor(workflow)) {
                var request = StaticRequest.of(workflow, staticName);
                if (statics.containsKey(request)) {
                    continue;
                }
                try {
                    statics.put(request, other.getStatic(request));
                } catch (EnvironmentException ex) {
                    log.debug("Failed to copy static {}: {}", request.key(), ex.getMessage());
                }
            }
        }
    }
}
