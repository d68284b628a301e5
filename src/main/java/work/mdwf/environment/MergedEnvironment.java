package work.mdwf.environment;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import work.mdwf.api.Environment;
import work.mdwf.api.EnvironmentManifest;
import work.mdwf.api.ResourceNotFoundException;
import work.mdwf.api.StaticRequest;
import work.mdwf.api.TemplateRequest;
import work.mdwf.schema.ExternalConverterDefinition;
import work.mdwf.schema.ExternalProcessorDefinition;
import work.mdwf.schema.ProjectConfig;
import work.mdwf.schema.WorkflowFile;

/**
 * Layers a project-local environment over a system-global one. Local resources win; the
 * global side is consulted only when the local side reports a resource as not found, so a
 * broken local resource is never masked by a healthy global one.
 */
public final class MergedEnvironment implements Environment {
    private final Environment local;
    private final Environment global;

    public MergedEnvironment(Environment local, Environment global) {
        this.local = Objects.requireNonNull(local, "local");
        this.global = Objects.requireNonNull(global, "global");
    }

    public Environment getLocalEnvironment() {
        return local;
    }

    public Environment getGlobalEnvironment() {
        return global;
    }

    @Override
    public void initialize() {
        local.initialize();
        global.initialize();
    }

    @Override
    public Optional<ProjectConfig> getConfig() {
        Optional<ProjectConfig> localConfig = local.getConfig();
        if (localConfig.isPresent()) {
            return localConfig;
        }
        return global.getConfig();
    }

    @Override
    public WorkflowFile getWorkflow(String name) {
        return localFirst(env -> env.getWorkflow(name));
    }

    @Override
    public List<String> listWorkflows() {
        var merged = new LinkedHashSet<String>(local.listWorkflows());
        merged.addAll(global.listWorkflows());
        return new ArrayList<>(merged);
    }

    @Override
    public boolean hasWorkflow(String name) {
        return local.hasWorkflow(name) || global.hasWorkflow(name);
    }

    @Override
    public List<ExternalProcessorDefinition> getProcessorDefinitions() {
        return unionByName(
            local.getProcessorDefinitions(),
            global.getProcessorDefinitions(),
            ExternalProcessorDefinition::name
        );
    }

    @Override
    public List<ExternalConverterDefinition> getConverterDefinitions() {
        return unionByName(
            local.getConverterDefinitions(),
            global.getConverterDefinitions(),
            ExternalConverterDefinition::name
        );
    }

    @Override
    public String getTemplate(TemplateRequest request) {
        return localFirst(env -> env.getTemplate(request));
    }

    @Override
    public boolean hasTemplate(TemplateRequest request) {
        return local.hasTemplate(request) || global.hasTemplate(request);
    }

    @Override
    public byte[] getStatic(StaticRequest request) {
        return localFirst(env -> env.getStatic(request));
    }

    @Override
    public boolean hasStatic(StaticRequest request) {
        return local.hasStatic(request) || global.hasStatic(request);
    }

    @Override
    public EnvironmentManifest getManifest() {
        return EnvironmentManifest.merge(local.getManifest(), global.getManifest());
    }

    public ResourceOrigin getResourceSource(String workflow) {
        return originOf(env -> env.hasWorkflow(workflow));
    }

    public ResourceOrigin getResourceSource(TemplateRequest request) {
        return originOf(env -> env.hasTemplate(request));
    }

    public ResourceOrigin getResourceSource(StaticRequest request) {
        return originOf(env -> env.hasStatic(request));
    }

    private <T> T localFirst(Function<Environment, T> lookup) {
        try {
            return lookup.apply(local);
        } catch (ResourceNotFoundException ex) {
            return lookup.apply(global);
        }
    }

    private ResourceOrigin originOf(Predicate<Environment> holds) {
        if (holds.test(local)) {
            return ResourceOrigin.LOCAL;
        }
        if (holds.test(global)) {
            return ResourceOrigin.GLOBAL;
        }
        return ResourceOrigin.NONE;
    }

    private static <T> List<T> unionByName(List<T> localItems, List<T> globalItems, Function<T, String> name) {
        Map<String, T> merged = new LinkedHashMap<>();
        for (T item : localItems) {
            merged.put(name.apply(item), item);
        }
        for (T item : globalItems) {
            merged.putIfAbsent(name.apply(item), item);
        }
        return new ArrayList<>(merged.values());
    }
}
