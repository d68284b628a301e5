package work.mdwf.api;

import java.util.List;
import java.util.Optional;
import work.mdwf.schema.ExternalConverterDefinition;
import work.mdwf.schema.ExternalProcessorDefinition;
import work.mdwf.schema.ProjectConfig;
import work.mdwf.schema.WorkflowFile;

/**
 * Uniform access to the resources a workflow needs: configuration, workflow definitions,
 * processor/converter definitions, templates and static assets.
 *
 * <p>Callers must not depend on the backing implementation. Failures follow one taxonomy:
 * {@link ResourceNotFoundException} for absent resources, {@link ValidationException} for
 * present but invalid ones, {@link EnvironmentSecurityException} for unsafe requests.
 * The {@code has*} checks never throw.</p>
 */
public interface Environment {
    /**
     * Makes the environment queryable. Safe to call repeatedly; the default is a no-op for
     * implementations that need no preparation.
     */
    default void initialize() {}

    /**
     * The parsed project configuration, or empty when no config file exists.
     */
    Optional<ProjectConfig> getConfig();

    WorkflowFile getWorkflow(String name);

    List<String> listWorkflows();

    default boolean hasWorkflow(String name) {
        try {
            return listWorkflows().contains(name);
        } catch (RuntimeException ex) {
            return false;
        }
    }

    List<ExternalProcessorDefinition> getProcessorDefinitions();

    List<ExternalConverterDefinition> getConverterDefinitions();

    /**
     * Template content, preferring the requested variant over the default rendering.
     */
    String getTemplate(TemplateRequest request);

    default boolean hasTemplate(TemplateRequest request) {
        return resolves(() -> getTemplate(request));
    }

    byte[] getStatic(StaticRequest request);

    default boolean hasStatic(StaticRequest request) {
        return resolves(() -> getStatic(request));
    }

    EnvironmentManifest getManifest();

    private static boolean resolves(Runnable lookup) {
        try {
            lookup.run();
            return true;
        } catch (ResourceNotFoundException | EnvironmentSecurityException ex) {
            return false;
        } catch (RuntimeException ex) {
            // present but unreadable still counts as present
            return true;
        }
    }
}
