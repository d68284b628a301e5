package work.mdwf.environment;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.mdwf.api.Environment;
import work.mdwf.api.EnvironmentManifest;
import work.mdwf.api.ResourceNotFoundException;
import work.mdwf.api.ValidationException;
import work.mdwf.security.SecurityConfig;
import work.mdwf.system.NioSystemInterface;
import work.mdwf.system.SystemInterface;

/**
 * Builds environments sharing one {@link SystemInterface} and {@link SecurityConfig}.
 */
public final class EnvironmentFactory {
    private static final Logger log = LoggerFactory.getLogger(EnvironmentFactory.class);

    private final SystemInterface system;
    private final SecurityConfig securityConfig;
    private final RootDiscovery discovery;

    public EnvironmentFactory() {
        this(NioSystemInterface.INSTANCE, SecurityConfig.defaults());
    }

    public EnvironmentFactory(SystemInterface system, SecurityConfig securityConfig) {
        this(system, securityConfig, new RootDiscovery(system, System::getenv, System::getProperty));
    }

    public EnvironmentFactory(SystemInterface system, SecurityConfig securityConfig, RootDiscovery discovery) {
        this.system = Objects.requireNonNull(system, "system");
        this.securityConfig = Objects.requireNonNull(securityConfig, "securityConfig");
        this.discovery = Objects.requireNonNull(discovery, "discovery");
    }

    public SecurityConfig securityConfig() {
        return securityConfig;
    }

    public FilesystemEnvironment createFilesystemEnvironment(Path root) {
        return new FilesystemEnvironment(root, system, securityConfig);
    }

    public MemoryEnvironment createMemoryEnvironment() {
        return new MemoryEnvironment();
    }

    public MergedEnvironment createMergedEnvironment(Environment local, Environment global) {
        return new MergedEnvironment(local, global);
    }

    public ArchiveEnvironment createArchiveEnvironment(ArchiveSource source) {
        return new ArchiveEnvironment(source, securityConfig, system);
    }

    public WorkflowContext createWorkflowContext(Environment environment, String workflowName) {
        return new WorkflowContext(environment, workflowName);
    }

    /**
     * Project-local resources under {@code <projectRoot>/.markdown-workflow} layered over the
     * system-global ones.
     */
    public MergedEnvironment createCliEnvironment(Path projectRoot, Path systemRoot) {
        return createMergedEnvironment(
            createFilesystemEnvironment(projectRoot.resolve(RootDiscovery.PROJECT_MARKER)),
            createFilesystemEnvironment(systemRoot)
        );
    }

    /**
     * @throws ResourceNotFoundException when neither layer defines the workflow
     */
    public WorkflowEnvironment createWorkflowEnvironment(Path projectRoot, Path systemRoot, String workflowName) {
        MergedEnvironment environment = createCliEnvironment(projectRoot, systemRoot);
        if (!environment.hasWorkflow(workflowName)) {
            throw new ResourceNotFoundException(
                "Workflow",
                workflowName,
                "Workflow '" + workflowName + "' not found. Available workflows: "
                    + String.join(", ", environment.listWorkflows()),
                null
            );
        }
        return new WorkflowEnvironment(environment, createWorkflowContext(environment, workflowName));
    }

    public DiscoveredEnvironment createFromDiscovery(Path startPath) {
        Path systemRoot = discovery.findSystemRoot(startPath).orElseThrow(() -> new ResourceNotFoundException(
            "System root",
            startPath.toString(),
            "System root not found. Set " + RootDiscovery.SYSTEM_ROOT_ENV + " or -D" + RootDiscovery.SYSTEM_ROOT_PROPERTY
                + " to the markdown-workflow installation.",
            null
        ));
        Path projectRoot = discovery.findProjectRoot(startPath).orElseThrow(() -> new ResourceNotFoundException(
            "Project root",
            startPath.toString(),
            "Project root not found from " + startPath + ". Run `wf init` to initialize a project.",
            null
        ));
        log.debug("Discovered project root {} and system root {}", projectRoot, systemRoot);
        return new DiscoveredEnvironment(createCliEnvironment(projectRoot, systemRoot), projectRoot, systemRoot);
    }

    /**
     * Builds, initializes and validates an archive environment.
     *
     * @throws ValidationException when the archive cannot be extracted or its contents are unusable
     */
    public ArchiveEnvironment openArchive(ArchiveSource source) {
        ArchiveEnvironment environment = createArchiveEnvironment(source);
        environment.initialize();
        EnvironmentReport report = validateEnvironment(environment);
        if (!report.valid()) {
            throw new ValidationException(
                "Archive " + source.name() + " is not a valid environment: " + String.join("; ", report.issues())
            );
        }
        report.warnings().forEach(warning -> log.warn("Archive {}: {}", source.name(), warning));
        return environment;
    }

    public EnvironmentReport validateEnvironment(Environment environment) {
        List<String> issues = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        try {
            EnvironmentManifest manifest = environment.getManifest();
            if (manifest.workflows().isEmpty()) {
                warnings.add("No workflows found");
            }
            for (String workflow : manifest.workflows()) {
                try {
                    environment.getWorkflow(workflow);
                } catch (RuntimeException ex) {
                    issues.add("Failed to load workflow '" + workflow + "': " + ex.getMessage());
                }
            }
            try {
                environment.getConfig();
            } catch (RuntimeException ex) {
                warnings.add("Configuration issues: " + ex.getMessage());
            }
        } catch (RuntimeException ex) {
            issues.add("Environment validation failed: " + ex.getMessage());
        }
        return EnvironmentReport.of(issues, warnings);
    }

    public record DiscoveredEnvironment(MergedEnvironment environment, Path projectRoot, Path systemRoot) {}
}
