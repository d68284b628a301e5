package work.mdwf.environment;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.mdwf.api.Environment;
import work.mdwf.api.EnvironmentException;
import work.mdwf.api.EnvironmentManifest;
import work.mdwf.api.EnvironmentSecurityException;
import work.mdwf.api.ResourceNotFoundException;
import work.mdwf.api.StaticRequest;
import work.mdwf.api.TemplateRequest;
import work.mdwf.api.ValidationException;
import work.mdwf.schema.ExternalConverterDefinition;
import work.mdwf.schema.ExternalProcessorDefinition;
import work.mdwf.schema.ProjectConfig;
import work.mdwf.schema.ResourceSchemas;
import work.mdwf.schema.WorkflowFile;
import work.mdwf.security.FileInfo;
import work.mdwf.security.SecurityConfig;
import work.mdwf.security.SecurityValidator;
import work.mdwf.system.SystemInterface;
import work.mdwf.system.NioSystemInterface;

/**
 * Environment over a directory tree laid out as described in {@link ResourceLayout}.
 * Every read goes through the {@link SecurityValidator}: request names are checked before
 * a path is built and file sizes and text content are checked before parsing.
 */
public final class FilesystemEnvironment implements Environment {
    private static final Logger log = LoggerFactory.getLogger(FilesystemEnvironment.class);

    private final Path root;
    private final SystemInterface system;
    private final SecurityValidator validator;
    private volatile EnvironmentManifest manifestCache;

    public FilesystemEnvironment(Path root) {
        this(root, NioSystemInterface.INSTANCE, SecurityConfig.defaults());
    }

    public FilesystemEnvironment(Path root, SystemInterface system, SecurityConfig securityConfig) {
        this.root = root.toAbsolutePath().normalize();
        this.system = system;
        this.validator = new SecurityValidator(securityConfig);
    }

    public Path root() {
        return root;
    }

    @Override
    public Optional<ProjectConfig> getConfig() {
        for (String candidate : ResourceLayout.CONFIG_CANDIDATES) {
            if (!system.isRegularFile(resolve(candidate))) {
                continue;
            }
            String content;
            try {
                content = readText(candidate);
            } catch (IOException ex) {
                throw new ValidationException("Failed to load config from " + resolve(candidate), ex);
            }
            return Optional.of(ResourceSchemas.parseProjectConfig(content, resolve(candidate).toString()));
        }
        return Optional.empty();
    }

    @Override
    public WorkflowFile getWorkflow(String name) {
        ResourceLayout.checkWorkflowName(validator, name);
        String relative = ResourceLayout.workflowFile(name);
        if (!system.isRegularFile(resolve(relative))) {
            throw new ResourceNotFoundException("Workflow", name);
        }
        String content;
        try {
            content = readText(relative);
        } catch (IOException ex) {
            throw new ResourceNotFoundException("Workflow", name, ex);
        }
        return ResourceSchemas.parseWorkflow(content, name);
    }

    @Override
    public List<String> listWorkflows() {
        Path workflowsDir = resolve(ResourceLayout.WORKFLOWS_DIR);
        if (!system.isDirectory(workflowsDir)) {
            return List.of();
        }
        try {
            List<String> workflows = new ArrayList<>();
            for (var entry : system.list(workflowsDir)) {
                if (entry.directory() && system.isRegularFile(resolve(ResourceLayout.workflowFile(entry.name())))) {
                    workflows.add(entry.name());
                }
            }
            return workflows;
        } catch (IOException ex) {
            log.warn("Failed to read workflows directory {}: {}", workflowsDir, ex.getMessage());
            return List.of();
        }
    }

    @Override
    public boolean hasWorkflow(String name) {
        try {
            ResourceLayout.checkWorkflowName(validator, name);
        } catch (EnvironmentSecurityException ex) {
            return false;
        }
        return system.isRegularFile(resolve(ResourceLayout.workflowFile(name)));
    }

    @Override
    public List<ExternalProcessorDefinition> getProcessorDefinitions() {
        return new ArrayList<>(loadDefinitions(ResourceLayout.PROCESSORS_DIR, ResourceSchemas::parseProcessor).values());
    }

    @Override
    public List<ExternalConverterDefinition> getConverterDefinitions() {
        return new ArrayList<>(loadDefinitions(ResourceLayout.CONVERTERS_DIR, ResourceSchemas::parseConverter).values());
    }

    @Override
    public String getTemplate(TemplateRequest request) {
        ResourceLayout.checkRequest(validator, request);
        for (String candidate : ResourceLayout.templateCandidates(request)) {
            if (system.isRegularFile(resolve(candidate))) {
                try {
                    return readText(candidate);
                } catch (IOException ex) {
                    throw new ResourceNotFoundException("Template", request.key(), ex);
                }
            }
        }
        throw new ResourceNotFoundException("Template", request.key());
    }

    @Override
    public boolean hasTemplate(TemplateRequest request) {
        try {
            ResourceLayout.checkRequest(validator, request);
        } catch (EnvironmentSecurityException ex) {
            return false;
        }
        return ResourceLayout.templateCandidates(request).stream().anyMatch(c -> system.isRegularFile(resolve(c)));
    }

    @Override
    public byte[] getStatic(StaticRequest request) {
        ResourceLayout.checkRequest(validator, request);
        for (String candidate : ResourceLayout.staticCandidates(request)) {
            if (system.isRegularFile(resolve(candidate))) {
                try {
                    checkSize(candidate);
                    return system.readBytes(resolve(candidate));
                } catch (IOException ex) {
                    throw new ResourceNotFoundException("Static", request.key(), ex);
                }
            }
        }
        throw new ResourceNotFoundException("Static", request.key());
    }

    @Override
    public boolean hasStatic(StaticRequest request) {
        try {
            ResourceLayout.checkRequest(validator, request);
        } catch (EnvironmentSecurityException ex) {
            return false;
        }
        return ResourceLayout.staticCandidates(request).stream().anyMatch(c -> system.isRegularFile(resolve(c)));
    }

    @Override
    public EnvironmentManifest getManifest() {
        EnvironmentManifest cached = manifestCache;
        if (cached != null) {
            return cached;
        }
        List<String> workflows = listWorkflows();
        Map<String, List<String>> templates = new LinkedHashMap<>();
        Map<String, List<String>> statics = new LinkedHashMap<>();
        for (String workflow : workflows) {
            templates.put(workflow, scanTemplates(workflow));
            statics.put(workflow, scanStatics(workflow));
        }
        boolean hasConfig = ResourceLayout.CONFIG_CANDIDATES.stream().anyMatch(c -> system.isRegularFile(resolve(c)));
        EnvironmentManifest manifest = new EnvironmentManifest(
            workflows,
            getProcessorDefinitions().stream().map(ExternalProcessorDefinition::name).toList(),
            getConverterDefinitions().stream().map(ExternalConverterDefinition::name).toList(),
            templates,
            statics,
            hasConfig
        );
        manifestCache = manifest;
        return manifest;
    }

    /**
     * Drops the memoized manifest after the directory tree changed.
     */
    public void invalidateManifest() {
        manifestCache = null;
    }

    private <T> Map<String, T> loadDefinitions(String directory, BiFunction<String, String, T> parser) {
        Map<String, T> definitions = new LinkedHashMap<>();
        Path dir = resolve(directory);
        if (!system.isDirectory(dir)) {
            return definitions;
        }
        List<SystemInterface.DirEntry> entries;
        try {
            entries = system.list(dir);
        } catch (IOException ex) {
            log.warn("Failed to read {} directory {}: {}", directory, dir, ex.getMessage());
            return definitions;
        }
        for (var entry : entries) {
            if (!entry.file() || !ResourceLayout.isDefinitionFile(entry.name())) {
                continue;
            }
            String relative = directory + "/" + entry.name();
            try {
                definitions.put(relative, parser.apply(readText(relative), relative));
            } catch (EnvironmentException | IOException ex) {
                log.warn("Skipping invalid definition {}: {}", relative, ex.getMessage());
            }
        }
        return definitions;
    }

    private List<String> scanTemplates(String workflow) {
        Path templatesDir = resolve(ResourceLayout.templatesDir(workflow));
        if (!system.isDirectory(templatesDir)) {
            return List.of();
        }
        try {
            List<String> names = new ArrayList<>();
            for (var entry : system.list(templatesDir)) {
                if (entry.directory() && !ResourceLayout.STATIC_DIR.equals(entry.name())
                    && containsTemplate(templatesDir.resolve(entry.name()))) {
                    names.add(entry.name());
                }
            }
            return names;
        } catch (IOException ex) {
            log.warn("Failed to scan templates for workflow {}: {}", workflow, ex.getMessage());
            return List.of();
        }
    }

    private boolean containsTemplate(Path templateDir) throws IOException {
        for (var entry : system.list(templateDir)) {
            if (entry.file() && ResourceLayout.isTemplateFile(entry.name())) {
                return true;
            }
        }
        return false;
    }

    private List<String> scanStatics(String workflow) {
        Path staticDir = resolve(ResourceLayout.staticDir(workflow));
        if (!system.isDirectory(staticDir)) {
            return List.of();
        }
        try {
            return system.list(staticDir).stream()
                .filter(SystemInterface.DirEntry::file)
                .map(SystemInterface.DirEntry::name)
                .toList();
        } catch (IOException ex) {
            log.warn("Failed to scan statics for workflow {}: {}", workflow, ex.getMessage());
            return List.of();
        }
    }

    private String readText(String relative) throws IOException {
        checkSize(relative);
        Path path = resolve(relative);
        if (validator.isContentChecked(relative)) {
            return validator.validateContent(relative, system.readBytes(path));
        }
        return system.readString(path);
    }

    private void checkSize(String relative) throws IOException {
        validator.validateFileSize(FileInfo.extensionOf(relative), system.size(resolve(relative)));
    }

    private Path resolve(String relative) {
        return root.resolve(relative);
    }
}
