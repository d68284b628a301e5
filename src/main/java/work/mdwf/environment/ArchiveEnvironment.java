package work.mdwf.environment;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.BiFunction;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;
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
import work.mdwf.system.NioSystemInterface;
import work.mdwf.system.SystemInterface;

/**
 * Environment backed by an untrusted ZIP archive.
 *
 * <p>The archive is extracted eagerly into memory on the first query (or an explicit
 * {@link #initialize()}). Entries failing a per-file check are dropped with a warning; a
 * batch exceeding the aggregate limits or carrying invalid text content fails the whole
 * initialization. Once {@link State#READY} the extracted map never changes.</p>
 */
public final class ArchiveEnvironment implements Environment {
    private static final Logger log = LoggerFactory.getLogger(ArchiveEnvironment.class);
    private static final int MAX_ENTRY_BYTES = Integer.MAX_VALUE - 8;

    public enum State {
        UNINITIALIZED,
        EXTRACTING,
        VALIDATED,
        READY
    }

    private final ArchiveSource source;
    private final SecurityValidator validator;
    private final SystemInterface system;
    private final Object lock = new Object();

    private volatile State state = State.UNINITIALIZED;
    private volatile Map<String, byte[]> files;
    private volatile EnvironmentManifest manifestCache;

    public ArchiveEnvironment(ArchiveSource source) {
        this(source, SecurityConfig.defaults());
    }

    public ArchiveEnvironment(ArchiveSource source, SecurityConfig securityConfig) {
        this(source, securityConfig, NioSystemInterface.INSTANCE);
    }

    public ArchiveEnvironment(ArchiveSource source, SecurityConfig securityConfig, SystemInterface system) {
        this.source = source;
        this.validator = new SecurityValidator(securityConfig);
        this.system = system;
    }

    public ArchiveSource source() {
        return source;
    }

    public State state() {
        return state;
    }

    @Override
    public void initialize() {
        if (files != null) {
            return;
        }
        synchronized (lock) {
            if (files != null) {
                return;
            }
            state = State.EXTRACTING;
            try {
                Map<String, byte[]> extracted = extract(readArchiveBytes());
                validateBatch(extracted);
                state = State.VALIDATED;
                files = Collections.unmodifiableMap(extracted);
                state = State.READY;
                log.debug("Archive {} ready with {} entries", source.name(), extracted.size());
            } catch (RuntimeException ex) {
                state = State.UNINITIALIZED;
                throw ex;
            }
        }
    }

    /**
     * Normalized paths of every extracted entry, sorted.
     */
    public Set<String> listPaths() {
        return Collections.unmodifiableSet(new TreeSet<>(files().keySet()));
    }

    @Override
    public Optional<ProjectConfig> getConfig() {
        Map<String, byte[]> entries = files();
        for (String candidate : ResourceLayout.CONFIG_CANDIDATES) {
            byte[] content = entries.get(candidate);
            if (content != null) {
                return Optional.of(ResourceSchemas.parseProjectConfig(text(content), source.name() + "!/" + candidate));
            }
        }
        return Optional.empty();
    }

    @Override
    public WorkflowFile getWorkflow(String name) {
        ResourceLayout.checkWorkflowName(validator, name);
        byte[] content = files().get(ResourceLayout.workflowFile(name));
        if (content == null) {
            throw new ResourceNotFoundException("Workflow", name);
        }
        return ResourceSchemas.parseWorkflow(text(content), name);
    }

    @Override
    public List<String> listWorkflows() {
        return getManifest().workflows();
    }

    @Override
    public boolean hasWorkflow(String name) {
        try {
            ResourceLayout.checkWorkflowName(validator, name);
            return files().containsKey(ResourceLayout.workflowFile(name));
        } catch (EnvironmentException ex) {
            return false;
        }
    }

    @Override
    public List<ExternalProcessorDefinition> getProcessorDefinitions() {
        return loadDefinitions(ResourceLayout.PROCESSORS_DIR, ResourceSchemas::parseProcessor);
    }

    @Override
    public List<ExternalConverterDefinition> getConverterDefinitions() {
        return loadDefinitions(ResourceLayout.CONVERTERS_DIR, ResourceSchemas::parseConverter);
    }

    @Override
    public String getTemplate(TemplateRequest request) {
        ResourceLayout.checkRequest(validator, request);
        Map<String, byte[]> entries = files();
        for (String candidate : ResourceLayout.templateCandidates(request)) {
            byte[] content = entries.get(candidate);
            if (content != null) {
                return text(content);
            }
        }
        throw new ResourceNotFoundException("Template", request.key());
    }

    @Override
    public boolean hasTemplate(TemplateRequest request) {
        try {
            ResourceLayout.checkRequest(validator, request);
            Map<String, byte[]> entries = files();
            return ResourceLayout.templateCandidates(request).stream().anyMatch(entries::containsKey);
        } catch (EnvironmentException ex) {
            return false;
        }
    }

    @Override
    public byte[] getStatic(StaticRequest request) {
        ResourceLayout.checkRequest(validator, request);
        Map<String, byte[]> entries = files();
        for (String candidate : ResourceLayout.staticCandidates(request)) {
            byte[] content = entries.get(candidate);
            if (content != null) {
                return content.clone();
            }
        }
        throw new ResourceNotFoundException("Static", request.key());
    }

    @Override
    public boolean hasStatic(StaticRequest request) {
        try {
            ResourceLayout.checkRequest(validator, request);
            Map<String, byte[]> entries = files();
            return ResourceLayout.staticCandidates(request).stream().anyMatch(entries::containsKey);
        } catch (EnvironmentException ex) {
            return false;
        }
    }

    @Override
    public EnvironmentManifest getManifest() {
        EnvironmentManifest cached = manifestCache;
        if (cached != null) {
            return cached;
        }
        Map<String, byte[]> entries = files();
        Set<String> workflows = new TreeSet<>();
        Map<String, Set<String>> templates = new TreeMap<>();
        Map<String, Set<String>> statics = new TreeMap<>();
        for (String path : entries.keySet()) {
            String[] segments = path.split("/");
            if (segments.length < 3 || !ResourceLayout.WORKFLOWS_DIR.equals(segments[0])) {
                continue;
            }
            String workflow = segments[1];
            if (segments.length == 3 && ResourceLayout.WORKFLOW_FILE.equals(segments[2])) {
                workflows.add(workflow);
            } else if (segments.length >= 5 && ResourceLayout.TEMPLATES_DIR.equals(segments[2])) {
                if (ResourceLayout.STATIC_DIR.equals(segments[3])) {
                    String rest = String.join("/", List.of(segments).subList(4, segments.length));
                    statics.computeIfAbsent(workflow, key -> new TreeSet<>()).add(rest);
                } else if (segments.length == 5 && ResourceLayout.isTemplateFile(segments[4])) {
                    templates.computeIfAbsent(workflow, key -> new TreeSet<>()).add(segments[3]);
                }
            }
        }
        Map<String, List<String>> templatesByWorkflow = new LinkedHashMap<>();
        Map<String, List<String>> staticsByWorkflow = new LinkedHashMap<>();
        for (String workflow : workflows) {
            templatesByWorkflow.put(workflow, new ArrayList<>(templates.getOrDefault(workflow, Set.of())));
            staticsByWorkflow.put(workflow, new ArrayList<>(statics.getOrDefault(workflow, Set.of())));
        }
        boolean hasConfig = ResourceLayout.CONFIG_CANDIDATES.stream().anyMatch(entries::containsKey);
        EnvironmentManifest manifest = new EnvironmentManifest(
            new ArrayList<>(workflows),
            getProcessorDefinitions().stream().map(ExternalProcessorDefinition::name).toList(),
            getConverterDefinitions().stream().map(ExternalConverterDefinition::name).toList(),
            templatesByWorkflow,
            staticsByWorkflow,
            hasConfig
        );
        manifestCache = manifest;
        return manifest;
    }

    private Map<String, byte[]> files() {
        initialize();
        return files;
    }

    private byte[] readArchiveBytes() {
        if (source.isBuffered()) {
            return source.buffer().get();
        }
        var path = source.filePath().orElseThrow();
        try {
            return system.readBytes(path);
        } catch (IOException ex) {
            throw failure("unable to read archive: " + ex.getMessage(), ex);
        }
    }

    private Map<String, byte[]> extract(byte[] archive) {
        log.debug("Extracting archive {} ({} bytes)", source.name(), archive.length);
        Map<String, byte[]> extracted = new LinkedHashMap<>();
        long totalSize = 0;
        try (
            ZipFile zip = ZipFile.builder()
                .setSeekableByteChannel(new SeekableInMemoryByteChannel(archive))
                .get()
        ) {
            Enumeration<ZipArchiveEntry> entries = zip.getEntries();
            while (entries.hasMoreElements()) {
                ZipArchiveEntry entry = entries.nextElement();
                if (entry.isDirectory()) {
                    continue;
                }
                String path = normalizeEntryPath(entry.getName());
                String extension = FileInfo.extensionOf(path);
                try {
                    validator.validatePath(path);
                    validator.validateFilename(FileInfo.baseName(path));
                    validator.validateExtension(extension);
                } catch (EnvironmentSecurityException ex) {
                    log.warn("Skipping archive entry {}: {}", entry.getName(), ex.getMessage());
                    continue;
                }
                byte[] content;
                try (InputStream in = zip.getInputStream(entry)) {
                    content = in.readNBytes(readBound(extension));
                } catch (IOException ex) {
                    log.warn("Skipping archive entry {}: {}", path, ex.getMessage());
                    continue;
                }
                if (content.length == MAX_ENTRY_BYTES) {
                    log.warn("Skipping archive entry {}: larger than {} bytes", path, MAX_ENTRY_BYTES);
                    continue;
                }
                try {
                    validator.validateFileSize(extension, content.length);
                } catch (EnvironmentSecurityException ex) {
                    log.warn("Skipping archive entry {}: {}", path, ex.getMessage());
                    continue;
                }
                extracted.put(path, content);
                totalSize += content.length;
                try {
                    validator.validateTotals(extracted.size(), totalSize);
                } catch (EnvironmentSecurityException ex) {
                    throw failure(ex.getMessage(), ex);
                }
                log.debug("Extracted {} ({} bytes)", path, content.length);
            }
        } catch (IOException ex) {
            throw failure("unreadable archive: " + ex.getMessage(), ex);
        }
        return extracted;
    }

    private void validateBatch(Map<String, byte[]> extracted) {
        List<FileInfo> batch = new ArrayList<>(extracted.size());
        extracted.forEach((path, content) -> batch.add(FileInfo.of(path, content.length)));
        try {
            validator.validateFiles(batch);
        } catch (EnvironmentSecurityException ex) {
            throw failure(ex.getMessage(), ex);
        }
        for (var entry : extracted.entrySet()) {
            if (!validator.isContentChecked(entry.getKey())) {
                continue;
            }
            try {
                validator.validateContent(entry.getKey(), entry.getValue());
            } catch (ValidationException ex) {
                throw failure(ex.getMessage(), ex);
            }
        }
    }

    // One byte past the limit is enough to reject an entry without inflating all of it.
    // Limits at or above MAX_ENTRY_BYTES saturate; an entry filling the bound is never stored.
    private int readBound(String extension) {
        long limit = validator.config().sizeLimitFor(extension);
        if (limit < 0) {
            limit = validator.config().maxTotalSize();
        }
        return limit >= MAX_ENTRY_BYTES ? MAX_ENTRY_BYTES : (int) limit + 1;
    }

    private <T> List<T> loadDefinitions(String directory, BiFunction<String, String, T> parser) {
        List<T> definitions = new ArrayList<>();
        Map<String, byte[]> entries = files();
        for (String path : new TreeSet<>(entries.keySet())) {
            if (!path.startsWith(directory + "/")) {
                continue;
            }
            String name = path.substring(directory.length() + 1);
            if (name.contains("/") || !ResourceLayout.isDefinitionFile(name)) {
                continue;
            }
            try {
                definitions.add(parser.apply(text(entries.get(path)), source.name() + "!/" + path));
            } catch (EnvironmentException ex) {
                log.warn("Skipping invalid definition {}: {}", path, ex.getMessage());
            }
        }
        return definitions;
    }

    private ValidationException failure(String detail, Throwable cause) {
        return new ValidationException(
            "Failed to initialize archive environment from " + source.name() + ": " + detail,
            cause
        );
    }

    static String normalizeEntryPath(String name) {
        String path = name.replace('\\', '/');
        while (path.startsWith("/")) {
            path = path.substring(1);
        }
        List<String> kept = new ArrayList<>();
        for (String segment : path.split("/")) {
            if (!segment.isEmpty() && !segment.equals(".")) {
                kept.add(segment);
            }
        }
        return String.join("/", kept);
    }

    private static String text(byte[] content) {
        return new String(content, StandardCharsets.UTF_8);
    }
}
