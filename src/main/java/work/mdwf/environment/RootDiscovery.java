package work.mdwf.environment;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.mdwf.system.NioSystemInterface;
import work.mdwf.system.SystemInterface;

/**
 * Locates the project root (nearest ancestor holding {@code .markdown-workflow/}) and the
 * system root holding the bundled workflows.
 */
public final class RootDiscovery {
    public static final String PROJECT_MARKER = ".markdown-workflow";
    public static final String SYSTEM_ROOT_ENV = "MDWF_SYSTEM_ROOT";
    public static final String SYSTEM_ROOT_PROPERTY = "mdwf.system.root";
    static final String PACKAGE_NAME = "markdown-workflow";

    private static final Logger log = LoggerFactory.getLogger(RootDiscovery.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final SystemInterface system;
    private final UnaryOperator<String> env;
    private final UnaryOperator<String> properties;

    public RootDiscovery() {
        this(NioSystemInterface.INSTANCE, System::getenv, System::getProperty);
    }

    public RootDiscovery(SystemInterface system, UnaryOperator<String> env, UnaryOperator<String> properties) {
        this.system = system;
        this.env = env;
        this.properties = properties;
    }

    public Optional<Path> findProjectRoot(Path start) {
        for (Path current = start.toAbsolutePath().normalize(); current != null; current = current.getParent()) {
            if (system.isDirectory(current.resolve(PROJECT_MARKER))) {
                return Optional.of(current);
            }
        }
        return Optional.empty();
    }

    /**
     * Checks {@value #SYSTEM_ROOT_ENV}, then {@value #SYSTEM_ROOT_PROPERTY}, then walks up from
     * {@code start} looking for the package.json of the markdown-workflow distribution.
     */
    public Optional<Path> findSystemRoot(Path start) {
        Optional<Path> configured = configured(env.apply(SYSTEM_ROOT_ENV))
            .or(() -> configured(properties.apply(SYSTEM_ROOT_PROPERTY)));
        if (configured.isPresent()) {
            return configured;
        }
        for (Path current = start.toAbsolutePath().normalize(); current != null; current = current.getParent()) {
            if (isSystemRoot(current)) {
                return Optional.of(current);
            }
        }
        return Optional.empty();
    }

    private Optional<Path> configured(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        Path path = Path.of(value).toAbsolutePath().normalize();
        if (!system.isDirectory(path)) {
            log.warn("Configured system root {} is not a directory", path);
            return Optional.empty();
        }
        return Optional.of(path);
    }

    private boolean isSystemRoot(Path directory) {
        Path packageJson = directory.resolve("package.json");
        if (!system.isRegularFile(packageJson)) {
            return false;
        }
        try {
            return PACKAGE_NAME.equals(JSON.readTree(system.readString(packageJson)).path("name").asText());
        } catch (IOException ex) {
            log.debug("Ignoring unreadable {}: {}", packageJson, ex.getMessage());
            return false;
        }
    }
}
