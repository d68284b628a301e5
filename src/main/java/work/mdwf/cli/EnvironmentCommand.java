package work.mdwf.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.mdwf.api.Environment;
import work.mdwf.environment.ArchiveSource;
import work.mdwf.environment.EnvironmentFactory;
import work.mdwf.environment.EnvironmentReport;
import work.mdwf.environment.RootDiscovery;
import work.mdwf.security.SecurityConfig;
import work.mdwf.system.NioSystemInterface;

@CommandLine.Command(
    name = "mdwf-env",
    description = "Inspect or validate a markdown-workflow resource environment.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class EnvironmentCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-p", "--project"},
        description = "Project root; resources are read from <project>/.markdown-workflow.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path projectRoot;

    @CommandLine.Option(
        names = {"-s", "--system"},
        description = "System root holding the bundled workflows.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path systemRoot;

    @CommandLine.Option(
        names = {"-a", "--archive"},
        description = "ZIP archive to load instead of directories.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path archive;

    @CommandLine.Option(
        names = "--discover",
        description = "Discover project and system roots from the working directory."
    )
    private boolean discover;

    @CommandLine.Option(
        names = "--security-config",
        description = "YAML file overriding the default security limits.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path securityConfigFile;

    @CommandLine.Option(
        names = "--validate",
        description = "Print a validation report instead of the manifest; exit 1 when issues are found."
    )
    private boolean validate;

    @Override
    public Integer call() throws Exception {
        SecurityConfig securityConfig = securityConfigFile == null
            ? SecurityConfig.defaults()
            : SecurityConfig.load(securityConfigFile);
        EnvironmentFactory factory = new EnvironmentFactory(NioSystemInterface.INSTANCE, securityConfig);
        Environment environment = openEnvironment(factory);
        environment.initialize();

        if (validate) {
            EnvironmentReport report = factory.validateEnvironment(environment);
            spec.commandLine().getOut().println(JSON_WRITER.writeValueAsString(report.toSerializableMap()));
            return report.valid() ? 0 : 1;
        }
        spec.commandLine().getOut().println(environment.getManifest().toPrettyJson());
        return 0;
    }

    private Environment openEnvironment(EnvironmentFactory factory) {
        if (archive != null) {
            return factory.createArchiveEnvironment(ArchiveSource.ofPath(archive));
        }
        if (discover) {
            return factory.createFromDiscovery(Path.of("")).environment();
        }
        if (projectRoot != null && systemRoot != null) {
            return factory.createCliEnvironment(projectRoot, systemRoot);
        }
        if (projectRoot != null) {
            return factory.createFilesystemEnvironment(projectRoot.resolve(RootDiscovery.PROJECT_MARKER));
        }
        if (systemRoot != null) {
            return factory.createFilesystemEnvironment(systemRoot);
        }
        throw new CommandLine.ParameterException(
            spec.commandLine(),
            "One of --archive, --discover, --project or --system is required."
        );
    }
}
