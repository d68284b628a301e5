package work.mdwf.environment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.mdwf.system.NioSystemInterface;

class RootDiscoveryTest {
    @TempDir
    Path tempDir;

    private static RootDiscovery discovery(Map<String, String> env, Map<String, String> properties) {
        return new RootDiscovery(NioSystemInterface.INSTANCE, env::get, properties::get);
    }

    @Test
    void findsNearestProjectMarker() throws Exception {
        Path project = Files.createDirectories(tempDir.resolve("work/job-search"));
        Files.createDirectories(project.resolve(".markdown-workflow"));
        Path nested = Files.createDirectories(project.resolve("collections/active/acme"));

        var found = discovery(Map.of(), Map.of()).findProjectRoot(nested);

        assertEquals(project.toAbsolutePath().normalize(), found.orElseThrow());
    }

    @Test
    void noProjectMarkerIsEmpty() throws Exception {
        Path plain = Files.createDirectories(tempDir.resolve("plain"));
        assertTrue(discovery(Map.of(), Map.of()).findProjectRoot(plain).isEmpty());
    }

    @Test
    void environmentVariableWinsOverProperty() throws Exception {
        Path fromEnv = Files.createDirectories(tempDir.resolve("env-root"));
        Path fromProperty = Files.createDirectories(tempDir.resolve("property-root"));

        var found = discovery(
            Map.of(RootDiscovery.SYSTEM_ROOT_ENV, fromEnv.toString()),
            Map.of(RootDiscovery.SYSTEM_ROOT_PROPERTY, fromProperty.toString())
        ).findSystemRoot(tempDir);

        assertEquals(fromEnv.toAbsolutePath().normalize(), found.orElseThrow());
    }

    @Test
    void propertyIsUsedWhenEnvironmentIsUnset() throws Exception {
        Path fromProperty = Files.createDirectories(tempDir.resolve("property-root"));

        var found = discovery(Map.of(), Map.of(RootDiscovery.SYSTEM_ROOT_PROPERTY, fromProperty.toString()))
            .findSystemRoot(tempDir);

        assertEquals(fromProperty.toAbsolutePath().normalize(), found.orElseThrow());
    }

    @Test
    void findsDistributionByPackageJson() throws Exception {
        Path install = Files.createDirectories(tempDir.resolve("install"));
        Files.writeString(install.resolve("package.json"), "{\"name\": \"markdown-workflow\", \"version\": \"1.0.0\"}");
        Path other = Files.createDirectories(install.resolve("node_modules/other"));
        Files.writeString(other.resolve("package.json"), "{\"name\": \"other\"}");

        var found = discovery(Map.of(), Map.of()).findSystemRoot(other);

        assertEquals(install.toAbsolutePath().normalize(), found.orElseThrow());
    }

    @Test
    void unreadablePackageJsonIsIgnored() throws Exception {
        Path broken = Files.createDirectories(tempDir.resolve("broken"));
        Files.writeString(broken.resolve("package.json"), "{not json");

        var found = discovery(Map.of(), Map.of()).findSystemRoot(broken);

        assertFalse(found.map(broken.toAbsolutePath().normalize()::equals).orElse(false));
    }
}
