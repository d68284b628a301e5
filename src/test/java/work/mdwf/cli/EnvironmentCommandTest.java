package work.mdwf.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.mdwf.support.EnvironmentFixtures.utf8;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import work.mdwf.support.EnvironmentFixtures;
import work.mdwf.support.ZipFixtures;

class EnvironmentCommandTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine commandLine = Main.newCommandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    @Test
    void printsManifestOfSystemRoot() throws Exception {
        EnvironmentFixtures.writeTree(tempDir, EnvironmentFixtures.blogTree());

        int exitCode = run("--system", tempDir.toString());

        assertEquals(0, exitCode);
        JsonNode manifest = JSON.readTree(out.toString());
        assertEquals("blog", manifest.path("workflows").get(0).asText());
        assertEquals("post", manifest.path("templates").path("blog").get(0).asText());
        assertEquals(false, manifest.path("hasConfig").asBoolean());
    }

    @Test
    void versionLineNamesTheCommand() {
        int exitCode = run("--version");

        assertEquals(0, exitCode);
        assertTrue(out.toString().startsWith("mdwf-env (java) "), out.toString());
    }

    @Test
    void printsManifestOfArchive() throws Exception {
        Path archive = Files.write(tempDir.resolve("blog.zip"), ZipFixtures.zip(EnvironmentFixtures.blogTree()));

        int exitCode = run("--archive", archive.toString());

        assertEquals(0, exitCode);
        assertEquals("style.css", JSON.readTree(out.toString()).path("statics").path("blog").get(0).asText());
    }

    @Test
    void validateExitsNonZeroOnIssues() throws Exception {
        EnvironmentFixtures.writeTree(tempDir, Map.of("workflows/bad/workflow.yml", utf8("workflow:\n  name: bad\n")));

        int exitCode = run("--system", tempDir.toString(), "--validate");

        assertEquals(1, exitCode);
        JsonNode report = JSON.readTree(out.toString());
        assertEquals(false, report.path("valid").asBoolean());
        assertTrue(report.path("issues").get(0).asText().contains("bad"));
    }

    @Test
    void validatePassesForHealthyEnvironment() throws Exception {
        EnvironmentFixtures.writeTree(tempDir, EnvironmentFixtures.blogTree());

        assertEquals(0, run("--system", tempDir.toString(), "--validate"));
        assertTrue(JSON.readTree(out.toString()).path("valid").asBoolean());
    }

    @Test
    void corruptArchiveIsShortError() throws Exception {
        Path archive = Files.writeString(tempDir.resolve("broken.zip"), "not a zip");

        int exitCode = run("--archive", archive.toString());

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("[VALIDATION_ERROR]"));
        assertTrue(err.toString().contains("broken.zip"));
    }

    @Test
    void requiresASource() {
        int exitCode = run();

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("--archive"));
    }
}
