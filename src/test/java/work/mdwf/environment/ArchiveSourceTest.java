package work.mdwf.environment;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.mdwf.support.EnvironmentFixtures.utf8;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.mdwf.api.StaticRequest;
import work.mdwf.support.EnvironmentFixtures;
import work.mdwf.support.ZipFixtures;

class ArchiveSourceTest {
    @Test
    void bufferIsCopiedOnConstructionAndAccess() {
        byte[] bytes = utf8("zip");
        var source = new ArchiveSource(Optional.empty(), Optional.of(bytes), "in-memory.zip");

        bytes[0] = 'X';
        assertArrayEquals(utf8("zip"), source.buffer().orElseThrow());
        source.buffer().orElseThrow()[0] = 'Y';
        assertArrayEquals(utf8("zip"), source.buffer().orElseThrow());
    }

    @Test
    void callerMutationDoesNotReachTheArchive() {
        byte[] archive = ZipFixtures.zip(EnvironmentFixtures.blogTree());
        var env = new ArchiveEnvironment(ArchiveSource.ofBuffer(archive));

        Arrays.fill(archive, (byte) 0);

        assertArrayEquals(utf8("body{}"), env.getStatic(StaticRequest.of("blog", "style.css")));
    }

    @Test
    void equalityComparesBufferContents() {
        var first = ArchiveSource.ofBuffer(utf8("zip"), "a.zip");
        var second = ArchiveSource.ofBuffer(utf8("zip"), "a.zip");

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, ArchiveSource.ofBuffer(utf8("zap"), "a.zip"));
        assertNotEquals(first, ArchiveSource.ofPath(Path.of("a.zip")));
    }

    @Test
    void nameDefaultsFromTheSource() {
        assertEquals("archive buffer", ArchiveSource.ofBuffer(utf8("zip")).name());
        assertEquals(Path.of("env.zip").toString(), ArchiveSource.ofPath(Path.of("env.zip")).name());
        assertTrue(ArchiveSource.ofBuffer(utf8("zip")).isBuffered());
        assertThrows(IllegalArgumentException.class, () -> new ArchiveSource(Optional.empty(), Optional.empty(), null));
    }
}
