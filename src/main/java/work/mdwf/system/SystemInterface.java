package work.mdwf.system;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * File-system operations used by filesystem-backed environments, injectable for tests.
 */
public interface SystemInterface {
    boolean exists(Path path);

    boolean isDirectory(Path path);

    boolean isRegularFile(Path path);

    long size(Path path) throws IOException;

    String readString(Path path) throws IOException;

    byte[] readBytes(Path path) throws IOException;

    /**
     * Entries of a directory, sorted by name.
     */
    List<DirEntry> list(Path directory) throws IOException;

    record DirEntry(String name, boolean directory, boolean file) {}
}
