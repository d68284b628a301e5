package work.mdwf.system;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * {@link SystemInterface} over {@link java.nio.file.Files}.
 */
public final class NioSystemInterface implements SystemInterface {
    public static final NioSystemInterface INSTANCE = new NioSystemInterface();

    @Override
    public boolean exists(Path path) {
        return Files.exists(path);
    }

    @Override
    public boolean isDirectory(Path path) {
        return Files.isDirectory(path);
    }

    @Override
    public boolean isRegularFile(Path path) {
        return Files.isRegularFile(path);
    }

    @Override
    public long size(Path path) throws IOException {
        return Files.size(path);
    }

    @Override
    public String readString(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    @Override
    public byte[] readBytes(Path path) throws IOException {
        return Files.readAllBytes(path);
    }

    @Override
    public List<DirEntry> list(Path directory) throws IOException {
        List<DirEntry> entries = new ArrayList<>();
        try (var stream = Files.list(directory)) {
            stream.forEach(path -> entries.add(new DirEntry(
                path.getFileName().toString(),
                Files.isDirectory(path),
                Files.isRegularFile(path)
            )));
        }
        entries.sort(Comparator.comparing(DirEntry::name));
        return entries;
    }
}
