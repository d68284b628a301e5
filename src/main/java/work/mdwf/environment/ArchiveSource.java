package work.mdwf.environment;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Where an archive environment gets its ZIP bytes from (file on disk or in-memory buffer).
 * The buffer is copied on the way in and on the way out; equality compares its contents.
 */
public record ArchiveSource(Optional<Path> filePath, Optional<byte[]> buffer, String name) {
    public ArchiveSource {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(buffer, "buffer");
        if (filePath.isEmpty() && buffer.isEmpty()) {
            throw new IllegalArgumentException("Either filePath or buffer must be present.");
        }
        buffer = buffer.map(byte[]::clone);
        if (name == null || name.isBlank()) {
            name = filePath.map(Path::toString).orElse("archive buffer");
        }
    }

    public static ArchiveSource ofPath(Path path) {
        return new ArchiveSource(Optional.of(path), Optional.empty(), path.toString());
    }

    public static ArchiveSource ofBuffer(byte[] bytes) {
        return ofBuffer(bytes, null);
    }

    public static ArchiveSource ofBuffer(byte[] bytes, String name) {
        Objects.requireNonNull(bytes, "bytes");
        return new ArchiveSource(Optional.empty(), Optional.of(bytes), name);
    }

    @Override
    public Optional<byte[]> buffer() {
        return buffer.map(byte[]::clone);
    }

    public boolean isBuffered() {
        return buffer.isPresent();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ArchiveSource that)) {
            return false;
        }
        return filePath.equals(that.filePath)
            && name.equals(that.name)
            && buffer.isPresent() == that.buffer.isPresent()
            && Arrays.equals(buffer.orElse(null), that.buffer.orElse(null));
    }

    @Override
    public int hashCode() {
        return Objects.hash(filePath, name, Arrays.hashCode(buffer.orElse(null)));
    }

    @Override
    public String toString() {
        return "ArchiveSource[" + name + "]";
    }
}
