package work.mdwf.security;

import java.util.Locale;
import java.util.Objects;

/**
 * A file about to enter an environment: its relative path, name, extension and size.
 */
public record FileInfo(String name, String path, String extension, long size) {
    public FileInfo {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(path, "path");
        extension = extension == null ? "" : extension.toLowerCase(Locale.ROOT);
    }

    public static FileInfo of(String path, long size) {
        return new FileInfo(baseName(path), path, extensionOf(path), size);
    }

    public static String baseName(String path) {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    /**
     * Lower-cased extension including the dot, or an empty string.
     */
    public static String extensionOf(String path) {
        String name = baseName(path);
        int dot = name.lastIndexOf('.');
        if (dot <= 0) {
            return "";
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
