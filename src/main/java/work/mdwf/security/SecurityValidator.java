package work.mdwf.security;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import work.mdwf.api.EnvironmentSecurityException;
import work.mdwf.api.ValidationException;

/**
 * Gatekeeper for every file entering an environment from an external source.
 *
 * <p>Single-file checks throw {@link EnvironmentSecurityException}; callers extracting a
 * batch skip the offending file. {@link #validateFiles(List)} guards the whole batch and its
 * failure is meant to abort the load.</p>
 */
public final class SecurityValidator {
    private static final int MAX_FILENAME_LENGTH = 255;
    private static final Pattern DANGEROUS_CHARS = Pattern.compile("[<>:\"|?*\\x00-\\x1f\\x7f]");
    private static final Pattern WINDOWS_DRIVE = Pattern.compile("^[A-Za-z]:.*");
    private static final Set<String> CHECKED_CONTENT = Set.of(".yml", ".yaml", ".json", ".md", ".markdown", ".txt");

    private final SecurityConfig config;

    public SecurityValidator() {
        this(SecurityConfig.defaults());
    }

    public SecurityValidator(SecurityConfig config) {
        this.config = config;
    }

    public SecurityConfig config() {
        return config;
    }

    public void validateFile(FileInfo file) {
        validateFilename(file.name());
        validatePath(file.path());
        validateExtension(file.extension());
        validateFileSize(file.extension(), file.size());
    }

    /**
     * Aggregate limits over a whole batch (archive or directory snapshot).
     */
    public void validateFiles(List<FileInfo> files) {
        long totalSize = 0;
        for (FileInfo file : files) {
            totalSize += file.size();
        }
        validateTotals(files.size(), totalSize);
    }

    /**
     * Aggregate limits for running totals, so a batch can be rejected while it is still being read.
     */
    public void validateTotals(int fileCount, long totalSize) {
        if (fileCount > config.maxFileCount()) {
            throw new EnvironmentSecurityException(
                "Too many files: " + fileCount + " exceeds limit of " + config.maxFileCount()
            );
        }
        if (totalSize > config.maxTotalSize()) {
            throw new EnvironmentSecurityException(
                "Total file size " + totalSize + " bytes exceeds limit of " + config.maxTotalSize() + " bytes"
            );
        }
    }

    public void validateFilename(String filename) {
        if (filename == null || filename.isBlank()) {
            throw new EnvironmentSecurityException("Empty filename not allowed");
        }
        if (filename.indexOf('/') >= 0 || filename.indexOf('\\') >= 0) {
            throw new EnvironmentSecurityException("Filename contains a path separator: " + filename);
        }
        if (filename.equals(".") || filename.contains("..")) {
            throw new EnvironmentSecurityException("Path traversal attempt in filename: " + filename);
        }
        if (DANGEROUS_CHARS.matcher(filename).find()) {
            throw new EnvironmentSecurityException("Filename contains dangerous characters: " + filename);
        }
        if (filename.length() > MAX_FILENAME_LENGTH) {
            throw new EnvironmentSecurityException(
                "Filename too long: " + filename.length() + " chars, max " + MAX_FILENAME_LENGTH
            );
        }
    }

    /**
     * Checks a path relative to an environment root. Separators may be {@code /} or {@code \}.
     */
    public void validatePath(String path) {
        if (path == null || path.isBlank()) {
            throw new EnvironmentSecurityException("Empty path not allowed");
        }
        if (path.indexOf('\0') >= 0) {
            throw new EnvironmentSecurityException("Invalid file path (null byte): " + path.replace("\0", "\\0"));
        }
        if (path.startsWith("/") || path.startsWith("\\") || WINDOWS_DRIVE.matcher(path).matches()) {
            throw new EnvironmentSecurityException("Absolute path not allowed: " + path);
        }
        String[] segments = path.replace('\\', '/').split("/");
        int depth = 0;
        for (String segment : segments) {
            if (segment.equals("..")) {
                throw new EnvironmentSecurityException("Invalid file path: " + path);
            }
            if (!segment.isEmpty() && !segment.equals(".")) {
                depth++;
            }
        }
        if (depth > config.maxPathDepth()) {
            throw new EnvironmentSecurityException(
                "File path too deep: " + depth + " levels, max " + config.maxPathDepth()
            );
        }
    }

    /**
     * An empty allowlist admits every extension.
     */
    public void validateExtension(String extension) {
        if (config.allowedExtensions().isEmpty()) {
            return;
        }
        String normalized = extension == null ? "" : extension.toLowerCase(Locale.ROOT);
        if (!config.allowedExtensions().contains(normalized)) {
            throw new EnvironmentSecurityException(
                "File extension not allowed: '" + extension + "'. Allowed: " + config.allowedExtensions()
            );
        }
    }

    public void validateFileSize(String extension, long size) {
        long limit = config.sizeLimitFor(extension);
        if (limit >= 0 && size > limit) {
            throw new EnvironmentSecurityException(
                "File size " + size + " bytes exceeds limit for " + extension + ": " + limit + " bytes"
            );
        }
    }

    public boolean isContentChecked(String path) {
        return CHECKED_CONTENT.contains(FileInfo.extensionOf(path));
    }

    /**
     * Decodes {@code raw} as strict UTF-8 and runs the configured content rules.
     */
    public String validateContent(String path, byte[] raw) {
        if (!config.enableContentValidation()) {
            return new String(raw, StandardCharsets.UTF_8);
        }
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(raw))
                .toString();
        } catch (CharacterCodingException ex) {
            throw new ValidationException("Content validation failed for " + path + ": not valid UTF-8 text", ex);
        }
        validateContent(path, text);
        return text;
    }

    public void validateContent(String path, String content) {
        if (!config.enableContentValidation()) {
            return;
        }
        for (ContentRule rule : config.contentRules()) {
            try {
                rule.check(path, content);
            } catch (ValidationException ex) {
                throw new ValidationException("Content validation failed for " + path + ": " + ex.getMessage(), ex);
            }
        }
    }

    public String sanitizeFilename(String filename) {
        return DANGEROUS_CHARS.matcher(filename).replaceAll("_").trim();
    }
}
