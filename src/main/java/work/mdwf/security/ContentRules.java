package work.mdwf.security;

import java.util.List;
import java.util.Locale;
import work.mdwf.api.ValidationException;

/**
 * Built-in {@link ContentRule}s.
 */
public final class ContentRules {
    public static final long DEFAULT_MAX_CONTENT_LENGTH = 1024L * 1024L;
    public static final List<String> DEFAULT_DENIED_YAML_TAGS = List.of(
        "!!java", "!!javax", "!!python", "!!ruby", "!!perl", "!!js"
    );

    private ContentRules() {}

    public static List<ContentRule> defaults() {
        return List.of(
            maxLength(DEFAULT_MAX_CONTENT_LENGTH),
            noNullCharacters(),
            deniedYamlTags(DEFAULT_DENIED_YAML_TAGS)
        );
    }

    public static ContentRule maxLength(long maxChars) {
        return (path, content) -> {
            if (content.length() > maxChars) {
                throw new ValidationException(
                    "Content of " + path + " is " + content.length() + " characters, limit is " + maxChars
                );
            }
        };
    }

    public static ContentRule noNullCharacters() {
        return (path, content) -> {
            if (content.indexOf('\0') >= 0) {
                throw new ValidationException("Content of " + path + " contains NUL characters");
            }
        };
    }

    /**
     * Rejects YAML documents using any of the given tag prefixes (only applied to
     * {@code .yml}/{@code .yaml} paths).
     */
    public static ContentRule deniedYamlTags(List<String> tagPrefixes) {
        List<String> denied = List.copyOf(tagPrefixes);
        return (path, content) -> {
            String extension = FileInfo.extensionOf(path);
            if (!".yml".equals(extension) && !".yaml".equals(extension)) {
                return;
            }
            String lowered = content.toLowerCase(Locale.ROOT);
            for (String tag : denied) {
                if (lowered.contains(tag.toLowerCase(Locale.ROOT))) {
                    throw new ValidationException("Content of " + path + " uses denied YAML tag " + tag);
                }
            }
        };
    }

    public static ContentRule notBlankMarkdown() {
        return (path, content) -> {
            String extension = FileInfo.extensionOf(path);
            if ((".md".equals(extension) || ".markdown".equals(extension)) && content.isBlank()) {
                throw new ValidationException("Markdown file " + path + " is empty");
            }
        };
    }
}
