package work.mdwf.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable limits applied by {@link SecurityValidator}.
 */
public record SecurityConfig(
    Map<String, Long> fileSizeLimits,
    Set<String> allowedExtensions,
    int maxFileCount,
    long maxTotalSize,
    int maxPathDepth,
    boolean enableContentValidation,
    List<ContentRule> contentRules
) {
    private static final long KIB = 1024L;
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final SecurityConfig DEFAULTS = new SecurityConfig(
        defaultSizeLimits(),
        defaultSizeLimits().keySet(),
        500,
        5 * KIB * KIB,
        6,
        true,
        ContentRules.defaults()
    );

    public SecurityConfig {
        Objects.requireNonNull(fileSizeLimits, "fileSizeLimits");
        Objects.requireNonNull(allowedExtensions, "allowedExtensions");
        Objects.requireNonNull(contentRules, "contentRules");
        fileSizeLimits = Map.copyOf(normalizeKeys(fileSizeLimits));
        allowedExtensions = Set.copyOf(normalizeExtensions(allowedExtensions));
        contentRules = List.copyOf(contentRules);
        if (maxFileCount <= 0 || maxTotalSize <= 0 || maxPathDepth <= 0) {
            throw new IllegalArgumentException("maxFileCount, maxTotalSize and maxPathDepth must be positive");
        }
    }

    public static SecurityConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder(DEFAULTS);
    }

    public static Builder builder(SecurityConfig base) {
        return new Builder(base);
    }

    /**
     * Reads overrides from a YAML file onto the defaults. Size limits given in the file are
     * merged with the default table rather than replacing it.
     */
    public static SecurityConfig load(Path yamlFile) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(Files.readString(yamlFile));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read security config: " + yamlFile, ex);
        }
        var builder = builder();
        if (root == null || !root.isObject()) {
            return builder.build();
        }
        JsonNode limits = root.path("fileSizeLimits");
        if (limits.isObject()) {
            var fields = limits.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                builder.fileSizeLimit(entry.getKey(), entry.getValue().asLong());
            }
        }
        JsonNode allowed = root.path("allowedExtensions");
        if (allowed.isArray()) {
            Set<String> extensions = new LinkedHashSet<>();
            allowed.forEach(node -> extensions.add(node.asText()));
            builder.allowedExtensions(extensions);
        }
        if (root.hasNonNull("maxFileCount")) {
            builder.maxFileCount(root.get("maxFileCount").asInt());
        }
        if (root.hasNonNull("maxTotalSize")) {
            builder.maxTotalSize(root.get("maxTotalSize").asLong());
        }
        if (root.hasNonNull("maxPathDepth")) {
            builder.maxPathDepth(root.get("maxPathDepth").asInt());
        }
        if (root.hasNonNull("enableContentValidation")) {
            builder.enableContentValidation(root.get("enableContentValidation").asBoolean());
        }
        JsonNode content = root.path("content");
        if (content.isObject()) {
            List<ContentRule> rules = new ArrayList<>();
            rules.add(ContentRules.maxLength(content.path("maxLength").asLong(ContentRules.DEFAULT_MAX_CONTENT_LENGTH)));
            rules.add(ContentRules.noNullCharacters());
            List<String> tags = new ArrayList<>();
            if (content.path("deniedYamlTags").isArray()) {
                content.get("deniedYamlTags").forEach(node -> tags.add(node.asText()));
            } else {
                tags.addAll(ContentRules.DEFAULT_DENIED_YAML_TAGS);
            }
            rules.add(ContentRules.deniedYamlTags(tags));
            if (content.path("rejectEmptyMarkdown").asBoolean(false)) {
                rules.add(ContentRules.notBlankMarkdown());
            }
            builder.contentRules(rules);
        }
        return builder.build();
    }

    /**
     * Limit for the extension, or {@code -1} when the extension is unconstrained.
     */
    public long sizeLimitFor(String extension) {
        return fileSizeLimits.getOrDefault(normalizeExtension(extension), -1L);
    }

    private static Map<String, Long> defaultSizeLimits() {
        Map<String, Long> limits = new LinkedHashMap<>();
        for (String text : List.of(".yml", ".yaml", ".json", ".md", ".markdown", ".txt", ".css")) {
            limits.put(text, 100 * KIB);
        }
        limits.put(".html", 200 * KIB);
        for (String image : List.of(".png", ".jpg", ".jpeg", ".gif", ".svg")) {
            limits.put(image, 500 * KIB);
        }
        limits.put(".docx", 1024 * KIB);
        limits.put(".pdf", 1024 * KIB);
        return limits;
    }

    private static Map<String, Long> normalizeKeys(Map<String, Long> limits) {
        Map<String, Long> normalized = new LinkedHashMap<>();
        limits.forEach((key, value) -> normalized.put(normalizeExtension(key), value));
        return normalized;
    }

    private static Set<String> normalizeExtensions(Set<String> extensions) {
        Set<String> normalized = new LinkedHashSet<>();
        extensions.forEach(ext -> normalized.add(normalizeExtension(ext)));
        return normalized;
    }

    private static String normalizeExtension(String extension) {
        String lowered = extension == null ? "" : extension.trim().toLowerCase(Locale.ROOT);
        if (!lowered.isEmpty() && !lowered.startsWith(".")) {
            return "." + lowered;
        }
        return lowered;
    }

    public static final class Builder {
        private final Map<String, Long> fileSizeLimits;
        private Set<String> allowedExtensions;
        private int maxFileCount;
        private long maxTotalSize;
        private int maxPathDepth;
        private boolean enableContentValidation;
        private List<ContentRule> contentRules;

        private Builder(SecurityConfig base) {
            this.fileSizeLimits = new LinkedHashMap<>(base.fileSizeLimits());
            this.allowedExtensions = new LinkedHashSet<>(base.allowedExtensions());
            this.maxFileCount = base.maxFileCount();
            this.maxTotalSize = base.maxTotalSize();
            this.maxPathDepth = base.maxPathDepth();
            this.enableContentValidation = base.enableContentValidation();
            this.contentRules = base.contentRules();
        }

        public Builder fileSizeLimit(String extension, long maxBytes) {
            this.fileSizeLimits.put(normalizeExtension(extension), maxBytes);
            return this;
        }

        public Builder allowedExtensions(Set<String> allowedExtensions) {
            this.allowedExtensions = new LinkedHashSet<>(allowedExtensions);
            return this;
        }

        public Builder allowExtension(String extension) {
            this.allowedExtensions.add(normalizeExtension(extension));
            return this;
        }

        public Builder maxFileCount(int maxFileCount) {
            this.maxFileCount = maxFileCount;
            return this;
        }

        public Builder maxTotalSize(long maxTotalSize) {
            this.maxTotalSize = maxTotalSize;
            return this;
        }

        public Builder maxPathDepth(int maxPathDepth) {
            this.maxPathDepth = maxPathDepth;
            return this;
        }

        public Builder enableContentValidation(boolean enableContentValidation) {
            this.enableContentValidation = enableContentValidation;
            return this;
        }

        public Builder contentRules(List<ContentRule> contentRules) {
            this.contentRules = List.copyOf(contentRules);
            return this;
        }

        public Builder addContentRule(ContentRule rule) {
            List<ContentRule> rules = new ArrayList<>(contentRules);
            rules.add(rule);
            this.contentRules = rules;
            return this;
        }

        public SecurityConfig build() {
            return new SecurityConfig(
                fileSizeLimits,
                allowedExtensions,
                maxFileCount,
                maxTotalSize,
                maxPathDepth,
                enableContentValidation,
                contentRules
            );
        }
    }
}
