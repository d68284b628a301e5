package work.mdwf.schema;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * Project configuration ({@code config.yml}): user identity, system behaviour and
 * per-workflow overrides.
 */
public record ProjectConfig(UserConfig user, SystemConfig system, Map<String, Map<String, Object>> workflows) {
    public ProjectConfig {
        SchemaChecks.requirePresent(user, "user");
        system = system == null ? SystemConfig.empty() : system;
        workflows = SchemaChecks.mapOrEmpty(workflows);
    }

    public record UserConfig(
        String name,
        @JsonProperty("preferred_name") String preferredName,
        String email,
        String phone,
        String address,
        String city,
        String state,
        String zip,
        String linkedin,
        String github,
        String website
    ) {
        public UserConfig {
            SchemaChecks.requireText(name, "user.name");
            SchemaChecks.requireText(preferredName, "user.preferred_name");
            SchemaChecks.requireText(email, "user.email");
            if (!email.contains("@")) {
                throw new IllegalArgumentException("user.email is not a valid address: " + email);
            }
        }
    }

    public record SystemConfig(
        String scraper,
        @JsonProperty("web_download") WebDownload webDownload,
        @JsonProperty("output_formats") List<String> outputFormats,
        GitSettings git,
        @JsonProperty("collection_id") CollectionIdSettings collectionId,
        Map<String, Object> testing
    ) {
        public SystemConfig {
            SchemaChecks.requireOneOf(scraper, "system.scraper", List.of("wget", "curl", "chrome"));
            outputFormats = SchemaChecks.listOrEmpty(outputFormats);
            testing = SchemaChecks.mapOrEmpty(testing);
        }

        static SystemConfig empty() {
            return new SystemConfig(null, null, List.of(), null, null, Map.of());
        }
    }

    public record WebDownload(
        Integer timeout,
        @JsonProperty("add_utf8_bom") Boolean addUtf8Bom,
        @JsonProperty("html_cleanup") String htmlCleanup
    ) {
        public WebDownload {
            SchemaChecks.requireOneOf(htmlCleanup, "system.web_download.html_cleanup", List.of("none", "scripts", "markdown"));
        }
    }

    public record GitSettings(
        @JsonProperty("auto_commit") Boolean autoCommit,
        @JsonProperty("commit_message_template") String commitMessageTemplate
    ) {}

    public record CollectionIdSettings(
        @JsonProperty("date_format") String dateFormat,
        @JsonProperty("sanitize_spaces") String sanitizeSpaces,
        @JsonProperty("max_length") Integer maxLength
    ) {}
}
