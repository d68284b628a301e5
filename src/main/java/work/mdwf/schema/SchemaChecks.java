package work.mdwf.schema;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Field-level checks shared by the schema records. Failures surface through Jackson as
 * instantiation problems and are reported by {@link ResourceSchemas}.
 */
final class SchemaChecks {
    private SchemaChecks() {}

    static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }

    static <T> T requirePresent(T value, String field) {
        if (value == null) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }

    static String requireOneOf(String value, String field, Collection<String> allowed) {
        if (value != null && !allowed.contains(value)) {
            throw new IllegalArgumentException(field + " must be one of " + allowed + " (got '" + value + "')");
        }
        return value;
    }

    static <T> List<T> listOrEmpty(List<T> value) {
        return value == null ? List.of() : List.copyOf(value);
    }

    static <K, V> Map<K, V> mapOrEmpty(Map<K, V> value) {
        return value == null ? Map.of() : value;
    }
}
