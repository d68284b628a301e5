package work.mdwf.environment;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link EnvironmentFactory#validateEnvironment}. Issues make the environment
 * unusable; warnings do not.
 */
public record EnvironmentReport(boolean valid, List<String> issues, List<String> warnings) {
    public EnvironmentReport {
        issues = List.copyOf(issues);
        warnings = List.copyOf(warnings);
    }

    public static EnvironmentReport of(List<String> issues, List<String> warnings) {
        return new EnvironmentReport(issues.isEmpty(), issues, warnings);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("valid", valid);
        serializable.put("issues", issues);
        serializable.put("warnings", warnings);
        return serializable;
    }
}
