package work.mdwf.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summary of everything an {@link Environment} can currently serve.
 *
 * <p>Resource maps are kept sorted by workflow name so that two manifests derived from the
 * same source compare equal and serialize identically.</p>
 */
public record EnvironmentManifest(
    List<String> workflows,
    List<String> processors,
    List<String> converters,
    Map<String, List<String>> templates,
    Map<String, List<String>> statics,
    boolean hasConfig
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public EnvironmentManifest {
        workflows = List.copyOf(workflows);
        processors = List.copyOf(processors);
        converters = List.copyOf(converters);
        templates = freeze(templates);
        statics = freeze(statics);
    }

    public static EnvironmentManifest empty() {
        return new EnvironmentManifest(List.of(), List.of(), List.of(), Map.of(), Map.of(), false);
    }

    /**
     * Combines two manifests: lists are unioned (local entries first) and
     * {@code hasConfig} holds when either side has a configuration.
     */
    public static EnvironmentManifest merge(EnvironmentManifest local, EnvironmentManifest global) {
        return new EnvironmentManifest(
            union(local.workflows(), global.workflows()),
            union(local.processors(), global.processors()),
            union(local.converters(), global.converters()),
            mergeResourceMaps(local.templates(), global.templates()),
            mergeResourceMaps(local.statics(), global.statics()),
            local.hasConfig() || global.hasConfig()
        );
    }

    public List<String> templatesFor(String workflow) {
        return templates.getOrDefault(workflow, List.of());
    }

    public List<String> staticsFor(String workflow) {
        return statics.getOrDefault(workflow, List.of());
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("workflows", workflows);
        serializable.put("processors", processors);
        serializable.put("converters", converters);
        serializable.put("templates", templates);
        serializable.put("statics", statics);
        serializable.put("hasConfig", hasConfig);
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize manifest: " + ex.getOriginalMessage(), ex);
        }
    }

    private static List<String> union(List<String> first, List<String> second) {
        var merged = new LinkedHashSet<String>(first);
        merged.addAll(second);
        return new ArrayList<>(merged);
    }

    private static Map<String, List<String>> mergeResourceMaps(
        Map<String, List<String>> local,
        Map<String, List<String>> global
    ) {
        Map<String, List<String>> merged = new TreeMap<>();
        for (var entry : local.entrySet()) {
            merged.put(entry.getKey(), entry.getValue());
        }
        for (var entry : global.entrySet()) {
            merged.merge(entry.getKey(), entry.getValue(), EnvironmentManifest::union);
        }
        return merged;
    }

    private static Map<String, List<String>> freeze(Map<String, List<String>> source) {
        Map<String, List<String>> sorted = new TreeMap<>();
        for (var entry : source.entrySet()) {
            sorted.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        return Collections.unmodifiableMap(sorted);
    }
}
