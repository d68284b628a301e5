package work.mdwf.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EnvironmentManifestTest {
    @Test
    void mapsAreSortedSoEqualSourcesSerializeIdentically() {
        Map<String, List<String>> first = new LinkedHashMap<>();
        first.put("job", List.of("cover"));
        first.put("blog", List.of("post"));
        Map<String, List<String>> second = new LinkedHashMap<>();
        second.put("blog", List.of("post"));
        second.put("job", List.of("cover"));

        var a = new EnvironmentManifest(List.of("blog", "job"), List.of(), List.of(), first, Map.of(), false);
        var b = new EnvironmentManifest(List.of("blog", "job"), List.of(), List.of(), second, Map.of(), false);

        assertEquals(a, b);
        assertEquals(a.toPrettyJson(), b.toPrettyJson());
        assertEquals(List.of("blog", "job"), List.copyOf(a.templates().keySet()));
    }

    @Test
    void mergeUnionsAndOrsConfig() {
        var local = new EnvironmentManifest(
            List.of("job"), List.of("mermaid"), List.of(), Map.of("job", List.of("cover")), Map.of(), false
        );
        var global = new EnvironmentManifest(
            List.of("blog", "job"),
            List.of("mermaid", "emoji"),
            List.of("pandoc"),
            Map.of("job", List.of("resume", "cover"), "blog", List.of("post")),
            Map.of("blog", List.of("style.css")),
            true
        );

        var merged = EnvironmentManifest.merge(local, global);

        assertEquals(List.of("job", "blog"), merged.workflows());
        assertEquals(List.of("mermaid", "emoji"), merged.processors());
        assertEquals(List.of("cover", "resume"), merged.templatesFor("job"));
        assertEquals(List.of("style.css"), merged.staticsFor("blog"));
        assertEquals(List.of(), merged.staticsFor("job"));
        assertTrue(merged.hasConfig());
    }

    @Test
    void emptyManifestHasNothing() {
        var empty = EnvironmentManifest.empty();
        assertTrue(empty.workflows().isEmpty());
        assertFalse(empty.hasConfig());
        assertEquals(Boolean.FALSE, empty.toSerializableMap().get("hasConfig"));
    }

    @Test
    void requestKeys() {
        assertEquals("job/cover", TemplateRequest.of("job", "cover").key());
        assertEquals("job/cover/formal", TemplateRequest.of("job", "cover", "formal").key());
        assertEquals("job/cover", TemplateRequest.of("job", "cover", " ").key());
        assertEquals("job/ref.docx", StaticRequest.of("job", "ref.docx").key());
        assertEquals(TemplateRequest.of("job", "cover"), TemplateRequest.of("job", "cover", "formal").withoutVariant());
    }
}
