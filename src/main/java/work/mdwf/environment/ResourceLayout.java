package work.mdwf.environment;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import work.mdwf.api.StaticRequest;
import work.mdwf.api.TemplateRequest;
import work.mdwf.security.SecurityValidator;

/**
 * Directory layout shared by every tree-shaped backing. Paths are relative, {@code /}
 * separated, and resolution is expressed as candidate lists where the first existing
 * candidate wins, so directory and archive backings resolve identically.
 *
 * <pre>
 * config.yml | config.yaml
 * workflows/&lt;name&gt;/workflow.yml
 * workflows/&lt;name&gt;/templates/&lt;template&gt;/{default.md | &lt;variant&gt;.md}
 * workflows/&lt;name&gt;/templates/static/&lt;file&gt;
 * processors/&lt;name&gt;.yml
 * converters/&lt;name&gt;.yml
 * </pre>
 */
final class ResourceLayout {
    static final String WORKFLOWS_DIR = "workflows";
    static final String PROCESSORS_DIR = "processors";
    static final String CONVERTERS_DIR = "converters";
    static final String WORKFLOW_FILE = "workflow.yml";
    static final String TEMPLATES_DIR = "templates";
    static final String STATIC_DIR = "static";
    static final String DEFAULT_TEMPLATE = "default.md";
    static final List<String> CONFIG_CANDIDATES = List.of("config.yml", "config.yaml");

    private ResourceLayout() {}

    static String workflowFile(String workflow) {
        return WORKFLOWS_DIR + "/" + workflow + "/" + WORKFLOW_FILE;
    }

    static String templatesDir(String workflow) {
        return WORKFLOWS_DIR + "/" + workflow + "/" + TEMPLATES_DIR;
    }

    static String staticDir(String workflow) {
        return templatesDir(workflow) + "/" + STATIC_DIR;
    }

    static List<String> templateCandidates(TemplateRequest request) {
        String base = templatesDir(request.workflow()) + "/" + request.template();
        List<String> candidates = new ArrayList<>(2);
        request.variant().ifPresent(variant -> candidates.add(base + "/" + variant + ".md"));
        candidates.add(base + "/" + DEFAULT_TEMPLATE);
        return candidates;
    }

    static List<String> staticCandidates(StaticRequest request) {
        return List.of(
            staticDir(request.workflow()) + "/" + request.staticName(),
            templatesDir(request.workflow()) + "/" + request.staticName()
        );
    }

    static boolean isDefinitionFile(String name) {
        String lowered = name.toLowerCase(Locale.ROOT);
        return lowered.endsWith(".yml") || lowered.endsWith(".yaml");
    }

    static boolean isTemplateFile(String name) {
        return name.toLowerCase(Locale.ROOT).endsWith(".md");
    }

    /**
     * Rejects request names that could escape the resource tree.
     *
     * @throws work.mdwf.api.EnvironmentSecurityException for an unsafe name
     */
    static void checkWorkflowName(SecurityValidator validator, String workflow) {
        validator.validateFilename(workflow);
    }

    static void checkRequest(SecurityValidator validator, TemplateRequest request) {
        validator.validateFilename(request.workflow());
        validator.validateFilename(request.template());
        request.variant().ifPresent(validator::validateFilename);
    }

    static void checkRequest(SecurityValidator validator, StaticRequest request) {
        validator.validateFilename(request.workflow());
        validator.validatePath(request.staticName());
    }
}
