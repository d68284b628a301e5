package work.mdwf.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Identifies a template of a workflow, optionally qualified by a rendering variant.
 */
public record TemplateRequest(String workflow, String template, Optional<String> variant) {
    public TemplateRequest {
        Objects.requireNonNull(workflow, "workflow");
        Objects.requireNonNull(template, "template");
        variant = variant == null ? Optional.empty() : variant.filter(v -> !v.isBlank());
    }

    public static TemplateRequest of(String workflow, String template) {
        return new TemplateRequest(workflow, template, Optional.empty());
    }

    public static TemplateRequest of(String workflow, String template, String variant) {
        return new TemplateRequest(workflow, template, Optional.ofNullable(variant));
    }

    public TemplateRequest withoutVariant() {
        return variant.isEmpty() ? this : of(workflow, template);
    }

    /**
     * Renders {@code <workflow>/<template>[/<variant>]}.
     */
    public String key() {
        return variant.map(v -> workflow + "/" + template + "/" + v).orElse(workflow + "/" + template);
    }
}
