package work.mdwf.api;

import java.util.Objects;

/**
 * Identifies a static asset (stylesheet, reference document, image) of a workflow.
 */
public record StaticRequest(String workflow, String staticName) {
    public StaticRequest {
        Objects.requireNonNull(workflow, "workflow");
        Objects.requireNonNull(staticName, "staticName");
    }

    public static StaticRequest of(String workflow, String staticName) {
        return new StaticRequest(workflow, staticName);
    }

    public String key() {
        return workflow + "/" + staticName;
    }
}
