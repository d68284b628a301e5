package work.mdwf.api;

/**
 * A workflow, template, static file, processor or converter is absent from the environment.
 */
public final class ResourceNotFoundException extends EnvironmentException {
    public static final String CODE = "RESOURCE_NOT_FOUND";

    private final String kind;
    private final String id;

    public ResourceNotFoundException(String kind, String id) {
        this(kind, id, kind + " not found: " + id, null);
    }

    public ResourceNotFoundException(String kind, String id, Throwable cause) {
        this(kind, id, kind + " not found: " + id, cause);
    }

    public ResourceNotFoundException(String kind, String id, String message, Throwable cause) {
        super(message, CODE, cause);
        this.kind = kind;
        this.id = id;
    }

    public String kind() {
        return kind;
    }

    public String id() {
        return id;
    }
}
