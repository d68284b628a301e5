package work.mdwf.api;

/**
 * A resource is present but malformed, or a source failed batch/content validation.
 */
public final class ValidationException extends EnvironmentException {
    public static final String CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(message, CODE);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, CODE, cause);
    }
}
