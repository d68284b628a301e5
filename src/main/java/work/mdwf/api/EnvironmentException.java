package work.mdwf.api;

/**
 * Base failure raised by {@link Environment} implementations, tagged with a stable code.
 */
public class EnvironmentException extends RuntimeException {
    private final String code;

    public EnvironmentException(String message, String code) {
        this(message, code, null);
    }

    public EnvironmentException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
