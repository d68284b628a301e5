package work.mdwf.api;

/**
 * A path, filename, extension or size violated the configured security limits.
 */
public final class EnvironmentSecurityException extends EnvironmentException {
    public static final String CODE = "SECURITY_ERROR";

    public EnvironmentSecurityException(String message) {
        super(message, CODE);
    }

    public EnvironmentSecurityException(String message, Throwable cause) {
        super(message, CODE, cause);
    }
}
