package work.mdwf.security;

/**
 * A sanity check run over decoded text before it is handed to a parser.
 */
@FunctionalInterface
public interface ContentRule {
    /**
     * @throws work.mdwf.api.ValidationException when the content is rejected
     */
    void check(String path, String content);
}
