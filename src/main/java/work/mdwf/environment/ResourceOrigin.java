package work.mdwf.environment;

/**
 * Which layer of a {@link MergedEnvironment} serves a resource.
 */
public enum ResourceOrigin {
    LOCAL,
    GLOBAL,
    NONE
}
