package work.bridge.sdk.schema;

/**
 * How a parameter collects surplus arguments.
 */
public enum VariadicKind {
    NONE,
    /** Java varargs: a repeated element of the declared component type. */
    POSITIONAL_REST,
    /** A {@link KeywordArgs} map of string to the declared value type. */
    KEYWORD_REST
}
