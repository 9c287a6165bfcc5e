package work.bridge.sdk.step;

/**
 * Best-effort origin of a step declaration. Both fields are {@code null} when unknown.
 */
public record SourceLocation(String filePath, Integer lineNumber) {
    private static final SourceLocation UNKNOWN = new SourceLocation(null, null);

    public static SourceLocation unknown() {
        return UNKNOWN;
    }

    public boolean isKnown() {
        return filePath != null;
    }
}
