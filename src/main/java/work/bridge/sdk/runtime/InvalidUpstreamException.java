package work.bridge.sdk.runtime;

/**
 * The upstream step results are not a JSON object.
 */
public final class InvalidUpstreamException extends StepInvocationException {
    public InvalidUpstreamException(String stepName, String message, Throwable cause) {
        super("invalid_upstream", stepName, message, cause);
    }
}
