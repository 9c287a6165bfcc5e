package work.bridge.sdk.runtime;

/**
 * The explicit input is not a JSON object.
 */
public final class InvalidInputException extends StepInvocationException {
    public InvalidInputException(String stepName, String message, Throwable cause) {
        super("invalid_input", stepName, message, cause);
    }
}
