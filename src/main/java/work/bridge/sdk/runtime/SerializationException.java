package work.bridge.sdk.runtime;

/**
 * The step result cannot be encoded under its declared return type.
 */
public final class SerializationException extends StepInvocationException {
    public SerializationException(String stepName, String message, Throwable cause) {
        super("serialization_error", stepName, message, cause);
    }
}
