package work.bridge.sdk.runtime;

/**
 * The step body itself failed, was cancelled or was interrupted. The underlying failure is kept as the cause.
 */
public final class StepExecutionException extends StepInvocationException {
    public StepExecutionException(String stepName, String message, Throwable cause) {
        super("step_failed", stepName, message, cause);
    }
}
