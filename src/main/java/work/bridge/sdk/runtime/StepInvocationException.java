package work.bridge.sdk.runtime;

import work.bridge.sdk.shared.BridgeException;

/**
 * Failure of a single step invocation. Registry state is never affected.
 */
public class StepInvocationException extends BridgeException {
    private final String stepName;

    protected StepInvocationException(String code, String stepName, String message, Throwable cause) {
        super(code, message, cause);
        this.stepName = stepName;
    }

    public String stepName() {
        return stepName;
    }
}
