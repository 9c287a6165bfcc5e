package work.bridge.sdk.shared;

/**
 * Base type for every failure raised by the SDK. Carries a stable machine-readable code.
 */
public abstract class BridgeException extends RuntimeException {
    private final String code;

    protected BridgeException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected BridgeException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * The message prefixed with the error code, e.g. {@code [step_failed] Step x failed}.
     */
    public String summary() {
        String message = getMessage();
        if (message == null || message.isBlank()) {
            message = getClass().getSimpleName();
        }
        return "[" + code + "] " + message;
    }
}
