package work.bridge.sdk.shared;

/**
 * Raised when a discovery unit or configuration file is malformed. Aborts the load of that unit.
 */
public final class ConfigurationException extends BridgeException {
    public ConfigurationException(String message) {
        super("configuration_error", message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super("configuration_error", message, cause);
    }
}
