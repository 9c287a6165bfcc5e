package work.bridge.sdk.schema;

import work.bridge.sdk.shared.BridgeException;

/**
 * Raised when a callable signature cannot be expressed as a parameter/return schema.
 * Registration of the offending callable is aborted.
 */
public final class SchemaDerivationException extends BridgeException {
    public SchemaDerivationException(String message) {
        super("schema_derivation_error", message);
    }

    public SchemaDerivationException(String message, Throwable cause) {
        super("schema_derivation_error", message, cause);
    }
}
