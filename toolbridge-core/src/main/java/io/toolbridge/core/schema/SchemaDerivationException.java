package io.toolbridge.core.schema;

/**
 * Raised when a handler's declared parameters and its documentation cannot be turned into an input schema.
 */
public final class SchemaDerivationException extends IllegalArgumentException {
    public SchemaDerivationException(String message) {
        super(message);
    }
}
