package com.example.doccatalog;

/**
 * Raised when an existing catalog cannot be read with the expected layout.
 */
public class SchemaException extends CatalogException {
    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
