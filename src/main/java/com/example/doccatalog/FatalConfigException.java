package com.example.doccatalog;

/**
 * Raised when the configuration cannot be honored before any work starts.
 */
public class FatalConfigException extends CatalogException {
    public FatalConfigException(String message) {
        super(message);
    }

    public FatalConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
