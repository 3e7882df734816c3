package com.example.doccatalog;

/**
 * Base type for every failure that aborts a catalog run.
 */
public class CatalogException extends RuntimeException {
    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
