package com.example.doccatalog.store;

import com.example.doccatalog.CatalogException;

/**
 * The store could not be opened, migrated or written.
 */
public class CatalogStoreException extends CatalogException {
    public CatalogStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
