package com.example.doccatalog;

import java.nio.file.Path;

/**
 * Raised when the destination store is already present (or in use) and the
 * configured policy does not allow writing to it.
 */
public class StoreConflictException extends CatalogException {
    private final Path storePath;

    public StoreConflictException(Path storePath, String message) {
        super(message);
        this.storePath = storePath;
    }

    public Path storePath() {
        return storePath;
    }
}
