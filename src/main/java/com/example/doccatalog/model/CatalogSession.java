package com.example.doccatalog.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * One engine run, persisted before any file row that references it.
 */
public record CatalogSession(
        String sessionId,
        List<Path> searchDirectories,
        Path baseDirectory,
        String hashAlgorithm,
        int bufferSize,
        Instant createdAt
) {
    public CatalogSession {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be blank");
        }
        searchDirectories = List.copyOf(searchDirectories);
    }
}
