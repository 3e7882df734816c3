package com.example.doccatalog.store;

/**
 * A {@code files} row joined with the base directory of its session.
 */
public record StoredFile(
        String sessionId,
        String baseDirectory,
        String relativePath,
        String filename,
        String extension,
        Long sizeBytes,
        String checksum,
        String fileKey,
        String hashAlgorithm
) {
}
