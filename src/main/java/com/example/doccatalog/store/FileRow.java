package com.example.doccatalog.store;

/**
 * One row of the {@code files} table.
 */
public record FileRow(
        String relativePath,
        String filename,
        String extension,
        Long sizeBytes,
        String humanReadableSize,
        String checksum,
        String sessionId,
        String fileKey,
        String hashAlgorithm
) {
}
