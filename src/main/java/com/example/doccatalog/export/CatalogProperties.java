package com.example.doccatalog.export;

import com.example.doccatalog.CatalogConfig;
import com.example.doccatalog.model.CatalogSession;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Settings a catalog was built with, written next to the exported table.
 */
public record CatalogProperties(
        String sessionId,
        List<String> searchDirectories,
        List<String> excludeDirectories,
        String existingCatalog,
        String priorStore,
        String baseDirectory,
        String store,
        String hashFunction,
        int readBufferSize,
        int bufferThreshold,
        boolean checkFileContents,
        Instant createdAt
) {
    public static CatalogProperties from(CatalogSession session, CatalogConfig config) {
        return new CatalogProperties(
                session.sessionId(),
                session.searchDirectories().stream().map(Path::toString).toList(),
                config.excludeDirectories(),
                config.existingCatalog().map(Path::toString).orElse(null),
                config.priorStore().map(Path::toString).orElse(null),
                session.baseDirectory().toString(),
                config.storePath().toString(),
                session.hashAlgorithm(),
                config.readBufferSize(),
                session.bufferSize(),
                config.checkFileContents(),
                session.createdAt()
        );
    }
}
