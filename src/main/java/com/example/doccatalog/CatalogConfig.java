package com.example.doccatalog;

import com.example.doccatalog.store.CatalogStore;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable runtime settings for one catalog run.
 */
public record CatalogConfig(
        List<Path> roots,
        Path baseDirectory,
        List<String> excludeDirectories,
        List<String> excludeFiles,
        Optional<Path> existingCatalog,
        Optional<Path> priorStore,
        Optional<String> priorSessionId,
        boolean requireExisting,
        Path storePath,
        StorePolicy storePolicy,
        Optional<Path> exportPath,
        boolean allowExportOverwrite,
        boolean checkFileContents,
        HashAlgorithm hashAlgorithm,
        int readBufferSize,
        int bufferThreshold,
        int threadCount,
        boolean followLinks,
        Optional<Integer> maxNewEntries,
        Optional<String> sessionId,
        boolean verbose
) {
    public static final String DEFAULT_STORE = "document_catalog.db";

    public CatalogConfig {
        if (roots == null || roots.isEmpty()) {
            throw new IllegalArgumentException("Config must include at least one root path.");
        }
        if (readBufferSize <= 0 || bufferThreshold <= 0 || threadCount <= 0) {
            throw new IllegalArgumentException("Buffer sizes and thread count must be positive.");
        }
        roots = List.copyOf(roots);
        excludeDirectories = List.copyOf(excludeDirectories);
        excludeFiles = List.copyOf(excludeFiles);
        if (baseDirectory == null) {
            baseDirectory = roots.get(0);
        }
    }

    public static Builder builder(List<Path> roots) {
        return new Builder(roots);
    }

    public static final class Builder {
        private final List<Path> roots;
        private Path baseDirectory;
        private List<String> excludeDirectories = new ArrayList<>();
        private List<String> excludeFiles = new ArrayList<>();
        private Path existingCatalog;
        private Path priorStore;
        private String priorSessionId;
        private boolean requireExisting;
        private Path storePath = Path.of(DEFAULT_STORE);
        private StorePolicy storePolicy = StorePolicy.ERROR;
        private Path exportPath;
        private boolean allowExportOverwrite;
        private boolean checkFileContents = true;
        private HashAlgorithm hashAlgorithm = HashAlgorithm.SHA1;
        private int readBufferSize = IdentityResolver.DEFAULT_BUFFER_SIZE;
        private int bufferThreshold = CatalogStore.DEFAULT_BUFFER_THRESHOLD;
        private int threadCount = 1;
        private boolean followLinks;
        private Integer maxNewEntries;
        private String sessionId;
        private boolean verbose;

        private Builder(List<Path> roots) {
            this.roots = List.copyOf(roots);
        }

        public Builder baseDirectory(Path value) {
            this.baseDirectory = value;
            return this;
        }

        public Builder excludeDirectories(List<String> value) {
            this.excludeDirectories = new ArrayList<>(value);
            return this;
        }

        public Builder excludeFiles(List<String> value) {
            this.excludeFiles = new ArrayList<>(value);
            return this;
        }

        public Builder existingCatalog(Path value) {
            this.existingCatalog = value;
            return this;
        }

        public Builder priorStore(Path value) {
            this.priorStore = value;
            return this;
        }

        public Builder priorSessionId(String value) {
            this.priorSessionId = value;
            return this;
        }

        public Builder requireExisting(boolean value) {
            this.requireExisting = value;
            return this;
        }

        public Builder storePath(Path value) {
            this.storePath = value;
            return this;
        }

        public Builder storePolicy(StorePolicy value) {
            this.storePolicy = value;
            return this;
        }

        public Builder exportPath(Path value) {
            this.exportPath = value;
            return this;
        }

        public Builder allowExportOverwrite(boolean value) {
            this.allowExportOverwrite = value;
            return this;
        }

        public Builder checkFileContents(boolean value) {
            this.checkFileContents = value;
            return this;
        }

        public Builder hashAlgorithm(HashAlgorithm value) {
            this.hashAlgorithm = value;
            return this;
        }

        public Builder readBufferSize(int value) {
            this.readBufferSize = value;
            return this;
        }

        public Builder bufferThreshold(int value) {
            this.bufferThreshold = value;
            return this;
        }

        public Builder threadCount(int value) {
            this.threadCount = value;
            return this;
        }

        public Builder followLinks(boolean value) {
            this.followLinks = value;
            return this;
        }

        public Builder maxNewEntries(Integer value) {
            this.maxNewEntries = value;
            return this;
        }

        public Builder sessionId(String value) {
            this.sessionId = value;
            return this;
        }

        public Builder verbose(boolean value) {
            this.verbose = value;
            return this;
        }

        public CatalogConfig build() {
            return new CatalogConfig(
                    roots,
                    baseDirectory,
                    excludeDirectories,
                    excludeFiles,
                    Optional.ofNullable(existingCatalog),
                    Optional.ofNullable(priorStore),
                    Optional.ofNullable(priorSessionId),
                    requireExisting,
                    storePath,
                    storePolicy,
                    Optional.ofNullable(exportPath),
                    allowExportOverwrite,
                    checkFileContents,
                    hashAlgorithm,
                    readBufferSize,
                    bufferThreshold,
                    threadCount,
                    followLinks,
                    Optional.ofNullable(maxNewEntries),
                    Optional.ofNullable(sessionId),
                    verbose
            );
        }
    }
}
