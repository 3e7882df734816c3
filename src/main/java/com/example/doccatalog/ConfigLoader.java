package com.example.doccatalog;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class ConfigLoader {
    private static final List<String> DEFAULT_EXCLUDE_FILES = List.of(
            "Thumbs.db",
            "desktop.ini",
            "ehthumbs.db",
            "pagefile.sys",
            "hiberfil.sys",
            "swapfile.sys"
    );
    private static final List<String> DEFAULT_EXCLUDE_DIRECTORIES = List.of(
            "$RECYCLE.BIN",
            "System Volume Information"
    );

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public CatalogConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        if (raw.roots == null || raw.roots.isEmpty()) {
            throw new FatalConfigException("Config must include at least one root path.");
        }

        HashAlgorithm hashAlgorithm;
        StorePolicy storePolicy;
        try {
            hashAlgorithm = raw.hashAlgorithm == null || raw.hashAlgorithm.isBlank()
                    ? HashAlgorithm.SHA1
                    : HashAlgorithm.of(raw.hashAlgorithm);
            storePolicy = StorePolicy.of(raw.storePolicy);
        } catch (IllegalArgumentException ex) {
            throw new FatalConfigException("Invalid configuration in " + path + ": " + ex.getMessage(), ex);
        }

        CatalogConfig.Builder builder = CatalogConfig.builder(raw.roots.stream().map(Path::of).toList())
                .excludeDirectories(mergePatterns(DEFAULT_EXCLUDE_DIRECTORIES, raw.excludeDirectories))
                .excludeFiles(mergePatterns(DEFAULT_EXCLUDE_FILES, raw.excludeFiles))
                .requireExisting(raw.requireExisting != null && raw.requireExisting)
                .storePath(Path.of(optionalString(raw.storePath, CatalogConfig.DEFAULT_STORE)))
                .storePolicy(storePolicy)
                .allowExportOverwrite(raw.allowExportOverwrite != null && raw.allowExportOverwrite)
                .checkFileContents(raw.checkFileContents == null || raw.checkFileContents)
                .hashAlgorithm(hashAlgorithm)
                .followLinks(raw.followLinks != null && raw.followLinks)
                .maxNewEntries(raw.maxNewEntries)
                .sessionId(optionalString(raw.sessionId, null))
                .priorSessionId(optionalString(raw.priorSessionId, null))
                .verbose(raw.verbose != null && raw.verbose);

        if (raw.baseDirectory != null && !raw.baseDirectory.isBlank()) {
            builder.baseDirectory(Path.of(raw.baseDirectory));
        }
        if (raw.existingCatalog != null && !raw.existingCatalog.isBlank()) {
            builder.existingCatalog(Path.of(raw.existingCatalog));
        }
        if (raw.priorStore != null && !raw.priorStore.isBlank()) {
            builder.priorStore(Path.of(raw.priorStore));
        }
        if (raw.exportPath != null && !raw.exportPath.isBlank()) {
            builder.exportPath(Path.of(raw.exportPath));
        }
        if (raw.readBufferSize != null && raw.readBufferSize > 0) {
            builder.readBufferSize(raw.readBufferSize);
        }
        if (raw.bufferThreshold != null && raw.bufferThreshold > 0) {
            builder.bufferThreshold(raw.bufferThreshold);
        }
        if (raw.threadCount != null && raw.threadCount > 0) {
            builder.threadCount(raw.threadCount);
        }
        return builder.build();
    }

    private List<String> mergePatterns(List<String> defaults, List<String> overrides) {
        List<String> merged = new ArrayList<>(defaults);
        if (overrides != null) {
            for (String pattern : overrides) {
                if (pattern == null || pattern.isBlank() || merged.contains(pattern)) {
                    continue;
                }
                merged.add(pattern);
            }
        }
        return List.copyOf(merged);
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public List<String> roots = new ArrayList<>();
        public String baseDirectory;
        public List<String> excludeDirectories;
        public List<String> excludeFiles;
        public String existingCatalog;
        public String priorStore;
        public String priorSessionId;
        public Boolean requireExisting;
        public String storePath;
        public String storePolicy;
        public String exportPath;
        public Boolean allowExportOverwrite;
        public Boolean checkFileContents;
        public String hashAlgorithm;
        public Integer readBufferSize;
        public Integer bufferThreshold;
        public Integer threadCount;
        public Boolean followLinks;
        public Integer maxNewEntries;
        public String sessionId;
        public Boolean verbose;
    }
}
