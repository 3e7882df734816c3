package com.example.doccatalog;

import com.example.doccatalog.export.CatalogProperties;
import com.example.doccatalog.export.CsvCatalogExporter;
import com.example.doccatalog.export.ExportSink;
import com.example.doccatalog.model.CatalogColumns;
import com.example.doccatalog.model.CatalogSession;
import com.example.doccatalog.model.FileRecord;
import com.example.doccatalog.store.CatalogStore;
import com.example.doccatalog.store.CsvCatalogImporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Orchestrates a catalog run: seeding from prior catalogs, walking the roots, admitting
 * new files into the store batch by batch, flagging duplicates and exporting the result.
 * <p>
 * All admission, buffering and flushing happens on the calling thread. With more than one
 * thread configured only hashing is fanned out, over a bounded window of walked paths
 * that is joined back in walk order.
 */
public final class CatalogEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(CatalogEngine.class);
    private static final int WINDOW_PER_THREAD = 8;

    private final CatalogConfig config;
    private final ExportSink exportSink;
    private final ProcessingLimiter limiter;
    private final IdentityResolver resolver;
    private final DuplicateDetector duplicateDetector = new DuplicateDetector();
    private volatile EngineState state = EngineState.INIT;

    private final List<FileRecord> records = new ArrayList<>();
    private int existingCount;
    private int newCount;
    private int alreadyKnown;
    private long ioSkips;
    private boolean cancelRequested;

    public CatalogEngine(CatalogConfig config) {
        this(config, defaultSink(config), defaultLimiter(config));
    }

    public CatalogEngine(CatalogConfig config, ExportSink exportSink, ProcessingLimiter limiter) {
        this.config = config;
        this.exportSink = exportSink;
        this.limiter = limiter;
        this.resolver = new IdentityResolver(config.hashAlgorithm(), config.readBufferSize());
    }

    /**
     * Executes one run. An engine instance runs once.
     *
     * @return counters and the admitted catalog; state is {@link EngineState#DONE} or
     * {@link EngineState#CANCELLED}
     * @throws CatalogException on any fatal condition, after moving to {@link EngineState#FAILED}
     */
    public CatalogResult run() throws IOException {
        if (state != EngineState.INIT) {
            throw new IllegalStateException("Engine already ran; state is " + state);
        }
        try {
            return execute();
        } catch (IOException | RuntimeException ex) {
            state = EngineState.FAILED;
            LOGGER.error("Catalog run failed: {}", ex.getMessage());
            throw ex;
        }
    }

    public EngineState state() {
        return state;
    }

    private CatalogResult execute() throws IOException {
        validate();
        CatalogSession session = new CatalogSession(
                config.sessionId().orElseGet(CatalogEngine::newSessionId),
                config.roots(),
                config.baseDirectory(),
                config.hashAlgorithm().jcaName,
                config.bufferThreshold(),
                Instant.now()
        );
        LOGGER.info("Starting catalog session {} over {}", session.sessionId(), config.roots());

        try (CatalogStore store = CatalogStore.open(config.storePath(), config.storePolicy(), config.bufferThreshold())) {
            store.beginSession(session);
            AdmissionIndex index = new AdmissionIndex(config.checkFileContents());

            state = EngineState.LOADING_EXISTING;
            loadExisting(store, index);

            state = EngineState.WALKING;
            WalkStats walkStats = walk(store, index);

            if (cancelRequested) {
                state = EngineState.FLUSHING;
                store.flush();
                state = EngineState.CANCELLED;
                LOGGER.info("Catalog session {} cancelled after {} new records; {} rows are stored",
                        session.sessionId(), newCount, store.rowsWritten());
                return result(session, store, walkStats, 0);
            }

            state = EngineState.DEDUPLICATING;
            int duplicates = duplicateDetector.detect(records, config.checkFileContents());

            state = EngineState.FLUSHING;
            store.flush();

            state = EngineState.EXPORTING;
            export(session);

            state = EngineState.DONE;
            CatalogResult result = result(session, store, walkStats, duplicates);
            logSummary(result, walkStats);
            return result;
        }
    }

    private void validate() {
        Optional<Path> existingCatalog = config.existingCatalog();
        if (existingCatalog.isPresent() && !Files.isRegularFile(existingCatalog.get())) {
            throw new FatalConfigException("Existing catalog " + existingCatalog.get() + " does not exist");
        }
        Optional<Path> exportPath = config.exportPath();
        if (exportPath.isPresent()) {
            Path path = exportPath.get();
            if (!path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv")) {
                throw new FatalConfigException("Export path " + path + " must end in .csv");
            }
            if (Files.exists(path) && !config.allowExportOverwrite()) {
                throw new FatalConfigException("Export " + path + " already exists and overwriting is not allowed");
            }
        }
        Optional<Path> priorStore = config.priorStore();
        if (priorStore.isPresent()
                && config.storePolicy() == StorePolicy.OVERWRITE
                && normalize(priorStore.get()).equals(normalize(config.storePath()))) {
            throw new FatalConfigException("Prior store " + priorStore.get()
                    + " is the destination store and would be overwritten before it is read");
        }
    }

    private void loadExisting(CatalogStore store, AdmissionIndex index) throws IOException {
        List<FileRecord> seeds = new ArrayList<>();
        if (config.existingCatalog().isPresent()) {
            seeds.addAll(new CsvCatalogImporter().load(
                    config.existingCatalog().get(), config.baseDirectory(), config.hashAlgorithm()));
        }
        if (config.priorStore().isPresent()) {
            seeds.addAll(store.loadExisting(
                    config.priorStore().get(), config.priorSessionId(), config.requireExisting(), config.hashAlgorithm()));
        }
        int dropped = 0;
        for (FileRecord record : seeds) {
            if (config.checkFileContents()) {
                record.resolveIdentity(resolver)
                        .ifPresent(skip -> LOGGER.debug("Existing record {} could not be hashed: {}", skip.path(), skip.reason()));
            }
            if (!index.admit(record)) {
                dropped++;
                continue;
            }
            records.add(record);
            existingCount++;
        }
        if (dropped > 0) {
            LOGGER.info("Dropped {} existing records listed more than once", dropped);
        }
        LOGGER.info("Seeded catalog with {} existing records", existingCount);
    }

    private WalkStats walk(CatalogStore store, AdmissionIndex index) {
        WalkStats stats = new WalkStats();
        DirectoryWalker walker = new DirectoryWalker(
                config.roots(),
                config.excludeDirectories(),
                config.excludeFiles(),
                config.followLinks(),
                () -> cancelRequested || limiter.shouldStop(newCount),
                stats
        );
        int threads = config.threadCount();
        ExecutorService hashExecutor = threads > 1 ? Executors.newFixedThreadPool(threads) : null;
        int windowSize = threads > 1 ? threads * WINDOW_PER_THREAD : 1;
        try {
            List<FileRecord> window = new ArrayList<>(windowSize);
            while (!cancelRequested && walker.hasNext()) {
                window.clear();
                while (window.size() < windowSize && walker.hasNext()) {
                    window.add(FileRecord.fromWalk(walker.next(), config.baseDirectory()));
                }
                if (hashExecutor != null) {
                    hashWindow(hashExecutor, window, index);
                }
                for (FileRecord candidate : window) {
                    admit(candidate, store, index);
                    if (cancelRequested) {
                        break;
                    }
                }
            }
        } finally {
            if (hashExecutor != null) {
                shutdown(hashExecutor);
            }
        }
        if (walker.wasStopped()) {
            cancelRequested = true;
        }
        return stats;
    }

    private void hashWindow(ExecutorService executor, List<FileRecord> window, AdmissionIndex index) {
        List<Future<?>> futures = new ArrayList<>(window.size());
        for (FileRecord candidate : window) {
            if (!config.checkFileContents() && index.contains(candidate)) {
                continue;
            }
            futures.add(executor.submit(() -> candidate.resolveIdentity(resolver)));
        }
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new CatalogException("Interrupted while hashing", ex);
            } catch (ExecutionException ex) {
                throw new CatalogException("Hashing failed", ex.getCause());
            }
        }
    }

    private void admit(FileRecord candidate, CatalogStore store, AdmissionIndex index) {
        // Relative-path identity needs no hashing to be checked.
        if (!config.checkFileContents() && index.contains(candidate)) {
            alreadyKnown++;
            return;
        }
        candidate.resolveIdentity(resolver).ifPresent(skip -> {
            ioSkips++;
            LOGGER.warn("Could not read {} ({}): {}", skip.path(), skip.reason(), skip.message());
        });
        if (!index.admit(candidate)) {
            alreadyKnown++;
            LOGGER.debug("Already cataloged: {}", candidate.absolutePath());
            return;
        }
        records.add(candidate);
        newCount++;
        if (config.verbose()) {
            LOGGER.info("New file: {}", candidate.absolutePath());
        } else {
            LOGGER.debug("New file: {}", candidate.absolutePath());
        }
        boolean flushed = store.enqueue(candidate);
        if (flushed && limiter.shouldStop(newCount)) {
            LOGGER.info("Stop requested after {} new records", newCount);
            cancelRequested = true;
        }
    }

    private void export(CatalogSession session) throws IOException {
        if (exportSink == ExportSink.NONE) {
            LOGGER.debug("No export destination configured");
            return;
        }
        List<Map<String, String>> rows = new ArrayList<>(records.size());
        for (FileRecord record : records) {
            rows.add(CatalogColumns.toRow(record));
        }
        exportSink.export(CatalogProperties.from(session, config), CatalogColumns.columnsOf(rows), rows);
    }

    private CatalogResult result(CatalogSession session, CatalogStore store, WalkStats walkStats, int duplicates) {
        int unidentified = 0;
        for (FileRecord record : records) {
            if (record.checksum() == null) {
                unidentified++;
            }
        }
        return new CatalogResult(
                session.sessionId(),
                state,
                existingCount,
                newCount,
                duplicates,
                walkStats.skippedEntries() + ioSkips,
                unidentified,
                alreadyKnown,
                store.rowsWritten(),
                store.alreadyStored(),
                records
        );
    }

    private void logSummary(CatalogResult result, WalkStats walkStats) {
        LOGGER.info("Catalog session {} finished: {} existing, {} new, {} already known, {} duplicates, "
                        + "{} skipped, {} without checksum, {} rows stored, {} already stored, "
                        + "{} files found in {} directories visited, {} excluded",
                result.sessionId(),
                result.existingRecords(),
                result.newRecords(),
                result.alreadyKnown(),
                result.duplicates(),
                result.skipped(),
                result.unidentified(),
                result.rowsStored(),
                result.alreadyStored(),
                walkStats.filesFound(),
                walkStats.directoriesVisited(),
                walkStats.excludedDirectories());
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ExportSink defaultSink(CatalogConfig config) {
        return config.exportPath()
                .<ExportSink>map(CsvCatalogExporter::new)
                .orElse(ExportSink.NONE);
    }

    private static ProcessingLimiter defaultLimiter(CatalogConfig config) {
        return config.maxNewEntries()
                .map(max -> (ProcessingLimiter) admitted -> admitted >= max)
                .orElse(ProcessingLimiter.NO_LIMIT);
    }

    private static String newSessionId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
