package com.example.doccatalog.store;

import com.example.doccatalog.HashAlgorithm;
import com.example.doccatalog.SchemaException;
import com.example.doccatalog.StoreConflictException;
import com.example.doccatalog.StorePolicy;
import com.example.doccatalog.model.CatalogSession;
import com.example.doccatalog.model.FileRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.apache.commons.io.FileUtils;
import org.flywaydb.core.Flyway;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SQLite-backed catalog store.
 * <p>
 * New records are staged in a {@link RecordBuffer} and written one transaction per batch,
 * so every flushed batch is durable even if the run dies later. Rows are only ever
 * appended. A lock file next to the database keeps a second writer out for as long as
 * the store is open.
 */
public final class CatalogStore implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(CatalogStore.class);
    public static final int DEFAULT_BUFFER_THRESHOLD = 100;

    private final Path storePath;
    private final FileChannel lockChannel;
    private final FileLock lock;
    private final HikariDataSource dataSource;
    private final Jdbi jdbi;
    private final RecordBuffer<FileRow> buffer;
    private final ObjectMapper mapper = new ObjectMapper();
    private CatalogSession session;
    private long alreadyStored;
    private boolean closed;

    private CatalogStore(Path storePath,
                         FileChannel lockChannel,
                         FileLock lock,
                         HikariDataSource dataSource,
                         int bufferThreshold) {
        this.storePath = storePath;
        this.lockChannel = lockChannel;
        this.lock = lock;
        this.dataSource = dataSource;
        this.jdbi = Jdbi.create(dataSource);
        this.jdbi.installPlugin(new SqlObjectPlugin());
        this.buffer = new RecordBuffer<>(bufferThreshold, this::writeBatch);
    }

    /**
     * Opens (creating if needed) the store at {@code storePath}.
     *
     * @throws StoreConflictException if the file exists and the policy is {@link StorePolicy#ERROR},
     *                                or another writer holds the store
     */
    public static CatalogStore open(Path storePath, StorePolicy policy, int bufferThreshold) {
        Path normalized = storePath.toAbsolutePath().normalize();
        boolean exists = Files.exists(normalized);
        if (exists && policy == StorePolicy.ERROR) {
            throw new StoreConflictException(normalized,
                    "Store " + normalized + " already exists; choose APPEND or OVERWRITE");
        }

        FileChannel lockChannel = null;
        try {
            Path parent = normalized.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            lockChannel = FileChannel.open(lockPathFor(normalized),
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock = tryLock(lockChannel);
            if (lock == null) {
                lockChannel.close();
                throw new StoreConflictException(normalized, "Store " + normalized + " is in use by another writer");
            }
            if (exists && policy == StorePolicy.OVERWRITE) {
                LOGGER.warn("Overwriting existing store {}", normalized);
                deleteDatabaseFiles(normalized);
            } else if (exists) {
                LOGGER.info("Appending to existing store {}", normalized);
            }
            migrate(normalized);
            HikariDataSource dataSource = createDataSource(normalized);
            return new CatalogStore(normalized, lockChannel, lock, dataSource, bufferThreshold);
        } catch (IOException | RuntimeException ex) {
            closeQuietly(lockChannel);
            if (ex instanceof StoreConflictException conflict) {
                throw conflict;
            }
            throw new CatalogStoreException("Failed to open store " + normalized, ex);
        }
    }

    /**
     * Persists the session row. Must precede any {@link #enqueue(FileRecord)}.
     */
    public void beginSession(CatalogSession session) {
        String searchDirs;
        try {
            searchDirs = mapper.writeValueAsString(session.searchDirectories().stream()
                    .map(directory -> absolute(directory).toString())
                    .toList());
        } catch (JsonProcessingException ex) {
            throw new CatalogStoreException("Failed to encode search directories", ex);
        }
        try {
            jdbi.useExtension(CatalogDao.class, dao -> {
                if (dao.countSessions(session.sessionId()) > 0) {
                    throw new StoreConflictException(storePath,
                            "Session " + session.sessionId() + " already exists in " + storePath);
                }
                dao.insertSession(
                        session.sessionId(),
                        searchDirs,
                        absolute(session.baseDirectory()).toString(),
                        session.hashAlgorithm(),
                        session.bufferSize(),
                        session.createdAt().toString()
                );
            });
        } catch (JdbiException ex) {
            throw new CatalogStoreException("Failed to persist session " + session.sessionId(), ex);
        }
        this.session = session;
    }

    /**
     * Stages a newly admitted record.
     *
     * @return true if this call flushed a full batch to the database
     */
    public boolean enqueue(FileRecord record) {
        if (session == null) {
            throw new IllegalStateException("beginSession must be called before enqueue");
        }
        return buffer.add(toRow(record));
    }

    public void flush() {
        buffer.flush();
    }

    /**
     * Loads the files of earlier sessions from a store file. When {@code sessionId} is empty,
     * every session except the current one is loaded, oldest first.
     * Checksums computed by a different algorithm than {@code algorithm} are discarded so
     * they get recomputed.
     *
     * @throws SchemaException if the store is absent and {@code required}, or lacks the catalog tables
     */
    public List<FileRecord> loadExisting(Path priorStore,
                                         Optional<String> sessionId,
                                         boolean required,
                                         HashAlgorithm algorithm) {
        Path normalized = priorStore.toAbsolutePath().normalize();
        if (!Files.exists(normalized)) {
            if (required) {
                throw new SchemaException("Required prior store " + normalized + " does not exist");
            }
            LOGGER.info("No prior store at {}; starting without existing records", normalized);
            return List.of();
        }
        String current = session == null ? "" : session.sessionId();
        List<StoredFile> rows;
        try {
            Jdbi source = normalized.equals(storePath) ? jdbi : priorJdbi(normalized);
            rows = source.withExtension(CatalogDao.class, dao -> {
                if (dao.countCatalogTables() < 2) {
                    throw new SchemaException("Store " + normalized + " has no sessions/files tables");
                }
                return sessionId.map(dao::fetchSessionFiles).orElseGet(() -> dao.fetchAllFilesExcept(current));
            });
        } catch (JdbiException ex) {
            throw new SchemaException("Failed to read prior store " + normalized, ex);
        }

        List<FileRecord> records = new ArrayList<>(rows.size());
        int invalidated = 0;
        for (StoredFile row : rows) {
            FileRecord record = FileRecord.fromStoreRow(
                    Path.of(row.baseDirectory()),
                    row.relativePath(),
                    row.filename(),
                    row.extension(),
                    row.sizeBytes(),
                    row.checksum(),
                    row.hashAlgorithm()
            );
            if (record.invalidateChecksumUnless(algorithm)) {
                invalidated++;
            }
            records.add(record);
        }
        if (invalidated > 0) {
            LOGGER.warn("{} stored checksums were computed with another algorithm than {}; they will be recomputed",
                    invalidated, algorithm.jcaName);
        }
        LOGGER.info("Loaded {} records from prior store {}", records.size(), normalized);
        return records;
    }

    public long storedFileCount(String sessionId) {
        return jdbi.withExtension(CatalogDao.class, dao -> dao.countFiles(sessionId));
    }

    public long rowsWritten() {
        return buffer.entriesWritten() - alreadyStored;
    }

    public long alreadyStored() {
        return alreadyStored;
    }

    public int pending() {
        return buffer.pending();
    }

    /**
     * Flushes whatever is still buffered, then releases the connection pool and the lock.
     * The lock file itself stays; only the lock on it guards the store.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (session != null) {
                buffer.flush();
            }
        } finally {
            dataSource.close();
            try {
                lock.release();
                lockChannel.close();
            } catch (IOException ex) {
                LOGGER.warn("Failed to release lock for {}", storePath, ex);
            }
        }
    }

    private void writeBatch(List<FileRow> rows) {
        try {
            int[] counts = jdbi.inTransaction(handle -> handle.attach(CatalogDao.class).insertFiles(rows));
            int skipped = 0;
            for (int count : counts) {
                if (count == 0) {
                    skipped++;
                }
            }
            if (skipped > 0) {
                LOGGER.info("{} rows of this batch were already stored by an earlier session", skipped);
                alreadyStored += skipped;
            }
            LOGGER.debug("Flushed {} rows to {}", rows.size(), storePath);
        } catch (JdbiException ex) {
            throw new CatalogStoreException("Failed to write batch of " + rows.size() + " rows to " + storePath, ex);
        }
    }

    private FileRow toRow(FileRecord record) {
        Long size = record.size();
        return new FileRow(
                record.relativePath(),
                record.name(),
                record.extension(),
                size,
                size == null ? null : FileUtils.byteCountToDisplaySize(size),
                record.checksum(),
                session.sessionId(),
                record.key(),
                record.hashAlgorithm()
        );
    }

    private static void migrate(Path database) {
        Flyway.configure()
                .dataSource(jdbcUrl(database), null, null)
                .locations("classpath:db/migration")
                .baselineOnMigrate(true)
                .baselineVersion("0")
                .load()
                .migrate();
    }

    private static HikariDataSource createDataSource(Path database) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl(database));
        config.setConnectionTestQuery("SELECT 1");
        // Single writer.
        config.setMaximumPoolSize(1);
        config.setConnectionInitSql("PRAGMA foreign_keys=ON");
        return new HikariDataSource(config);
    }

    private static Jdbi priorJdbi(Path database) {
        Jdbi jdbi = Jdbi.create(jdbcUrl(database));
        jdbi.installPlugin(new SqlObjectPlugin());
        return jdbi;
    }

    private static Path absolute(Path path) {
        return path.toAbsolutePath().normalize();
    }

    private static String jdbcUrl(Path database) {
        return "jdbc:sqlite:" + database;
    }

    private static Path lockPathFor(Path database) {
        return database.resolveSibling(database.getFileName() + ".lock");
    }

    private static FileLock tryLock(FileChannel channel) throws IOException {
        try {
            return channel.tryLock();
        } catch (OverlappingFileLockException ex) {
            return null;
        }
    }

    private static void deleteDatabaseFiles(Path database) throws IOException {
        Files.deleteIfExists(database);
        Files.deleteIfExists(database.resolveSibling(database.getFileName() + "-wal"));
        Files.deleteIfExists(database.resolveSibling(database.getFileName() + "-shm"));
        Files.deleteIfExists(database.resolveSibling(database.getFileName() + "-journal"));
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException ex) {
            LOGGER.warn("Failed to close lock channel", ex);
        }
    }
}
