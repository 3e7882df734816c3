package com.example.doccatalog.store;

import org.jdbi.v3.sqlobject.config.RegisterRowMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlBatch;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;

public interface CatalogDao {

    // --- Sessions ------------------------------------------------------------

    @SqlUpdate("""
        INSERT INTO sessions(session_id, search_dirs, base_dir, hash_algorithm, buffer_size, created_at)
        VALUES(:sessionId, :searchDirs, :baseDir, :hashAlgorithm, :bufferSize, :createdAt)
        """)
    void insertSession(@Bind("sessionId") String sessionId,
                       @Bind("searchDirs") String searchDirs,
                       @Bind("baseDir") String baseDir,
                       @Bind("hashAlgorithm") String hashAlgorithm,
                       @Bind("bufferSize") int bufferSize,
                       @Bind("createdAt") String createdAt);

    @SqlQuery("SELECT COUNT(*) FROM sessions WHERE session_id = :sessionId")
    int countSessions(@Bind("sessionId") String sessionId);

    // --- Files ---------------------------------------------------------------

    /**
     * Rows whose key is already stored (by an earlier session) are left untouched and
     * report an update count of 0.
     */
    @SqlBatch("""
        INSERT OR IGNORE INTO files(relative_path, filename, extension, size_bytes, human_readable_size,
                                    checksum, session_id, file_key, hash_algorithm)
        VALUES(:relativePath, :filename, :extension, :sizeBytes, :humanReadableSize,
               :checksum, :sessionId, :fileKey, :hashAlgorithm)
        """)
    int[] insertFiles(@BindMethods List<FileRow> rows);

    @SqlQuery("SELECT COUNT(*) FROM files WHERE session_id = :sessionId")
    long countFiles(@Bind("sessionId") String sessionId);

    @SqlQuery("""
        SELECT s.session_id,
               s.base_dir,
               f.relative_path,
               f.filename,
               f.extension,
               f.size_bytes,
               f.checksum,
               f.file_key,
               COALESCE(f.hash_algorithm, s.hash_algorithm) AS hash_algorithm
          FROM files f
          JOIN sessions s ON s.session_id = f.session_id
         WHERE s.session_id = :sessionId
         ORDER BY f.rowid
        """)
    @RegisterRowMapper(StoredFileMapper.class)
    List<StoredFile> fetchSessionFiles(@Bind("sessionId") String sessionId);

    @SqlQuery("""
        SELECT s.session_id,
               s.base_dir,
               f.relative_path,
               f.filename,
               f.extension,
               f.size_bytes,
               f.checksum,
               f.file_key,
               COALESCE(f.hash_algorithm, s.hash_algorithm) AS hash_algorithm
          FROM files f
          JOIN sessions s ON s.session_id = f.session_id
         WHERE s.session_id <> :excludedSessionId
         ORDER BY s.rowid, f.rowid
        """)
    @RegisterRowMapper(StoredFileMapper.class)
    List<StoredFile> fetchAllFilesExcept(@Bind("excludedSessionId") String excludedSessionId);

    @SqlQuery("SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name IN ('sessions', 'files')")
    int countCatalogTables();
}
