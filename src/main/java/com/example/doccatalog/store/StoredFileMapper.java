package com.example.doccatalog.store;

import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class StoredFileMapper implements RowMapper<StoredFile> {
    @Override
    public StoredFile map(ResultSet rs, StatementContext ctx) throws SQLException {
        long size = rs.getLong("size_bytes");
        Long sizeBytes = rs.wasNull() ? null : size;
        return new StoredFile(
                rs.getString("session_id"),
                rs.getString("base_dir"),
                rs.getString("relative_path"),
                rs.getString("filename"),
                rs.getString("extension"),
                sizeBytes,
                rs.getString("checksum"),
                rs.getString("file_key"),
                rs.getString("hash_algorithm")
        );
    }
}
