package com.example.doccatalog;

import com.example.doccatalog.model.FileRecord;

import java.util.List;

/**
 * Aggregate outcome of one engine run.
 *
 * @param existingRecords records seeded from an import or a prior store
 * @param newRecords      records admitted from the walk
 * @param duplicates      admitted records flagged as duplicate content
 * @param skipped         walk entries and files that could not be read
 * @param unidentified    admitted records without a checksum
 * @param alreadyKnown    walked files equal to an admitted record
 * @param rowsStored      rows this session wrote to the store
 * @param alreadyStored   rows whose key an earlier session had already stored
 * @param records         the admitted catalog, existing records first
 */
public record CatalogResult(
        String sessionId,
        EngineState state,
        int existingRecords,
        int newRecords,
        int duplicates,
        long skipped,
        int unidentified,
        int alreadyKnown,
        long rowsStored,
        long alreadyStored,
        List<FileRecord> records
) {
    public CatalogResult {
        records = List.copyOf(records);
    }
}
