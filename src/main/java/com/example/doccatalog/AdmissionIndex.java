package com.example.doccatalog;

import com.example.doccatalog.model.FileRecord;

import java.util.HashSet;
import java.util.Set;

/**
 * Identities of the records admitted so far. With content checking a record is
 * identified by its key, otherwise by its relative path. A record without a checksum has
 * no content identity and is never considered known.
 */
final class AdmissionIndex {
    private final boolean byContent;
    private final Set<String> admitted = new HashSet<>();

    AdmissionIndex(boolean byContent) {
        this.byContent = byContent;
    }

    boolean contains(FileRecord record) {
        String identity = identityOf(record);
        return identity != null && admitted.contains(identity);
    }

    /**
     * @return false if an equal record was already admitted
     */
    boolean admit(FileRecord record) {
        String identity = identityOf(record);
        return identity == null || admitted.add(identity);
    }

    private String identityOf(FileRecord record) {
        if (!byContent) {
            return record.relativePath();
        }
        return record.checksum() == null ? null : record.key();
    }
}
