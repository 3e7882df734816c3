package com.example.doccatalog;

import com.example.doccatalog.model.FileRecord;
import com.example.doccatalog.model.FileRecord.Origin;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Flags records whose content was already seen earlier in the catalog.
 * <p>
 * Existing records are visited first in their load order, then new records in walk order.
 * The first record carrying a checksum is canonical; every later one is a duplicate.
 * Records without a checksum are never flagged.
 */
public final class DuplicateDetector {

    /**
     * @return number of records flagged as duplicate, or 0 if content checking is off
     */
    public int detect(List<FileRecord> records, boolean checkFileContents) {
        if (!checkFileContents) {
            return 0;
        }
        Set<String> seen = new HashSet<>();
        int duplicates = 0;
        duplicates += pass(records, Origin.EXISTING, seen);
        duplicates += pass(records, Origin.NEW, seen);
        return duplicates;
    }

    private int pass(List<FileRecord> records, Origin origin, Set<String> seen) {
        int duplicates = 0;
        for (FileRecord record : records) {
            if (record.origin() != origin) {
                continue;
            }
            String checksum = record.checksum();
            if (checksum == null) {
                record.markDuplicate(false);
            } else if (seen.add(checksum)) {
                record.markDuplicate(false);
            } else {
                record.markDuplicate(true);
                duplicates++;
            }
        }
        return duplicates;
    }
}
