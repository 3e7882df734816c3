package com.example.doccatalog.model;

import org.apache.commons.io.FileUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Column names of the tabular catalog and the rules that order them for export.
 */
public final class CatalogColumns {
    public static final String FILE_PATH = "File Path";
    public static final String BASE_DIRECTORY = "Base Directory";
    public static final String RELATIVE_PATH = "Relative Path";
    public static final String SUBDIRECTORY_PREFIX = "Subdirectory ";
    public static final String FILENAME = "Filename";
    public static final String EXTENSION = "Extension";
    public static final String FILE_SIZE = "File Size";
    public static final String READABLE_SIZE = "Readable Size";
    public static final String CHECKSUM = "Checksum";
    public static final String DUPLICATE = "Duplicate";
    public static final String HASH_ALGORITHM = "Hash Algorithm";

    private static final List<String> TRAILING_FIXED = List.of(
            FILENAME, EXTENSION, FILE_SIZE, READABLE_SIZE, CHECKSUM, DUPLICATE);

    private static final Set<String> DERIVED = Set.of(
            BASE_DIRECTORY, RELATIVE_PATH, FILENAME, EXTENSION, READABLE_SIZE);

    private CatalogColumns() {
    }

    /**
     * Columns the export computes from the record itself; an import recomputes them
     * instead of carrying them as extra attributes.
     */
    public static boolean isDerived(String column) {
        return DERIVED.contains(column) || subdirectoryIndex(column) > 0;
    }

    /**
     * File Path, Base Directory, Relative Path, Subdirectory 1..N, Filename, Extension,
     * File Size, Readable Size, Checksum, Duplicate, then everything else in the order given.
     */
    public static List<String> order(Collection<String> columns) {
        if (!columns.contains(FILE_PATH)) {
            throw new IllegalArgumentException("Catalog columns must include '" + FILE_PATH + "'");
        }
        List<String> ordered = new ArrayList<>(columns.size());
        ordered.add(FILE_PATH);
        if (columns.contains(BASE_DIRECTORY)) {
            ordered.add(BASE_DIRECTORY);
        }
        if (columns.contains(RELATIVE_PATH)) {
            ordered.add(RELATIVE_PATH);
        }
        columns.stream()
                .filter(column -> subdirectoryIndex(column) > 0)
                .sorted(Comparator.comparingInt(CatalogColumns::subdirectoryIndex))
                .forEach(ordered::add);
        for (String column : TRAILING_FIXED) {
            if (columns.contains(column)) {
                ordered.add(column);
            }
        }
        for (String column : columns) {
            if (!ordered.contains(column)) {
                ordered.add(column);
            }
        }
        return ordered;
    }

    /**
     * Union of the columns of all rows, first-encountered order, then {@link #order(Collection)}.
     */
    public static List<String> columnsOf(List<Map<String, String>> rows) {
        Set<String> seen = new LinkedHashSet<>();
        seen.add(FILE_PATH);
        for (Map<String, String> row : rows) {
            seen.addAll(row.keySet());
        }
        return order(seen);
    }

    public static Map<String, String> toRow(FileRecord record) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put(FILE_PATH, record.absolutePath().toString());
        row.put(FILENAME, record.name());
        row.put(EXTENSION, record.extension());
        Long size = record.size();
        row.put(FILE_SIZE, size == null ? "" : Long.toString(size));
        row.put(READABLE_SIZE, size == null ? "" : FileUtils.byteCountToDisplaySize(size));
        row.put(CHECKSUM, record.checksum() == null ? "" : record.checksum());
        row.put(DUPLICATE, Boolean.toString(record.isDuplicate()));
        if (record.baseDirectory() != null) {
            row.put(BASE_DIRECTORY, record.baseDirectory().toString());
            row.put(RELATIVE_PATH, record.relativePath());
            List<String> subdirectories = record.subdirectories();
            for (int i = 0; i < subdirectories.size(); i++) {
                row.put(SUBDIRECTORY_PREFIX + (i + 1), subdirectories.get(i));
            }
        }
        if (record.hashAlgorithm() != null) {
            row.put(HASH_ALGORITHM, record.hashAlgorithm());
        }
        for (ExtraAttribute extra : record.extras()) {
            row.putIfAbsent(extra.name(), extra.value());
        }
        return row;
    }

    static int subdirectoryIndex(String column) {
        if (!column.startsWith(SUBDIRECTORY_PREFIX)) {
            return -1;
        }
        try {
            return Integer.parseInt(column.substring(SUBDIRECTORY_PREFIX.length()).trim());
        } catch (NumberFormatException ex) {
            return -1;
        }
    }
}
