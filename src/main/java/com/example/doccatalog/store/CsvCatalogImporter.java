package com.example.doccatalog.store;

import com.example.doccatalog.HashAlgorithm;
import com.example.doccatalog.SchemaException;
import com.example.doccatalog.model.CatalogColumns;
import com.example.doccatalog.model.ExtraAttribute;
import com.example.doccatalog.model.FileRecord;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.input.BOMInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Reads a catalog previously exported as CSV into existing-origin records.
 * <p>
 * "File Path" is mandatory. "File Size", "Checksum", "Duplicate" and "Hash Algorithm" map
 * onto the record; columns the export derives from the path are dropped; every other
 * named column is kept verbatim, in header order, as an extra attribute. Unnamed columns,
 * such as a leading row index, are dropped. A column name used twice is a schema error.
 */
public final class CsvCatalogImporter {
    private static final Logger LOGGER = LoggerFactory.getLogger(CsvCatalogImporter.class);

    // The header row is read by hand so columns are addressed by position.
    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setIgnoreEmptyLines(true)
            .build();

    public List<FileRecord> load(Path csvFile, Path baseDirectory, HashAlgorithm algorithm) throws IOException {
        List<FileRecord> records = new ArrayList<>();
        int invalidated = 0;
        try (Reader reader = openReader(csvFile);
             CSVParser parser = FORMAT.parse(reader)) {
            Iterator<CSVRecord> rows = parser.iterator();
            if (!rows.hasNext()) {
                throw new SchemaException("Catalog " + csvFile + " has no header row");
            }
            Header header = Header.read(rows.next(), csvFile);
            while (rows.hasNext()) {
                FileRecord record = toRecord(rows.next(), header, baseDirectory);
                if (record == null) {
                    continue;
                }
                if (record.invalidateChecksumUnless(algorithm)) {
                    invalidated++;
                }
                records.add(record);
            }
        } catch (UncheckedIOException | IllegalArgumentException ex) {
            throw new SchemaException("Catalog " + csvFile + " is not a readable CSV table: " + ex.getMessage(), ex);
        }
        if (invalidated > 0) {
            LOGGER.warn("{} imported checksums were computed with another algorithm than {}; they will be recomputed",
                    invalidated, algorithm.jcaName);
        }
        LOGGER.info("Imported {} records from {}", records.size(), csvFile);
        return records;
    }

    private static Reader openReader(Path csvFile) throws IOException {
        InputStream raw = Files.newInputStream(csvFile);
        try {
            // Spreadsheet tools often prefix UTF-8 CSV with a byte order mark.
            InputStream withoutBom = BOMInputStream.builder().setInputStream(raw).get();
            return new BufferedReader(new InputStreamReader(withoutBom, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            raw.close();
            throw ex;
        }
    }

    private FileRecord toRecord(CSVRecord row, Header header, Path baseDirectory) {
        String filePath = value(row, header.filePath);
        if (filePath == null) {
            LOGGER.warn("Skipping row {} without a file path", row.getRecordNumber());
            return null;
        }
        Path path;
        try {
            path = Path.of(filePath);
        } catch (InvalidPathException ex) {
            LOGGER.warn("Skipping row {} with invalid path '{}'", row.getRecordNumber(), filePath, ex);
            return null;
        }

        List<ExtraAttribute> extras = new ArrayList<>(header.extraIndexes.size());
        for (int index : header.extraIndexes) {
            String raw = index < row.size() ? row.get(index) : "";
            extras.add(new ExtraAttribute(header.names.get(index), raw));
        }

        return FileRecord.fromImportRow(
                path,
                baseDirectory,
                parseSize(value(row, header.fileSize), row),
                value(row, header.checksum),
                value(row, header.hashAlgorithm),
                Boolean.parseBoolean(value(row, header.duplicate)),
                extras
        );
    }

    private static String value(CSVRecord row, int index) {
        if (index < 0 || index >= row.size()) {
            return null;
        }
        String value = row.get(index).trim();
        return value.isEmpty() ? null : value;
    }

    private static Long parseSize(String raw, CSVRecord row) {
        if (raw == null) {
            return null;
        }
        try {
            if (raw.chars().allMatch(Character::isDigit)) {
                return Long.parseLong(raw);
            }
            // Spreadsheets tend to write integral sizes as "123.0".
            return (long) Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            LOGGER.warn("Ignoring unreadable file size '{}' in row {}", raw, row.getRecordNumber());
            return null;
        }
    }

    /**
     * Column positions of one header row.
     */
    private static final class Header {
        private final List<String> names;
        private final List<Integer> extraIndexes = new ArrayList<>();
        private int filePath = -1;
        private int fileSize = -1;
        private int checksum = -1;
        private int duplicate = -1;
        private int hashAlgorithm = -1;

        private Header(List<String> names) {
            this.names = names;
        }

        static Header read(CSVRecord headerRow, Path csvFile) {
            List<String> names = new ArrayList<>(headerRow.size());
            for (String name : headerRow) {
                names.add(name.trim());
            }
            Header header = new Header(names);
            Set<String> seen = new HashSet<>();
            int unnamed = 0;
            for (int index = 0; index < names.size(); index++) {
                String name = names.get(index);
                if (name.isEmpty()) {
                    unnamed++;
                    continue;
                }
                if (!seen.add(name)) {
                    throw new SchemaException("Catalog " + csvFile + " has more than one '" + name + "' column");
                }
                switch (name) {
                    case CatalogColumns.FILE_PATH -> header.filePath = index;
                    case CatalogColumns.FILE_SIZE -> header.fileSize = index;
                    case CatalogColumns.CHECKSUM -> header.checksum = index;
                    case CatalogColumns.DUPLICATE -> header.duplicate = index;
                    case CatalogColumns.HASH_ALGORITHM -> header.hashAlgorithm = index;
                    default -> {
                        if (!CatalogColumns.isDerived(name)) {
                            header.extraIndexes.add(index);
                        }
                    }
                }
            }
            if (header.filePath < 0) {
                throw new SchemaException("Catalog " + csvFile + " has no '" + CatalogColumns.FILE_PATH + "' column");
            }
            if (unnamed > 0) {
                LOGGER.debug("Dropping {} unnamed columns of {}", unnamed, csvFile);
            }
            return header;
        }
    }
}
