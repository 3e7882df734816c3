package com.example.doccatalog.export;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes the catalog table as CSV plus a JSON properties file beside it.
 */
public final class CsvCatalogExporter implements ExportSink {
    private static final Logger LOGGER = LoggerFactory.getLogger(CsvCatalogExporter.class);

    private final Path exportPath;

    public CsvCatalogExporter(Path exportPath) {
        this.exportPath = exportPath;
    }

    @Override
    public void export(CatalogProperties properties, List<String> columns, List<Map<String, String>> rows) throws IOException {
        Path parent = exportPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(columns.toArray(new String[0]))
                .build();
        try (Writer writer = Files.newBufferedWriter(exportPath, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            List<String> values = new ArrayList<>(columns.size());
            for (Map<String, String> row : rows) {
                values.clear();
                for (String column : columns) {
                    values.add(row.getOrDefault(column, ""));
                }
                printer.printRecord(values);
            }
        }
        new PropertiesWriter(PropertiesWriter.sidecarFor(exportPath)).save(properties);
        LOGGER.info("Exported {} records to {}", rows.size(), exportPath);
    }
}
