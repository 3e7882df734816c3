package com.example.doccatalog.export;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;

import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CsvCatalogExporterTest {

    @Test
    void writesTableAndPropertiesSidecar() throws Exception {
        Path dir = Files.createTempDirectory("export");
        Path csv = dir.resolve("out/catalog.csv");
        Map<String, String> row = new LinkedHashMap<>();
        row.put("File Path", "/data/a, b.txt");
        row.put("Checksum", "abc");
        Map<String, String> sparse = Map.of("File Path", "/data/c.txt");
        CatalogProperties properties = new CatalogProperties("s1", List.of("/data"), List.of("tmp"), null, null,
                "/data", "catalog.db", "SHA-1", 65536, 100, true, Instant.parse("2024-01-02T03:04:05Z"));

        new CsvCatalogExporter(csv).export(properties, List.of("File Path", "Checksum"), List.of(row, sparse));

        try (Reader reader = Files.newBufferedReader(csv);
             CSVParser parser = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build().parse(reader)) {
            assertEquals(List.of("File Path", "Checksum"), parser.getHeaderNames());
            List<CSVRecord> records = parser.getRecords();
            assertEquals(2, records.size());
            assertEquals("/data/a, b.txt", records.get(0).get("File Path"));
            assertEquals("", records.get(1).get("Checksum"));
        }

        Path sidecar = dir.resolve("out/catalog.properties.json");
        assertTrue(Files.exists(sidecar));
        CatalogProperties loaded = new PropertiesWriter(sidecar).load().orElseThrow();
        assertEquals(properties, loaded);
        assertTrue(Files.readString(sidecar).contains("2024-01-02T03:04:05Z"));
    }

    @Test
    void sidecarNameFollowsTheExportStem() {
        assertEquals(Path.of("/tmp/report.properties.json"), PropertiesWriter.sidecarFor(Path.of("/tmp/report.csv")));
    }

    @Test
    void missingSidecarLoadsAsEmpty() throws Exception {
        Path dir = Files.createTempDirectory("export");

        assertTrue(new PropertiesWriter(dir.resolve("none.properties.json")).load().isEmpty());
    }
}
