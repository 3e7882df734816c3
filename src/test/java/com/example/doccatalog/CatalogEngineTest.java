package com.example.doccatalog;

import com.example.doccatalog.export.ExportSink;
import com.example.doccatalog.model.FileRecord;
import com.example.doccatalog.store.CatalogStore;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;

import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CatalogEngineTest {

    @Test
    void catalogsFlagsDuplicatesAndHonorsExclusions() throws Exception {
        Path root = Files.createTempDirectory("engine-root");
        Files.writeString(root.resolve("a.txt"), "X");
        Files.writeString(root.resolve("b.txt"), "X");
        Files.writeString(root.resolve("c.txt"), "Y");
        Files.createDirectories(root.resolve("tmp"));
        Files.writeString(root.resolve("tmp/d.txt"), "Z");
        Path work = Files.createTempDirectory("engine-work");

        CatalogConfig config = CatalogConfig.builder(List.of(root))
                .excludeDirectories(List.of("tmp"))
                .storePath(work.resolve("catalog.db"))
                .exportPath(work.resolve("catalog.csv"))
                .sessionId("scenario-a")
                .build();
        CatalogEngine engine = new CatalogEngine(config);
        CatalogResult result = engine.run();

        assertEquals(EngineState.DONE, engine.state());
        assertEquals(List.of("a.txt", "b.txt", "c.txt"), names(result.records()));
        assertEquals(3, result.newRecords());
        assertEquals(1, result.duplicates());
        assertFalse(result.records().get(0).isDuplicate());
        assertTrue(result.records().get(1).isDuplicate());
        assertFalse(result.records().get(2).isDuplicate());
        assertEquals(3L, result.rowsStored());

        List<CSVRecord> exported = readCsv(work.resolve("catalog.csv"));
        assertEquals(3, exported.size());
        assertEquals("true", exported.get(1).get("Duplicate"));
        assertEquals("b.txt", exported.get(1).get("Relative Path"));
        assertTrue(Files.exists(work.resolve("catalog.properties.json")));

        try (CatalogStore store = CatalogStore.open(config.storePath(), StorePolicy.APPEND, 10)) {
            assertEquals(3L, store.storedFileCount("scenario-a"));
        }
    }

    @Test
    void importedRecordsStayExistingAndOnlyNewFilesAreCounted() throws Exception {
        Path root = Files.createTempDirectory("engine-root");
        Files.writeString(root.resolve("a.txt"), "alpha");
        Files.writeString(root.resolve("b.txt"), "bravo");
        Files.writeString(root.resolve("n.txt"), "new");
        Path work = Files.createTempDirectory("engine-work");
        Path imported = work.resolve("previous.csv");
        Files.writeString(imported, "File Path,File Size,Checksum,Owner\n"
                + root.resolve("a.txt") + ",5," + sha1(root.resolve("a.txt")) + ",ops\n"
                + root.resolve("b.txt") + ",5," + sha1(root.resolve("b.txt")) + ",dev\n");

        CatalogConfig config = CatalogConfig.builder(List.of(root))
                .existingCatalog(imported)
                .storePath(work.resolve("catalog.db"))
                .build();
        CatalogResult result = new CatalogEngine(config).run();

        assertEquals(3, result.records().size());
        assertEquals(2, result.existingRecords());
        assertEquals(1, result.newRecords());
        assertEquals(2, result.alreadyKnown());
        assertEquals(FileRecord.Origin.EXISTING, result.records().get(0).origin());
        assertEquals(FileRecord.Origin.EXISTING, result.records().get(1).origin());
        assertEquals(FileRecord.Origin.NEW, result.records().get(2).origin());
        assertEquals("n.txt", result.records().get(2).name());
        assertEquals(1L, result.rowsStored());
    }

    @Test
    void rerunAgainstItsOwnExportAdmitsNothingNew() throws Exception {
        Path root = Files.createTempDirectory("engine-root");
        Files.createDirectories(root.resolve("sub"));
        Files.writeString(root.resolve("a.txt"), "alpha");
        Files.writeString(root.resolve("sub/b.txt"), "bravo");
        Files.writeString(root.resolve("sub/c.txt"), "alpha");
        Path work = Files.createTempDirectory("engine-work");

        CatalogConfig first = CatalogConfig.builder(List.of(root))
                .storePath(work.resolve("first.db"))
                .exportPath(work.resolve("first.csv"))
                .build();
        CatalogResult firstResult = new CatalogEngine(first).run();
        assertEquals(3, firstResult.newRecords());

        CatalogConfig second = CatalogConfig.builder(List.of(root))
                .existingCatalog(work.resolve("first.csv"))
                .storePath(work.resolve("second.db"))
                .exportPath(work.resolve("second.csv"))
                .build();
        CatalogResult secondResult = new CatalogEngine(second).run();

        assertEquals(0, secondResult.newRecords());
        assertEquals(3, secondResult.existingRecords());
        assertEquals(3, secondResult.alreadyKnown());
        assertEquals(1, secondResult.duplicates());
        assertEquals(0L, secondResult.rowsStored());
        assertEquals(names(firstResult.records()), names(secondResult.records()));
    }

    @Test
    void priorStoreSessionsSeedTheCatalog() throws Exception {
        Path root = Files.createTempDirectory("engine-root");
        Files.writeString(root.resolve("a.txt"), "alpha");
        Path work = Files.createTempDirectory("engine-work");
        Path db = work.resolve("catalog.db");

        new CatalogEngine(CatalogConfig.builder(List.of(root)).storePath(db).build()).run();
        Files.writeString(root.resolve("b.txt"), "bravo");

        CatalogConfig second = CatalogConfig.builder(List.of(root))
                .storePath(db)
                .storePolicy(StorePolicy.APPEND)
                .priorStore(db)
                .build();
        CatalogResult result = new CatalogEngine(second).run();

        assertEquals(1, result.existingRecords());
        assertEquals(1, result.newRecords());
        assertEquals("b.txt", result.records().get(1).name());
        assertEquals(1L, result.rowsStored());
        assertEquals(0L, result.alreadyStored());
    }

    @Test
    void stopRequestKeepsFlushedRowsAndSkipsExport() throws Exception {
        Path root = Files.createTempDirectory("engine-root");
        for (int dir = 0; dir < 3; dir++) {
            Path sub = Files.createDirectories(root.resolve("dir" + dir));
            for (int file = 0; file < 3; file++) {
                Files.writeString(sub.resolve("f" + file + ".txt"), "content " + dir + "/" + file);
            }
        }
        Path work = Files.createTempDirectory("engine-work");
        List<Integer> exports = new ArrayList<>();
        ExportSink sink = (properties, columns, rows) -> exports.add(rows.size());

        CatalogConfig config = CatalogConfig.builder(List.of(root))
                .storePath(work.resolve("catalog.db"))
                .bufferThreshold(2)
                .sessionId("cancelled")
                .build();
        CatalogEngine engine = new CatalogEngine(config, sink, admitted -> admitted >= 2);
        CatalogResult result = engine.run();

        assertEquals(EngineState.CANCELLED, engine.state());
        assertEquals(EngineState.CANCELLED, result.state());
        assertEquals(2, result.newRecords());
        assertEquals(2L, result.rowsStored());
        assertTrue(exports.isEmpty());
        try (CatalogStore store = CatalogStore.open(config.storePath(), StorePolicy.APPEND, 10)) {
            assertEquals(2L, store.storedFileCount("cancelled"));
        }
    }

    @Test
    void parallelHashingPreservesWalkOrder() throws Exception {
        Path root = Files.createTempDirectory("engine-root");
        for (int dir = 0; dir < 5; dir++) {
            Path sub = Files.createDirectories(root.resolve("dir" + dir));
            for (int file = 0; file < 12; file++) {
                Files.writeString(sub.resolve("f" + file + ".txt"), "content " + (file % 4));
            }
        }
        Path work = Files.createTempDirectory("engine-work");

        CatalogResult sequential = new CatalogEngine(CatalogConfig.builder(List.of(root))
                .storePath(work.resolve("sequential.db"))
                .build()).run();
        CatalogResult parallel = new CatalogEngine(CatalogConfig.builder(List.of(root))
                .storePath(work.resolve("parallel.db"))
                .threadCount(4)
                .bufferThreshold(7)
                .build()).run();

        assertEquals(60, parallel.newRecords());
        assertEquals(paths(sequential.records()), paths(parallel.records()));
        assertEquals(duplicateFlags(sequential.records()), duplicateFlags(parallel.records()));
        assertEquals(56, parallel.duplicates());
        assertEquals(60L, parallel.rowsStored());
    }

    @Test
    void withoutContentCheckRelativePathDecidesAndFlagsAreLeftAlone() throws Exception {
        Path root = Files.createTempDirectory("engine-root");
        Files.writeString(root.resolve("a.txt"), "changed");
        Files.writeString(root.resolve("b.txt"), "changed");
        Path work = Files.createTempDirectory("engine-work");
        Path imported = work.resolve("previous.csv");
        Files.writeString(imported, "File Path,Checksum,Duplicate\n" + root.resolve("a.txt") + ",stale,True\n");

        CatalogConfig config = CatalogConfig.builder(List.of(root))
                .existingCatalog(imported)
                .checkFileContents(false)
                .storePath(work.resolve("catalog.db"))
                .build();
        CatalogResult result = new CatalogEngine(config).run();

        assertEquals(1, result.alreadyKnown());
        assertEquals(1, result.newRecords());
        assertEquals(0, result.duplicates());
        assertEquals("stale", result.records().get(0).checksum());
        assertTrue(result.records().get(0).isDuplicate());
        assertFalse(result.records().get(1).isDuplicate());
    }

    @Test
    void exportPathMustBeCsv() throws Exception {
        Path root = Files.createTempDirectory("engine-root");
        Path work = Files.createTempDirectory("engine-work");
        CatalogConfig config = CatalogConfig.builder(List.of(root))
                .storePath(work.resolve("catalog.db"))
                .exportPath(work.resolve("catalog.xlsx"))
                .build();
        CatalogEngine engine = new CatalogEngine(config);

        assertThrows(FatalConfigException.class, engine::run);
        assertEquals(EngineState.FAILED, engine.state());
        assertFalse(Files.exists(work.resolve("catalog.db")));
    }

    @Test
    void existingExportNeedsExplicitOverwrite() throws Exception {
        Path root = Files.createTempDirectory("engine-root");
        Path work = Files.createTempDirectory("engine-work");
        Files.writeString(work.resolve("catalog.csv"), "File Path\n");

        CatalogConfig refused = CatalogConfig.builder(List.of(root))
                .storePath(work.resolve("refused.db"))
                .exportPath(work.resolve("catalog.csv"))
                .build();
        assertThrows(FatalConfigException.class, () -> new CatalogEngine(refused).run());

        CatalogConfig allowed = CatalogConfig.builder(List.of(root))
                .storePath(work.resolve("allowed.db"))
                .exportPath(work.resolve("catalog.csv"))
                .allowExportOverwrite(true)
                .build();
        assertEquals(EngineState.DONE, new CatalogEngine(allowed).run().state());
    }

    @Test
    void missingExistingCatalogIsFatal() throws Exception {
        Path root = Files.createTempDirectory("engine-root");
        Path work = Files.createTempDirectory("engine-work");
        CatalogConfig config = CatalogConfig.builder(List.of(root))
                .existingCatalog(work.resolve("missing.csv"))
                .storePath(work.resolve("catalog.db"))
                .build();

        assertThrows(FatalConfigException.class, () -> new CatalogEngine(config).run());
    }

    @Test
    void priorStoreCannotBeTheOverwrittenDestination() throws Exception {
        Path root = Files.createTempDirectory("engine-root");
        Path work = Files.createTempDirectory("engine-work");
        CatalogConfig config = CatalogConfig.builder(List.of(root))
                .storePath(work.resolve("catalog.db"))
                .storePolicy(StorePolicy.OVERWRITE)
                .priorStore(work.resolve("./catalog.db"))
                .build();

        assertThrows(FatalConfigException.class, () -> new CatalogEngine(config).run());
    }

    @Test
    void existingStoreUnderErrorPolicyFailsTheRun() throws Exception {
        Path root = Files.createTempDirectory("engine-root");
        Path work = Files.createTempDirectory("engine-work");
        CatalogConfig config = CatalogConfig.builder(List.of(root)).storePath(work.resolve("catalog.db")).build();
        new CatalogEngine(config).run();

        CatalogEngine rerun = new CatalogEngine(config);
        assertThrows(StoreConflictException.class, rerun::run);
        assertEquals(EngineState.FAILED, rerun.state());
    }

    private static String sha1(Path file) {
        return IdentityResolver.resolve(file, HashAlgorithm.SHA1, 1024).getIdentity().checksum();
    }

    private static List<String> names(List<FileRecord> records) {
        return records.stream().map(FileRecord::name).toList();
    }

    private static List<Path> paths(List<FileRecord> records) {
        return records.stream().map(FileRecord::absolutePath).toList();
    }

    private static List<Boolean> duplicateFlags(List<FileRecord> records) {
        return records.stream().map(FileRecord::isDuplicate).toList();
    }

    private static List<CSVRecord> readCsv(Path csv) throws Exception {
        try (Reader reader = Files.newBufferedReader(csv);
             CSVParser parser = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build().parse(reader)) {
            return parser.getRecords();
        }
    }
}
