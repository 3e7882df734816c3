package com.example.doccatalog.store;

import com.example.doccatalog.HashAlgorithm;
import com.example.doccatalog.SchemaException;
import com.example.doccatalog.model.FileRecord;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CsvCatalogImporterTest {
    private final CsvCatalogImporter importer = new CsvCatalogImporter();

    @Test
    void importsRecognizedColumnsAndKeepsExtras() throws Exception {
        Path dir = Files.createTempDirectory("import");
        Path csv = dir.resolve("catalog.csv");
        Files.writeString(csv, String.join("\n",
                "File Path,Relative Path,Subdirectory 1,File Size,Checksum,Duplicate,Owner,Notes",
                dir.resolve("a/x.txt") + ",a/x.txt,a,10,abc,False,ops,\"first, note\"",
                dir.resolve("y.txt") + ",y.txt,,20.0,def,True,dev,",
                ""));

        List<FileRecord> records = importer.load(csv, dir, HashAlgorithm.SHA1);

        assertEquals(2, records.size());
        FileRecord first = records.get(0);
        assertEquals(FileRecord.Origin.EXISTING, first.origin());
        assertEquals(10L, first.size());
        assertEquals("abc", first.checksum());
        assertFalse(first.isDuplicate());
        assertEquals(2, first.extras().size());
        assertEquals("Owner", first.extras().get(0).name());
        assertEquals("first, note", first.extras().get(1).value());

        FileRecord second = records.get(1);
        assertEquals(20L, second.size());
        assertTrue(second.isDuplicate());
        assertEquals("", second.extras().get(1).value());
    }

    @Test
    void missingFilePathColumnIsASchemaError() throws Exception {
        Path csv = Files.createTempDirectory("import").resolve("catalog.csv");
        Files.writeString(csv, "Filename,Checksum\nx.txt,abc\n");

        assertThrows(SchemaException.class, () -> importer.load(csv, csv.getParent(), HashAlgorithm.SHA1));
    }

    @Test
    void rowsWithoutPathAreSkipped() throws Exception {
        Path dir = Files.createTempDirectory("import");
        Path csv = dir.resolve("catalog.csv");
        Files.writeString(csv, "File Path,Checksum\n,abc\n" + dir.resolve("b.txt") + ",def\n");

        List<FileRecord> records = importer.load(csv, dir, HashAlgorithm.SHA1);

        assertEquals(1, records.size());
        assertEquals("b.txt", records.get(0).name());
    }

    @Test
    void checksumOfAnotherAlgorithmIsDropped() throws Exception {
        Path dir = Files.createTempDirectory("import");
        Path csv = dir.resolve("catalog.csv");
        Files.writeString(csv, "File Path,Checksum,Hash Algorithm\n"
                + dir.resolve("a.txt") + ",5d41402abc4b2a76b9719d911017c592,MD5\n"
                + dir.resolve("b.txt") + ",aaf4c61ddcc5e8a2dabede0f3b482cd9aea9434d,SHA-1\n");

        List<FileRecord> records = importer.load(csv, dir, HashAlgorithm.SHA1);

        assertNull(records.get(0).checksum());
        assertFalse(records.get(0).isIdentityResolved());
        assertEquals("aaf4c61ddcc5e8a2dabede0f3b482cd9aea9434d", records.get(1).checksum());
    }

    @Test
    void missingChecksumLeavesIdentityUnresolved() throws Exception {
        Path dir = Files.createTempDirectory("import");
        Path csv = dir.resolve("catalog.csv");
        Files.writeString(csv, "File Path\n" + dir.resolve("a.txt") + "\n");

        FileRecord record = importer.load(csv, dir, HashAlgorithm.SHA1).get(0);

        assertNull(record.checksum());
        assertNull(record.size());
        assertFalse(record.isIdentityResolved());
    }

    @Test
    void unnamedIndexColumnIsDropped() throws Exception {
        Path dir = Files.createTempDirectory("import");
        Path csv = dir.resolve("catalog.csv");
        Files.writeString(csv, ",File Path,Checksum,Owner\n0," + dir.resolve("a.txt") + ",abc,ops\n");

        List<FileRecord> records = importer.load(csv, dir, HashAlgorithm.SHA1);

        assertEquals(1, records.size());
        assertEquals("abc", records.get(0).checksum());
        assertEquals(1, records.get(0).extras().size());
        assertEquals("Owner", records.get(0).extras().get(0).name());
        assertEquals("ops", records.get(0).extras().get(0).value());
    }

    @Test
    void byteOrderMarkBeforeTheHeaderIsIgnored() throws Exception {
        Path dir = Files.createTempDirectory("import");
        Path csv = dir.resolve("catalog.csv");
        Files.writeString(csv, "\uFEFFFile Path,Checksum\n" + dir.resolve("a.txt") + ",abc\n");

        List<FileRecord> records = importer.load(csv, dir, HashAlgorithm.SHA1);

        assertEquals(1, records.size());
        assertEquals("a.txt", records.get(0).name());
        assertEquals("abc", records.get(0).checksum());
    }

    @Test
    void repeatedColumnNameIsASchemaError() throws Exception {
        Path dir = Files.createTempDirectory("import");
        Path csv = dir.resolve("catalog.csv");
        Files.writeString(csv, "File Path,Note,Note\n" + dir.resolve("a.txt") + ",n1,n2\n");

        SchemaException ex = assertThrows(SchemaException.class, () -> importer.load(csv, dir, HashAlgorithm.SHA1));
        assertTrue(ex.getMessage().contains("Note"));
    }

    @Test
    void shortRowsLeaveTrailingExtrasEmpty() throws Exception {
        Path dir = Files.createTempDirectory("import");
        Path csv = dir.resolve("catalog.csv");
        Files.writeString(csv, "File Path,Owner,Note\n" + dir.resolve("a.txt") + ",ops\n");

        FileRecord record = importer.load(csv, dir, HashAlgorithm.SHA1).get(0);

        assertEquals("ops", record.extras().get(0).value());
        assertEquals("Note", record.extras().get(1).name());
        assertEquals("", record.extras().get(1).value());
    }

    @Test
    void malformedQuotingIsASchemaError() throws Exception {
        Path dir = Files.createTempDirectory("import");
        Path csv = dir.resolve("catalog.csv");
        Files.writeString(csv, "File Path,Checksum\n\"" + dir.resolve("a.txt") + "\"abc,def\n");

        assertThrows(SchemaException.class, () -> importer.load(csv, dir, HashAlgorithm.SHA1));
    }

    @Test
    void emptyFileIsASchemaError() throws Exception {
        Path csv = Files.createTempDirectory("import").resolve("catalog.csv");
        Files.writeString(csv, "");

        assertThrows(SchemaException.class, () -> importer.load(csv, csv.getParent(), HashAlgorithm.SHA1));
    }
}
