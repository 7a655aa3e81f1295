package com.samplesift.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.samplesift.record.Record;
import com.samplesift.record.RecordSourceException;
import com.samplesift.record.RecordStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPOutputStream;
import org.junit.jupiter.api.Test;

final class DelimitedRecordSourceTest {

    @Test
    void readsTsvWithDefaultIdColumn() throws Exception {
        Path file = write("metadata.tsv", "strain\tdate\tcountry\nA\t2021-01-01\tPeru\n\nB\t2021-02-01\n");
        DelimitedRecordSource source = new DelimitedRecordSource(file);
        assertEquals('\t', source.getDelimiter());
        assertEquals(List.of("strain", "date", "country"), source.getColumns());
        List<Record> records = readAll(source);
        assertEquals(2, records.size());
        assertEquals("Peru", records.get(0).get("country"));
        assertEquals("", records.get(1).get("country"));
    }

    @Test
    void readsCsvAndFallsBackToNameColumn() throws Exception {
        Path file = write("metadata.csv", "\uFEFFname,location\nA,\"Lima, Peru\"\n");
        DelimitedRecordSource source = new DelimitedRecordSource(file);
        assertEquals(',', source.getDelimiter());
        assertEquals("name", source.getIdColumn());
        Record record = readAll(source).get(0);
        assertEquals("A", record.getId());
        assertEquals("Lima, Peru", record.get("location"));
    }

    @Test
    void readsGzipAndRestartsOnEveryOpen() throws Exception {
        Path file = Files.createTempDirectory("samplesift-gz").resolve("metadata.tsv.gz");
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(file))) {
            out.write("strain\tdate\nA\t2021\nB\t2022\n".getBytes(StandardCharsets.UTF_8));
        }
        DelimitedRecordSource source = new DelimitedRecordSource(file);
        assertEquals(2, readAll(source).size());
        assertEquals(2, readAll(source).size());
    }

    @Test
    void customIdColumnsArePickedInOrder() throws Exception {
        Path file = write("metadata.tsv", "accession\tstrain\nX1\tA\n");
        DelimitedRecordSource source = new DelimitedRecordSource(file, List.of("accession", "strain"));
        assertEquals("X1", readAll(source).get(0).getId());
    }

    @Test
    void rejectsMissingIdColumn() throws Exception {
        Path file = write("metadata.tsv", "id\tdate\nA\t2021\n");
        RecordSourceException ex =
                assertThrows(RecordSourceException.class, () -> new DelimitedRecordSource(file));
        assertTrue(ex.getMessage().contains("id columns"));
    }

    @Test
    void rejectsEmptyFile() throws Exception {
        Path file = write("metadata.tsv", "");
        assertThrows(RecordSourceException.class, () -> new DelimitedRecordSource(file));
    }

    @Test
    void rowsWiderThanHeaderComeBackMalformed() throws Exception {
        Path file = write("metadata.tsv", "strain\tdate\nA\t2021\textra\nB\t2022\n");
        List<Record> records = readAll(new DelimitedRecordSource(file));
        assertEquals(2, records.size());
        assertEquals("A", records.get(0).getId());
        assertTrue(records.get(0).isMalformed());
        assertEquals("row has 3 cells but the header has 2", records.get(0).getProblem());
        assertFalse(records.get(1).isMalformed());
    }

    @Test
    void emptyIdentifierIsNamedAfterItsLine() throws Exception {
        Path file = write("metadata.tsv", "strain\tdate\nA\t2021\n\t2021\nB\t2022\n");
        List<Record> records = readAll(new DelimitedRecordSource(file));
        assertEquals(3, records.size());
        assertEquals("<line 3>", records.get(1).getId());
        assertEquals("empty strain value", records.get(1).getProblem());
        assertEquals("B", records.get(2).getId());
    }

    @Test
    void gzipSuffixOnPlainFileFailsToRead() throws Exception {
        Path file = write("metadata.tsv.gz", "strain\tdate\nA\t2021\n");
        RecordSourceException ex =
                assertThrows(RecordSourceException.class, () -> new DelimitedRecordSource(file));
        assertTrue(ex.getMessage().contains("metadata.tsv.gz"));
    }

    private static List<Record> readAll(DelimitedRecordSource source) throws RecordSourceException {
        List<Record> records = new ArrayList<>();
        try (RecordStream stream = source.open()) {
            for (Record record = stream.next(); record != null; record = stream.next()) {
                records.add(record);
            }
            assertNull(stream.next());
        }
        return records;
    }

    static Path write(String name, String content) throws Exception {
        Path file = Files.createTempDirectory("samplesift-io").resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
