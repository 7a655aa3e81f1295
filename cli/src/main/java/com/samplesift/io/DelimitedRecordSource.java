package com.samplesift.io;

import com.samplesift.record.Record;
import com.samplesift.record.RecordSource;
import com.samplesift.record.RecordSourceException;
import com.samplesift.record.RecordStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Metadata table on disk, CSV or TSV, optionally gzip-compressed. The header is read once when
 * the source is created; every {@link #open()} re-reads the file from the start, so the engine can
 * stream it once per pass.
 *
 * <p>The identifier column is the first of the configured id columns present in the header.
 * Rows shorter than the header are padded with empty cells. Rows longer than the header, or with
 * an empty identifier, come back as {@link Record#malformed malformed records}; a row without an
 * identifier is named after its line, e.g. {@code <line 3>}. Blank lines are skipped. Quoted cells
 * may not span lines.</p>
 */
public final class DelimitedRecordSource implements RecordSource {

    public static final List<String> DEFAULT_ID_COLUMNS = List.of("strain", "name");

    private static final Logger LOGGER = Logger.getLogger(DelimitedRecordSource.class.getName());

    private final Path path;
    private final char delimiter;
    private final List<String> columns;
    private final String idColumn;

    public DelimitedRecordSource(Path path, List<String> idColumns) throws RecordSourceException {
        this.path = Objects.requireNonNull(path, "path");
        String header;
        try (BufferedReader reader = TextFiles.newReader(path)) {
            header = TextFiles.stripBom(reader.readLine());
        } catch (IOException ex) {
            throw new RecordSourceException("Failed to read metadata " + path + ": " + ex.getMessage(), ex);
        }
        if (header == null || header.isBlank()) {
            throw new RecordSourceException("Metadata " + path + " is empty");
        }
        this.delimiter = DelimitedLineParser.sniffDelimiter(header);
        this.columns = List.copyOf(DelimitedLineParser.parse(header, delimiter));
        String found = null;
        for (String candidate : idColumns) {
            if (columns.contains(candidate)) {
                found = candidate;
                break;
            }
        }
        if (found == null) {
            throw new RecordSourceException(
                    "None of the possible id columns " + idColumns + " were found in the metadata's columns "
                            + columns);
        }
        this.idColumn = found;
    }

    public DelimitedRecordSource(Path path) throws RecordSourceException {
        this(path, DEFAULT_ID_COLUMNS);
    }

    @Override
    public List<String> getColumns() {
        return columns;
    }

    public String getIdColumn() {
        return idColumn;
    }

    public char getDelimiter() {
        return delimiter;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public RecordStream open() throws RecordSourceException {
        BufferedReader reader;
        try {
            reader = TextFiles.newReader(path);
        } catch (IOException ex) {
            throw new RecordSourceException("Failed to open metadata " + path + ": " + ex.getMessage(), ex);
        }
        try {
            reader.readLine();
        } catch (IOException ex) {
            RecordSourceException failure =
                    new RecordSourceException("Failed to open metadata " + path + ": " + ex.getMessage(), ex);
            try {
                reader.close();
            } catch (IOException closeFailure) {
                failure.addSuppressed(closeFailure);
            }
            throw failure;
        }
        return new Cursor(reader);
    }

    private final class Cursor implements RecordStream {
        private final BufferedReader reader;
        private long lineNumber = 1;

        Cursor(BufferedReader reader) {
            this.reader = reader;
        }

        @Override
        public Record next() throws RecordSourceException {
            String line;
            try {
                do {
                    line = reader.readLine();
                    lineNumber++;
                } while (line != null && line.isBlank());
            } catch (IOException ex) {
                throw new RecordSourceException(
                        "Failed to read " + path + " at line " + lineNumber + ": " + ex.getMessage(), ex);
            }
            if (line == null) {
                return null;
            }
            List<String> cells = DelimitedLineParser.parse(line, delimiter);
            Map<String, String> values = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                values.put(columns.get(i), i < cells.size() ? cells.get(i) : "");
            }
            String id = values.get(idColumn);
            if (id.isEmpty()) {
                return malformed("<line " + lineNumber + ">", values, "empty " + idColumn + " value");
            }
            if (cells.size() > columns.size()) {
                return malformed(id, values,
                        "row has " + cells.size() + " cells but the header has " + columns.size());
            }
            return new Record(id, values);
        }

        private Record malformed(String id, Map<String, String> values, String problem) {
            long line = lineNumber;
            LOGGER.fine(() -> path + ":" + line + ": " + problem);
            return Record.malformed(id, values, problem);
        }

        @Override
        public void close() throws RecordSourceException {
            try {
                reader.close();
            } catch (IOException ex) {
                throw new RecordSourceException("Failed to close " + path, ex);
            }
        }
    }
}
