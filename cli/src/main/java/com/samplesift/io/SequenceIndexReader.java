package com.samplesift.io;

import com.samplesift.quality.SequenceStats;
import com.samplesift.record.RecordSourceException;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a tab-separated sequence index with at least the columns {@code strain}, {@code length},
 * {@code A}, {@code C}, {@code G}, {@code T}, {@code N} and {@code invalid_nucleotides}. Other
 * count columns are ignored.
 */
public final class SequenceIndexReader {

    private static final List<String> REQUIRED =
            List.of("strain", "length", "A", "C", "G", "T", "N", "invalid_nucleotides");

    private SequenceIndexReader() {}

    public static SequenceIndex read(Path path) throws RecordSourceException {
        Map<String, SequenceStats> entries = new HashMap<>();
        try (BufferedReader reader = TextFiles.newReader(path)) {
            String header = TextFiles.stripBom(reader.readLine());
            if (header == null) {
                throw new RecordSourceException("Sequence index " + path + " is empty");
            }
            List<String> columns = DelimitedLineParser.parse(header, '\t');
            int[] positions = new int[REQUIRED.size()];
            for (int i = 0; i < REQUIRED.size(); i++) {
                positions[i] = columns.indexOf(REQUIRED.get(i));
                if (positions[i] < 0) {
                    throw new RecordSourceException(
                            "Sequence index " + path + " lacks required column '" + REQUIRED.get(i) + "'");
                }
            }
            String line;
            int lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                List<String> cells = DelimitedLineParser.parse(line, '\t');
                long[] counts = new long[positions.length];
                for (int i = 1; i < positions.length; i++) {
                    counts[i] = count(path, lineNumber, cells, positions[i], REQUIRED.get(i));
                }
                String id = cell(cells, positions[0]);
                long valid = counts[2] + counts[3] + counts[4] + counts[5];
                entries.put(id, new SequenceStats(counts[1], valid, counts[6], counts[7]));
            }
        } catch (IOException ex) {
            throw new RecordSourceException("Failed to read sequence index " + path + ": " + ex.getMessage(), ex);
        }
        return new SequenceIndex(entries);
    }

    private static long count(Path path, int lineNumber, List<String> cells, int position, String column)
            throws RecordSourceException {
        String value = cell(cells, position).trim();
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ex) {
            throw new RecordSourceException(
                    path + ":" + lineNumber + ": column '" + column + "' is not a count: '" + value + "'", ex);
        }
    }

    private static String cell(List<String> cells, int position) {
        return position < cells.size() ? cells.get(position) : "";
    }
}
