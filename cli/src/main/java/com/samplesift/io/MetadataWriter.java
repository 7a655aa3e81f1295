package com.samplesift.io;

import com.samplesift.record.Record;
import com.samplesift.record.RecordSource;
import com.samplesift.record.RecordSourceException;
import com.samplesift.record.RecordStream;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes the metadata rows of kept records as TSV with the input header, streaming the source once
 * more so row order matches the input.
 */
public final class MetadataWriter {

    private MetadataWriter() {}

    /** @return the number of rows written. */
    public static long write(RecordSource source, Collection<String> keptIds, Path path)
            throws RecordSourceException, IOException {
        Set<String> kept = new HashSet<>(keptIds);
        List<String> columns = source.getColumns();
        long written = 0;
        try (BufferedWriter writer = TextFiles.newWriter(path);
                RecordStream stream = source.open()) {
            writeRow(writer, columns);
            List<String> row = new ArrayList<>(columns.size());
            for (Record record = stream.next(); record != null; record = stream.next()) {
                if (record.isMalformed() || !kept.contains(record.getId())) {
                    continue;
                }
                row.clear();
                for (String column : columns) {
                    String value = record.get(column);
                    row.add(value == null ? "" : value);
                }
                writeRow(writer, row);
                written++;
            }
        }
        return written;
    }

    private static void writeRow(BufferedWriter writer, List<String> cells) throws IOException {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                writer.write('\t');
            }
            writer.write(DelimitedLineParser.quote(cells.get(i), '\t'));
        }
        writer.newLine();
    }
}
