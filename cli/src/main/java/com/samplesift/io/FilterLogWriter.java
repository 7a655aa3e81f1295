package com.samplesift.io;

import com.samplesift.outcome.OutcomeListener;
import com.samplesift.predicate.DropReason;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Audit log of per-record decisions as TSV with columns {@code strain}, {@code filter} and
 * {@code kwargs}. Write failures surface as {@link UncheckedIOException} since listener callbacks
 * cannot throw checked exceptions.
 */
public final class FilterLogWriter implements OutcomeListener, Closeable {

    static final String FORCE_INCLUDE = "force-include";

    private final BufferedWriter writer;

    public FilterLogWriter(Path path) throws IOException {
        this.writer = TextFiles.newWriter(path);
        writeRow("strain", "filter", "kwargs");
    }

    @Override
    public void onDropped(String id, DropReason reason, String detail) {
        writeRow(id, reason.getCode(), detail);
    }

    @Override
    public void onForceIncluded(String id, String detail) {
        writeRow(id, FORCE_INCLUDE, detail);
    }

    private void writeRow(String id, String filter, String kwargs) {
        try {
            writer.write(DelimitedLineParser.quote(id, '\t'));
            writer.write('\t');
            writer.write(filter);
            writer.write('\t');
            writer.write(DelimitedLineParser.quote(kwargs == null ? "" : kwargs, '\t'));
            writer.newLine();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write filter log", ex);
        }
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
