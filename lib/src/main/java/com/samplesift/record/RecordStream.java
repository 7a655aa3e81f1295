package com.samplesift.record;

/** Forward-only cursor over a {@link RecordSource}. */
public interface RecordStream extends AutoCloseable {

    /**
     * @return the next record, or {@code null} once the stream is exhausted.
     */
    Record next() throws RecordSourceException;

    @Override
    void close() throws RecordSourceException;
}
