package com.samplesift.record;

import java.util.List;

/**
 * A finite, restartable input table. Every call to {@link #open()} must yield the same records in
 * the same order, since filtering makes up to two passes (three when metadata is written back out).
 */
public interface RecordSource {

    /** Column names in header order, including the identifier column. */
    List<String> getColumns() throws RecordSourceException;

    /** Opens a fresh stream positioned before the first record. */
    RecordStream open() throws RecordSourceException;
}
