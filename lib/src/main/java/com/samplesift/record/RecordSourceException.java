package com.samplesift.record;

/**
 * Checked exception signalling that the input table could not be read. Unlike an unparseable row,
 * which the source hands over as a {@link Record#malformed malformed record}, this aborts the run.
 */
public final class RecordSourceException extends Exception {
    public RecordSourceException(String message) {
        super(message);
    }

    public RecordSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
