package com.samplesift.record;

import com.samplesift.date.DateAmbiguityResolver;
import com.samplesift.date.DateValue;
import com.samplesift.date.MalformedDateException;
import java.util.Objects;

/**
 * A record together with its position in the input stream and its lazily resolved date, so the
 * date cell is parsed at most once however many predicates and grouping columns look at it.
 */
public final class RecordContext {
    private final Record record;
    private final long ordinal;
    private final String dateColumn;
    private boolean dateResolved;
    private DateValue date;
    private MalformedDateException dateFailure;

    public RecordContext(Record record, long ordinal, String dateColumn) {
        this.record = Objects.requireNonNull(record, "record");
        this.ordinal = ordinal;
        this.dateColumn = dateColumn;
    }

    public Record getRecord() {
        return record;
    }

    public String getId() {
        return record.getId();
    }

    /** Zero-based position of the record in the input stream. */
    public long getOrdinal() {
        return ordinal;
    }

    public String getRawDate() {
        return dateColumn == null ? null : record.get(dateColumn);
    }

    public DateValue getDate() throws MalformedDateException {
        resolveDate();
        if (dateFailure != null) {
            throw dateFailure;
        }
        return date;
    }

    public boolean isDateMalformed() {
        resolveDate();
        return dateFailure != null;
    }

    private void resolveDate() {
        if (dateResolved) {
            return;
        }
        dateResolved = true;
        try {
            date = DateAmbiguityResolver.resolve(getRawDate());
        } catch (MalformedDateException ex) {
            dateFailure = ex;
        }
    }
}
