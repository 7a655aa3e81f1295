package com.samplesift.record;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** In-memory {@link RecordSource}, mainly for embedding callers and tests. */
public final class ListRecordSource implements RecordSource {
    private final List<String> columns;
    private final List<Record> records;

    public ListRecordSource(List<String> columns, List<Record> records) {
        this.columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
        this.records = List.copyOf(Objects.requireNonNull(records, "records"));
    }

    /** Builds a source whose columns are the union of all record columns in first-seen order. */
    public static ListRecordSource of(String idColumn, List<Record> records) {
        Set<String> columns = new LinkedHashSet<>();
        columns.add(idColumn);
        for (Record record : records) {
            columns.addAll(record.getValues().keySet());
        }
        return new ListRecordSource(new ArrayList<>(columns), records);
    }

    @Override
    public List<String> getColumns() {
        return columns;
    }

    @Override
    public RecordStream open() {
        Iterator<Record> iterator = records.iterator();
        return new RecordStream() {
            @Override
            public Record next() {
                return iterator.hasNext() ? iterator.next() : null;
            }

            @Override
            public void close() {}
        };
    }

    public int size() {
        return records.size();
    }
}
