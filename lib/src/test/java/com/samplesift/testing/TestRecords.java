package com.samplesift.testing;

import com.samplesift.record.ListRecordSource;
import com.samplesift.record.Record;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Builds in-memory records keyed by a {@code strain} column. */
public final class TestRecords {

    public static final String ID_COLUMN = "strain";

    private TestRecords() {}

    /** {@code record("A", "country", "USA", "date", "2021-01-01")}. */
    public static Record record(String id, String... columnsAndValues) {
        if (columnsAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("columns and values must come in pairs");
        }
        Map<String, String> values = new LinkedHashMap<>();
        values.put(ID_COLUMN, id);
        for (int i = 0; i < columnsAndValues.length; i += 2) {
            values.put(columnsAndValues[i], columnsAndValues[i + 1]);
        }
        return new Record(id, values);
    }

    public static ListRecordSource source(List<Record> records) {
        return ListRecordSource.of(ID_COLUMN, records);
    }
}
