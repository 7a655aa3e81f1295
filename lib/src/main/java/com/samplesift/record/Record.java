package com.samplesift.record;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One metadata row: a unique identifier plus the raw string value of every column. Records are
 * read-only; derived values (date parts, group keys, priorities) live outside the record.
 *
 * <p>A source that meets a row it cannot parse still hands it over, flagged with the parse
 * problem, so the row is dropped and counted instead of ending the stream.</p>
 */
public final class Record {
    private final String id;
    private final Map<String, String> values;
    private final String problem;

    public Record(String id, Map<String, String> values) {
        this(id, values, null);
    }

    private Record(String id, Map<String, String> values, String problem) {
        this.id = Objects.requireNonNull(id, "id");
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(values, "values")));
        this.problem = problem;
    }

    /**
     * A row that could not be parsed.
     *
     * @param id the row's identifier, or a placeholder such as {@code <line 3>} when it has none.
     */
    public static Record malformed(String id, Map<String, String> values, String problem) {
        return new Record(id, values, Objects.requireNonNull(problem, "problem"));
    }

    public String getId() {
        return id;
    }

    /** Returns the raw value of {@code column}, or {@code null} when the record has no such column. */
    public String get(String column) {
        return values.get(column);
    }

    public Map<String, String> getValues() {
        return values;
    }

    public boolean isMalformed() {
        return problem != null;
    }

    /** Why the row could not be parsed, or {@code null} for a well-formed record. */
    public String getProblem() {
        return problem;
    }

    @Override
    public String toString() {
        return problem == null ? "Record[" + id + "]" : "Record[" + id + ", malformed: " + problem + "]";
    }
}
