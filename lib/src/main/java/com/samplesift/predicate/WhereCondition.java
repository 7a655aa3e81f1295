package com.samplesift.predicate;

import com.samplesift.config.ConfigurationException;
import com.samplesift.record.Record;
import java.util.Locale;
import java.util.Objects;

/**
 * A {@code column=value} or {@code column!=value} condition from the {@code exclude_where} and
 * {@code force_include_where} options. Values are compared case-insensitively; a missing cell
 * compares as the empty string.
 */
public final class WhereCondition {
    private final String column;
    private final String value;
    private final boolean negated;

    public WhereCondition(String column, String value, boolean negated) {
        this.column = Objects.requireNonNull(column, "column");
        this.value = Objects.requireNonNull(value, "value");
        this.negated = negated;
    }

    public static WhereCondition parse(String text) throws ConfigurationException {
        Objects.requireNonNull(text, "text");
        int notEquals = text.indexOf("!=");
        int equals = text.indexOf('=');
        boolean negated = notEquals >= 0 && notEquals < equals;
        int split = negated ? notEquals : equals;
        if (split <= 0) {
            throw new ConfigurationException(
                    "Invalid where condition '" + text + "'; expected column=value or column!=value");
        }
        String column = text.substring(0, split).trim();
        String value = text.substring(split + (negated ? 2 : 1)).trim();
        if (column.isEmpty()) {
            throw new ConfigurationException("Missing column in where condition '" + text + "'");
        }
        return new WhereCondition(column, value, negated);
    }

    public boolean matches(Record record) {
        String cell = record.get(column);
        boolean equal = normalize(cell).equals(normalize(value));
        return negated != equal;
    }

    public String getColumn() {
        return column;
    }

    public String getValue() {
        return value;
    }

    public boolean isNegated() {
        return negated;
    }

    private static String normalize(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return column + (negated ? "!=" : "=") + value;
    }
}
