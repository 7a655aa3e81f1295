package com.samplesift.group;

import java.util.List;
import java.util.Objects;

/** Ordered tuple of grouping values; the empty tuple is the single implicit group. */
public final class GroupKey {
    public static final GroupKey IMPLICIT = new GroupKey(List.of());

    private final List<String> values;

    public GroupKey(List<String> values) {
        this.values = List.copyOf(Objects.requireNonNull(values, "values"));
    }

    public static GroupKey of(String... values) {
        return new GroupKey(List.of(values));
    }

    public List<String> getValues() {
        return values;
    }

    public boolean isImplicit() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof GroupKey that && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return isImplicit() ? "(all)" : "(" + String.join(", ", values) + ")";
    }
}
