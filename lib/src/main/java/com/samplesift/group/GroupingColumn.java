package com.samplesift.group;

import com.samplesift.date.DateComponent;

/** A requested {@code group_by} entry: either a literal data column or a date-derived column. */
public final class GroupingColumn {

    public enum Kind {
        LITERAL(null),
        YEAR(DateComponent.YEAR),
        MONTH(DateComponent.MONTH),
        WEEK(DateComponent.DAY);

        private final DateComponent deepestComponent;

        Kind(DateComponent deepestComponent) {
            this.deepestComponent = deepestComponent;
        }

        /** The most specific date component this kind needs, or {@code null} for literal columns. */
        public DateComponent getDeepestComponent() {
            return deepestComponent;
        }

        static Kind forName(String name) {
            return switch (name) {
                case "year" -> YEAR;
                case "month" -> MONTH;
                case "week" -> WEEK;
                default -> LITERAL;
            };
        }
    }

    private final String name;
    private final Kind kind;

    GroupingColumn(String name, Kind kind) {
        this.name = name;
        this.kind = kind;
    }

    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isDateDerived() {
        return kind != Kind.LITERAL;
    }

    @Override
    public String toString() {
        return isDateDerived() ? name + " (from date)" : name;
    }
}
