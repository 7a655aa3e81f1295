package com.samplesift.date;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.IsoFields;
import java.util.Locale;
import java.util.Objects;

/**
 * A resolved date cell. Each component is either a known integer or ambiguous ({@code null}).
 * Instances are produced by {@link DateAmbiguityResolver}, which guarantees that a known month
 * implies a known year and a known day implies a known month.
 */
public final class DateValue {
    static final DateValue UNKNOWN = new DateValue(null, null, null);

    private final Integer year;
    private final Integer month;
    private final Integer day;

    DateValue(Integer year, Integer month, Integer day) {
        this.year = year;
        this.month = month;
        this.day = day;
    }

    public Integer getYear() {
        return year;
    }

    public Integer getMonth() {
        return month;
    }

    public Integer getDay() {
        return day;
    }

    public boolean isKnown(DateComponent component) {
        return switch (component) {
            case YEAR -> year != null;
            case MONTH -> month != null;
            case DAY -> day != null;
        };
    }

    public boolean isFullyKnown() {
        return day != null;
    }

    /**
     * Returns the first ambiguous component among {@code YEAR} up to and including
     * {@code deepest}, or {@code null} when all of them are known.
     */
    public DateComponent firstAmbiguousThrough(DateComponent deepest) {
        for (DateComponent component : DateComponent.values()) {
            if (!isKnown(component)) {
                return component;
            }
            if (component == deepest) {
                break;
            }
        }
        return null;
    }

    /** Earliest calendar day this value could denote, or {@code null} when the year is unknown. */
    public LocalDate earliest() {
        if (year == null) {
            return null;
        }
        return LocalDate.of(year, month != null ? month : 1, day != null ? day : 1);
    }

    /** Latest calendar day this value could denote, or {@code null} when the year is unknown. */
    public LocalDate latest() {
        if (year == null) {
            return null;
        }
        YearMonth yearMonth = YearMonth.of(year, month != null ? month : 12);
        return day != null ? yearMonth.atDay(day) : yearMonth.atEndOfMonth();
    }

    /** ISO-8601 week label such as {@code 2021-W05}; requires a fully known date. */
    public String isoWeekLabel() {
        if (!isFullyKnown()) {
            throw new IllegalStateException("ISO week requires a fully resolved date: " + this);
        }
        LocalDate date = LocalDate.of(year, month, day);
        return String.format(
                Locale.ROOT,
                "%d-W%02d",
                date.get(IsoFields.WEEK_BASED_YEAR),
                date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DateValue that)) {
            return false;
        }
        return Objects.equals(year, that.year) && Objects.equals(month, that.month) && Objects.equals(day, that.day);
    }

    @Override
    public int hashCode() {
        return Objects.hash(year, month, day);
    }

    @Override
    public String toString() {
        return (year != null ? String.format(Locale.ROOT, "%04d", year) : "XXXX")
                + "-"
                + (month != null ? String.format(Locale.ROOT, "%02d", month) : "XX")
                + "-"
                + (day != null ? String.format(Locale.ROOT, "%02d", day) : "XX");
    }
}
