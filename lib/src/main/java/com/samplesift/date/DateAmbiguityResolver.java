package com.samplesift.date;

import java.time.YearMonth;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies the components of a date cell as known or ambiguous.
 *
 * <p>Accepted shapes are {@code YYYY}, {@code YYYY-MM} and {@code YYYY-MM-DD}. A token containing
 * an {@code X} or {@code ?} placeholder is ambiguous, as is any component missing from a shorter
 * shape. Ambiguity propagates to the right: {@code 2021-XX-05} has a known year and an ambiguous
 * month and day. Empty cells resolve to a fully ambiguous value rather than failing.</p>
 */
public final class DateAmbiguityResolver {

    private static final Pattern DATE_PATTERN =
            Pattern.compile("([0-9Xx?]{4})(?:-([0-9Xx?]{2})(?:-([0-9Xx?]{2}))?)?");
    private static final Pattern DIGITS = Pattern.compile("[0-9]+");

    private DateAmbiguityResolver() {}

    public static DateValue resolve(String raw) throws MalformedDateException {
        if (raw == null || raw.isBlank()) {
            return DateValue.UNKNOWN;
        }
        String trimmed = raw.trim();
        Matcher matcher = DATE_PATTERN.matcher(trimmed);
        if (!matcher.matches()) {
            throw new MalformedDateException(raw, "Unrecognized date format: '" + raw + "'");
        }
        Integer year = numeric(matcher.group(1));
        Integer month = numeric(matcher.group(2));
        Integer day = numeric(matcher.group(3));

        if (month != null && (month < 1 || month > 12)) {
            throw new MalformedDateException(raw, "Month out of range in date: '" + raw + "'");
        }
        if (day != null && (day < 1 || day > 31)) {
            throw new MalformedDateException(raw, "Day out of range in date: '" + raw + "'");
        }
        if (year == null) {
            month = null;
        }
        if (month == null) {
            day = null;
        }
        if (day != null && day > YearMonth.of(year, month).lengthOfMonth()) {
            throw new MalformedDateException(raw, "Day out of range in date: '" + raw + "'");
        }
        return new DateValue(year, month, day);
    }

    /** Whether grouping by {@code year} is possible for this date. */
    public static boolean isYearUsable(DateValue value) {
        return value.isKnown(DateComponent.YEAR);
    }

    /** Whether grouping by {@code month} is possible: year and month must both be known. */
    public static boolean isMonthUsable(DateValue value) {
        return value.isKnown(DateComponent.YEAR) && value.isKnown(DateComponent.MONTH);
    }

    /** Whether grouping by ISO {@code week} is possible: every component must be known. */
    public static boolean isWeekUsable(DateValue value) {
        return isMonthUsable(value) && value.isKnown(DateComponent.DAY);
    }

    private static Integer numeric(String token) {
        if (token == null || !DIGITS.matcher(token).matches()) {
            return null;
        }
        return Integer.parseInt(token);
    }
}
