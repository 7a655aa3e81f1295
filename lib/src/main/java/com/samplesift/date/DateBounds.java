package com.samplesift.date;

import com.samplesift.config.ConfigurationException;
import java.time.LocalDate;
import java.time.Year;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;

/**
 * Parses the {@code min_date}/{@code max_date} options. A partial lower bound is widened to its
 * first day and a partial upper bound to its last day, so {@code --max-date 2020} keeps all of 2020.
 */
public final class DateBounds {

    private DateBounds() {}

    public static LocalDate parseLower(String text) throws ConfigurationException {
        return parse(text, true);
    }

    public static LocalDate parseUpper(String text) throws ConfigurationException {
        return parse(text, false);
    }

    private static LocalDate parse(String text, boolean lower) throws ConfigurationException {
        if (text == null || text.isBlank()) {
            return null;
        }
        String trimmed = text.trim();
        try {
            switch (trimmed.length()) {
                case 4 -> {
                    Year year = Year.parse(trimmed);
                    return lower ? year.atDay(1) : year.atMonth(12).atEndOfMonth();
                }
                case 7 -> {
                    YearMonth month = YearMonth.parse(trimmed);
                    return lower ? month.atDay(1) : month.atEndOfMonth();
                }
                default -> {
                    return LocalDate.parse(trimmed);
                }
            }
        } catch (DateTimeParseException ex) {
            throw new ConfigurationException(
                    "Invalid " + (lower ? "minimum" : "maximum") + " date '" + text + "'; expected YYYY, YYYY-MM or YYYY-MM-DD",
                    ex);
        }
    }
}
