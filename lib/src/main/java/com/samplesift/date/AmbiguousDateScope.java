package com.samplesift.date;

import com.samplesift.config.ConfigurationException;
import java.util.Locale;

/** Which ambiguity the {@code exclude_ambiguous_dates_by} option drops. */
public enum AmbiguousDateScope {
    ANY,
    YEAR,
    MONTH,
    DAY;

    public boolean isAmbiguous(DateValue value) {
        return switch (this) {
            case ANY, DAY -> !value.isKnown(DateComponent.DAY);
            case MONTH -> !value.isKnown(DateComponent.MONTH);
            case YEAR -> !value.isKnown(DateComponent.YEAR);
        };
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AmbiguousDateScope parse(String text) throws ConfigurationException {
        try {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException(
                    "Unknown ambiguous date scope '" + text + "'; expected any, year, month or day", ex);
        }
    }
}
