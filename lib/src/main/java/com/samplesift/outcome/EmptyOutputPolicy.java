package com.samplesift.outcome;

import com.samplesift.config.ConfigurationException;
import java.util.Locale;

/** What to do when every record was dropped. */
public enum EmptyOutputPolicy {
    /** Fail the run with {@link EmptyOutputException}. */
    ERROR,
    /** Log a warning and succeed. */
    WARN,
    /** Succeed quietly. */
    SILENT;

    public static EmptyOutputPolicy parse(String text) throws ConfigurationException {
        try {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException(
                    "Unknown empty output reporting '" + text + "'; expected error, warn or silent", ex);
        }
    }
}
