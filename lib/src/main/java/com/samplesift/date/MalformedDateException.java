package com.samplesift.date;

/**
 * Raised when a non-empty date cell does not match {@code YYYY}, {@code YYYY-MM} or
 * {@code YYYY-MM-DD} (placeholders allowed), or names an impossible month or day.
 */
public final class MalformedDateException extends Exception {
    private final String rawValue;

    public MalformedDateException(String rawValue, String message) {
        super(message);
        this.rawValue = rawValue;
    }

    public String getRawValue() {
        return rawValue;
    }
}
