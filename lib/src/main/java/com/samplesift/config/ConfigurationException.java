package com.samplesift.config;

/**
 * Checked exception for invalid or contradictory filter options. Always raised before the first
 * record is streamed; it is never retryable.
 */
public final class ConfigurationException extends Exception {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
