package com.samplesift.quality;

import com.samplesift.config.ConfigurationException;
import java.util.Locale;

/** Data-quality checks recognized in the {@code quality_thresholds} mapping. */
public enum QualityThreshold {
    /** Minimum number of valid nucleotides (A, C, G, T). */
    MIN_LENGTH("min_length"),
    /** Maximum number of characters that are not valid nucleotide codes. */
    MAX_INVALID("max_invalid"),
    /** Maximum number of {@code N} characters. */
    MAX_N("max_n");

    private final String key;

    QualityThreshold(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public boolean passes(SequenceStats stats, long bound) {
        return switch (this) {
            case MIN_LENGTH -> stats.getValidNucleotides() >= bound;
            case MAX_INVALID -> stats.getInvalidCharacters() <= bound;
            case MAX_N -> stats.getAmbiguousN() <= bound;
        };
    }

    public static QualityThreshold fromKey(String key) throws ConfigurationException {
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (QualityThreshold threshold : values()) {
            if (threshold.key.equals(normalized)) {
                return threshold;
            }
        }
        throw new ConfigurationException("Unknown quality threshold '" + key + "'");
    }
}
