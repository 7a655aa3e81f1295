package com.samplesift.config;

import com.samplesift.date.AmbiguousDateScope;
import com.samplesift.outcome.EmptyOutputPolicy;
import com.samplesift.predicate.WhereCondition;
import com.samplesift.quality.QualityThreshold;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/**
 * Reads filter options from {@link Properties} whose keys are the snake_case option names, for
 * example {@code group_by=country year} or {@code exclude_where=region=asia;host!=human}.
 *
 * <p>List values are split on commas and whitespace; {@code exclude_where} and
 * {@code include_where} conditions are separated by semicolons since a condition may contain
 * spaces.</p>
 */
public final class FilterConfigProperties {

    public static final String GROUP_BY = "group_by";
    public static final String SUBSAMPLE_MAX_SEQUENCES = "subsample_max_sequences";
    public static final String SEQUENCES_PER_GROUP = "sequences_per_group";
    public static final String SUBSAMPLE_SEED = "subsample_seed";
    public static final String PROBABILISTIC_SAMPLING = "probabilistic_sampling";
    public static final String MAX_ALLOCATION_ATTEMPTS = "max_allocation_attempts";
    public static final String MIN_DATE = "min_date";
    public static final String MAX_DATE = "max_date";
    public static final String DATE_COLUMN = "date_column";
    public static final String EXCLUDE_IDS = "exclude_ids";
    public static final String INCLUDE_IDS = "include_ids";
    public static final String FORCE_INCLUDE_IDS = "force_include_ids";
    public static final String EXCLUDE_WHERE = "exclude_where";
    public static final String FORCE_INCLUDE_WHERE = "include_where";
    public static final String EXCLUDE_ALL = "exclude_all";
    public static final String QUERY = "query";
    public static final String EXCLUDE_AMBIGUOUS_DATES_BY = "exclude_ambiguous_dates_by";
    public static final String EMPTY_OUTPUT_REPORTING = "empty_output_reporting";
    public static final String CACHE_DECISIONS = "cache_decisions";

    /** Every key this class understands. */
    public static final Set<String> KEYS = Set.of(
            GROUP_BY,
            SUBSAMPLE_MAX_SEQUENCES,
            SEQUENCES_PER_GROUP,
            SUBSAMPLE_SEED,
            PROBABILISTIC_SAMPLING,
            MAX_ALLOCATION_ATTEMPTS,
            MIN_DATE,
            MAX_DATE,
            DATE_COLUMN,
            EXCLUDE_IDS,
            INCLUDE_IDS,
            FORCE_INCLUDE_IDS,
            EXCLUDE_WHERE,
            FORCE_INCLUDE_WHERE,
            EXCLUDE_ALL,
            QUERY,
            EXCLUDE_AMBIGUOUS_DATES_BY,
            EMPTY_OUTPUT_REPORTING,
            CACHE_DECISIONS,
            QualityThreshold.MIN_LENGTH.getKey(),
            QualityThreshold.MAX_INVALID.getKey(),
            QualityThreshold.MAX_N.getKey());

    private FilterConfigProperties() {}

    /** Applies every recognized key of {@code properties} to {@code builder}. */
    public static FilterConfig.Builder apply(Properties properties, FilterConfig.Builder builder)
            throws ConfigurationException {
        String value;
        if ((value = get(properties, GROUP_BY)) != null) {
            builder.groupBy(splitList(value));
        }
        if ((value = get(properties, SUBSAMPLE_MAX_SEQUENCES)) != null) {
            builder.subsampleTotal(parseLong(SUBSAMPLE_MAX_SEQUENCES, value));
        }
        if ((value = get(properties, SEQUENCES_PER_GROUP)) != null) {
            builder.subsamplePerGroup(parseLong(SEQUENCES_PER_GROUP, value));
        }
        if ((value = get(properties, SUBSAMPLE_SEED)) != null) {
            builder.seed(parseLong(SUBSAMPLE_SEED, value));
        }
        if ((value = get(properties, PROBABILISTIC_SAMPLING)) != null) {
            builder.probabilisticSampling(parseBoolean(PROBABILISTIC_SAMPLING, value));
        }
        if ((value = get(properties, MAX_ALLOCATION_ATTEMPTS)) != null) {
            long attempts = parseLong(MAX_ALLOCATION_ATTEMPTS, value);
            if (attempts > Integer.MAX_VALUE) {
                throw new ConfigurationException(MAX_ALLOCATION_ATTEMPTS + " is too large: " + attempts);
            }
            builder.maxAllocationAttempts((int) attempts);
        }
        if ((value = get(properties, MIN_DATE)) != null) {
            builder.minDate(value);
        }
        if ((value = get(properties, MAX_DATE)) != null) {
            builder.maxDate(value);
        }
        if ((value = get(properties, DATE_COLUMN)) != null) {
            builder.dateColumn(value);
        }
        if ((value = get(properties, EXCLUDE_IDS)) != null) {
            builder.excludeIds(splitList(value));
        }
        if ((value = get(properties, INCLUDE_IDS)) != null) {
            builder.includeIds(splitList(value));
        }
        if ((value = get(properties, FORCE_INCLUDE_IDS)) != null) {
            builder.forceIncludeIds(splitList(value));
        }
        if ((value = get(properties, EXCLUDE_WHERE)) != null) {
            for (String condition : splitConditions(value)) {
                builder.excludeWhere(WhereCondition.parse(condition));
            }
        }
        if ((value = get(properties, FORCE_INCLUDE_WHERE)) != null) {
            for (String condition : splitConditions(value)) {
                builder.forceIncludeWhere(WhereCondition.parse(condition));
            }
        }
        if ((value = get(properties, EXCLUDE_ALL)) != null) {
            builder.excludeAll(parseBoolean(EXCLUDE_ALL, value));
        }
        if ((value = get(properties, QUERY)) != null) {
            builder.queryExpression(value);
        }
        for (QualityThreshold threshold : QualityThreshold.values()) {
            if ((value = get(properties, threshold.getKey())) != null) {
                builder.qualityThreshold(threshold, parseLong(threshold.getKey(), value));
            }
        }
        if ((value = get(properties, EXCLUDE_AMBIGUOUS_DATES_BY)) != null) {
            builder.excludeAmbiguousDatesBy(AmbiguousDateScope.parse(value));
        }
        if ((value = get(properties, EMPTY_OUTPUT_REPORTING)) != null) {
            builder.emptyOutputPolicy(EmptyOutputPolicy.parse(value));
        }
        if ((value = get(properties, CACHE_DECISIONS)) != null) {
            builder.cacheDecisions(parseBoolean(CACHE_DECISIONS, value));
        }
        return builder;
    }

    public static List<String> splitList(String value) {
        List<String> out = new ArrayList<>();
        for (String part : value.split("[,\\s]+")) {
            if (!part.isEmpty()) {
                out.add(part);
            }
        }
        return out;
    }

    private static List<String> splitConditions(String value) {
        List<String> out = new ArrayList<>();
        for (String part : value.split(";")) {
            if (!part.isBlank()) {
                out.add(part.trim());
            }
        }
        return out;
    }

    private static String get(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            return null;
        }
        value = value.trim();
        return value.isEmpty() ? null : value;
    }

    static long parseLong(String key, String value) throws ConfigurationException {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            throw new ConfigurationException(key + " must be an integer, got '" + value + "'", ex);
        }
    }

    static boolean parseBoolean(String key, String value) throws ConfigurationException {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1" -> true;
            case "false", "no", "0" -> false;
            default -> throw new ConfigurationException(key + " must be true or false, got '" + value + "'");
        };
    }
}
