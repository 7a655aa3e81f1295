package com.samplesift.predicate;

import com.samplesift.date.DateComponent;

/**
 * Why a record did not reach the output. Every dropped record carries exactly one reason: an
 * unparseable row, the first failing predicate, a grouping ambiguity, or the subsampling quota.
 */
public enum DropReason {
    MALFORMED_RECORD("malformed-record"),
    MALFORMED_DATE("malformed-date"),
    EXCLUDE_ALL("exclude-all"),
    EXCLUDED_ID("exclusion-list"),
    EXCLUDE_WHERE("exclude-where"),
    INCLUSION_MISMATCH("inclusion-mismatch"),
    AMBIGUOUS_DATE("ambiguous-date"),
    DATE_BOUNDS("date-bounds"),
    QUERY("query-predicate"),
    MISSING_SEQUENCE("missing-sequence"),
    QUALITY("quality-threshold"),
    GROUPING_AMBIGUOUS_YEAR("ambiguous-date-for-grouping(year)"),
    GROUPING_AMBIGUOUS_MONTH("ambiguous-date-for-grouping(month)"),
    GROUPING_AMBIGUOUS_DAY("ambiguous-date-for-grouping(day)"),
    SUBSAMPLING("subsampling-quota-exceeded");

    private final String code;

    DropReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isGroupingAmbiguity() {
        return this == GROUPING_AMBIGUOUS_YEAR || this == GROUPING_AMBIGUOUS_MONTH || this == GROUPING_AMBIGUOUS_DAY;
    }

    public static DropReason forGroupingAmbiguity(DateComponent component) {
        return switch (component) {
            case YEAR -> GROUPING_AMBIGUOUS_YEAR;
            case MONTH -> GROUPING_AMBIGUOUS_MONTH;
            case DAY -> GROUPING_AMBIGUOUS_DAY;
        };
    }
}
