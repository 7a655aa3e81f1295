package com.samplesift.config;

import com.samplesift.date.AmbiguousDateScope;
import com.samplesift.date.DateBounds;
import com.samplesift.outcome.EmptyOutputPolicy;
import com.samplesift.predicate.WhereCondition;
import com.samplesift.quality.QualityThreshold;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable options for one filtering run. Instances are created through {@link Builder}, whose
 * {@link Builder#build()} rejects contradictory combinations before any input is touched.
 */
public final class FilterConfig {

    public static final String DEFAULT_DATE_COLUMN = "date";
    public static final int DEFAULT_MAX_ALLOCATION_ATTEMPTS = 100;

    private final List<String> groupBy;
    private final Long subsampleTotal;
    private final Long subsamplePerGroup;
    private final Long seed;
    private final boolean probabilisticSampling;
    private final int maxAllocationAttempts;
    private final LocalDate minDate;
    private final LocalDate maxDate;
    private final String dateColumn;
    private final Set<String> excludeIds;
    private final Set<String> includeIds;
    private final Set<String> forceIncludeIds;
    private final List<WhereCondition> excludeWhere;
    private final List<WhereCondition> forceIncludeWhere;
    private final boolean excludeAll;
    private final String queryExpression;
    private final Map<QualityThreshold, Long> qualityThresholds;
    private final AmbiguousDateScope excludeAmbiguousDatesBy;
    private final EmptyOutputPolicy emptyOutputPolicy;
    private final boolean cacheDecisions;

    private FilterConfig(Builder builder, LocalDate minDate, LocalDate maxDate) {
        this.groupBy = List.copyOf(builder.groupBy);
        this.subsampleTotal = builder.subsampleTotal;
        this.subsamplePerGroup = builder.subsamplePerGroup;
        this.seed = builder.seed;
        this.probabilisticSampling = builder.probabilisticSampling;
        this.maxAllocationAttempts = builder.maxAllocationAttempts;
        this.minDate = minDate;
        this.maxDate = maxDate;
        this.dateColumn = builder.dateColumn;
        this.excludeIds = Set.copyOf(builder.excludeIds);
        this.includeIds = builder.includeIds == null ? null : Set.copyOf(builder.includeIds);
        this.forceIncludeIds = Set.copyOf(builder.forceIncludeIds);
        this.excludeWhere = List.copyOf(builder.excludeWhere);
        this.forceIncludeWhere = List.copyOf(builder.forceIncludeWhere);
        this.excludeAll = builder.excludeAll;
        this.queryExpression = builder.queryExpression;
        EnumMap<QualityThreshold, Long> thresholds = new EnumMap<>(QualityThreshold.class);
        thresholds.putAll(builder.qualityThresholds);
        this.qualityThresholds = Collections.unmodifiableMap(thresholds);
        this.excludeAmbiguousDatesBy = builder.excludeAmbiguousDatesBy;
        this.emptyOutputPolicy = builder.emptyOutputPolicy;
        this.cacheDecisions = builder.cacheDecisions;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getGroupBy() {
        return groupBy;
    }

    /** Target total output size, or {@code null} when not subsampling to a total. */
    public Long getSubsampleTotal() {
        return subsampleTotal;
    }

    /** Fixed per-group count, or {@code null} when not subsampling per group. */
    public Long getSubsamplePerGroup() {
        return subsamplePerGroup;
    }

    public boolean isSubsampling() {
        return subsampleTotal != null || subsamplePerGroup != null;
    }

    /** Configured seed, or {@code null} for a fresh seed on every run. */
    public Long getSeed() {
        return seed;
    }

    public boolean isProbabilisticSampling() {
        return probabilisticSampling;
    }

    public int getMaxAllocationAttempts() {
        return maxAllocationAttempts;
    }

    public LocalDate getMinDate() {
        return minDate;
    }

    public LocalDate getMaxDate() {
        return maxDate;
    }

    public String getDateColumn() {
        return dateColumn;
    }

    public Set<String> getExcludeIds() {
        return excludeIds;
    }

    /** Allow-list of identifiers, or {@code null} when every identifier is allowed. */
    public Set<String> getIncludeIds() {
        return includeIds;
    }

    public Set<String> getForceIncludeIds() {
        return forceIncludeIds;
    }

    public List<WhereCondition> getExcludeWhere() {
        return excludeWhere;
    }

    public List<WhereCondition> getForceIncludeWhere() {
        return forceIncludeWhere;
    }

    public boolean isExcludeAll() {
        return excludeAll;
    }

    public String getQueryExpression() {
        return queryExpression;
    }

    public Map<QualityThreshold, Long> getQualityThresholds() {
        return qualityThresholds;
    }

    public AmbiguousDateScope getExcludeAmbiguousDatesBy() {
        return excludeAmbiguousDatesBy;
    }

    public EmptyOutputPolicy getEmptyOutputPolicy() {
        return emptyOutputPolicy;
    }

    public boolean isCacheDecisions() {
        return cacheDecisions;
    }

    public static final class Builder {
        private final List<String> groupBy = new ArrayList<>();
        private Long subsampleTotal;
        private Long subsamplePerGroup;
        private Long seed;
        private boolean probabilisticSampling = true;
        private int maxAllocationAttempts = DEFAULT_MAX_ALLOCATION_ATTEMPTS;
        private String minDate;
        private String maxDate;
        private String dateColumn = DEFAULT_DATE_COLUMN;
        private final Set<String> excludeIds = new LinkedHashSet<>();
        private Set<String> includeIds;
        private final Set<String> forceIncludeIds = new LinkedHashSet<>();
        private final List<WhereCondition> excludeWhere = new ArrayList<>();
        private final List<WhereCondition> forceIncludeWhere = new ArrayList<>();
        private boolean excludeAll;
        private String queryExpression;
        private final Map<QualityThreshold, Long> qualityThresholds = new EnumMap<>(QualityThreshold.class);
        private AmbiguousDateScope excludeAmbiguousDatesBy;
        private EmptyOutputPolicy emptyOutputPolicy = EmptyOutputPolicy.ERROR;
        private boolean cacheDecisions = true;

        private Builder() {}

        public Builder groupBy(Collection<String> columns) {
            groupBy.clear();
            for (String column : columns) {
                groupBy.add(Objects.requireNonNull(column, "column").trim());
            }
            return this;
        }

        public Builder groupBy(String... columns) {
            return groupBy(List.of(columns));
        }

        public Builder subsampleTotal(Long total) {
            this.subsampleTotal = total;
            return this;
        }

        public Builder subsamplePerGroup(Long perGroup) {
            this.subsamplePerGroup = perGroup;
            return this;
        }

        public Builder seed(Long seed) {
            this.seed = seed;
            return this;
        }

        public Builder probabilisticSampling(boolean enabled) {
            this.probabilisticSampling = enabled;
            return this;
        }

        public Builder maxAllocationAttempts(int attempts) {
            this.maxAllocationAttempts = attempts;
            return this;
        }

        public Builder minDate(String minDate) {
            this.minDate = minDate;
            return this;
        }

        public Builder maxDate(String maxDate) {
            this.maxDate = maxDate;
            return this;
        }

        public Builder dateColumn(String dateColumn) {
            this.dateColumn = Objects.requireNonNull(dateColumn, "dateColumn");
            return this;
        }

        public Builder excludeIds(Collection<String> ids) {
            excludeIds.addAll(ids);
            return this;
        }

        public Builder includeIds(Collection<String> ids) {
            if (includeIds == null) {
                includeIds = new LinkedHashSet<>();
            }
            includeIds.addAll(ids);
            return this;
        }

        public Builder forceIncludeIds(Collection<String> ids) {
            forceIncludeIds.addAll(ids);
            return this;
        }

        public Builder excludeWhere(WhereCondition condition) {
            excludeWhere.add(Objects.requireNonNull(condition, "condition"));
            return this;
        }

        public Builder forceIncludeWhere(WhereCondition condition) {
            forceIncludeWhere.add(Objects.requireNonNull(condition, "condition"));
            return this;
        }

        public Builder excludeAll(boolean excludeAll) {
            this.excludeAll = excludeAll;
            return this;
        }

        public Builder queryExpression(String expression) {
            this.queryExpression = expression == null || expression.isBlank() ? null : expression;
            return this;
        }

        public Builder qualityThreshold(QualityThreshold threshold, long bound) {
            qualityThresholds.put(Objects.requireNonNull(threshold, "threshold"), bound);
            return this;
        }

        public Builder excludeAmbiguousDatesBy(AmbiguousDateScope scope) {
            this.excludeAmbiguousDatesBy = scope;
            return this;
        }

        public Builder emptyOutputPolicy(EmptyOutputPolicy policy) {
            this.emptyOutputPolicy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public Builder cacheDecisions(boolean cacheDecisions) {
            this.cacheDecisions = cacheDecisions;
            return this;
        }

        public FilterConfig build() throws ConfigurationException {
            if (subsampleTotal != null && subsamplePerGroup != null) {
                throw new ConfigurationException(
                        "subsample_total and subsample_per_group are mutually exclusive");
            }
            if (subsampleTotal != null && subsampleTotal < 1) {
                throw new ConfigurationException("subsample_total must be at least 1, got " + subsampleTotal);
            }
            if (subsamplePerGroup != null && subsamplePerGroup < 1) {
                throw new ConfigurationException(
                        "subsample_per_group must be at least 1, got " + subsamplePerGroup);
            }
            if (subsamplePerGroup != null && groupBy.isEmpty()) {
                throw new ConfigurationException("subsample_per_group requires at least one group_by column");
            }
            if (!groupBy.isEmpty() && subsampleTotal == null && subsamplePerGroup == null) {
                throw new ConfigurationException(
                        "group_by requires either subsample_total or subsample_per_group");
            }
            Set<String> distinct = new LinkedHashSet<>();
            for (String column : groupBy) {
                if (column.isEmpty()) {
                    throw new ConfigurationException("group_by contains an empty column name");
                }
                if (!distinct.add(column)) {
                    throw new ConfigurationException("group_by lists column '" + column + "' more than once");
                }
            }
            if (distinct.contains("week") && (distinct.contains("year") || distinct.contains("month"))) {
                throw new ConfigurationException(
                        "group_by 'week' cannot be combined with 'year' or 'month'; ISO weeks carry their own year");
            }
            if (maxAllocationAttempts < 1) {
                throw new ConfigurationException("max allocation attempts must be at least 1");
            }
            for (Map.Entry<QualityThreshold, Long> entry : qualityThresholds.entrySet()) {
                if (entry.getValue() < 0) {
                    throw new ConfigurationException(
                            "Quality threshold " + entry.getKey().getKey() + " must not be negative");
                }
            }
            if (dateColumn.isBlank()) {
                throw new ConfigurationException("date column name must not be blank");
            }
            LocalDate min = DateBounds.parseLower(minDate);
            LocalDate max = DateBounds.parseUpper(maxDate);
            if (min != null && max != null && min.isAfter(max)) {
                throw new ConfigurationException("min_date " + min + " is after max_date " + max);
            }
            return new FilterConfig(this, min, max);
        }
    }
}
