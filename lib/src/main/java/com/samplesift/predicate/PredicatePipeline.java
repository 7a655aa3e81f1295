package com.samplesift.predicate;

import com.samplesift.config.ConfigurationException;
import com.samplesift.config.FilterConfig;
import com.samplesift.quality.SequenceStatistics;
import com.samplesift.query.QueryEvaluator;
import com.samplesift.record.Record;
import com.samplesift.record.RecordContext;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Runs records through an ordered list of {@link RecordPredicate}s and stops at the first
 * non-pass decision, so each record is attributed to exactly one reason.
 *
 * <p>{@link #fromConfig} wires the stages in this fixed order:</p>
 * <ol>
 *   <li>unparseable rows</li>
 *   <li>force-include by identifier, then by {@code force_include_where}</li>
 *   <li>malformed date (only when a date is consulted)</li>
 *   <li>{@code exclude_all}</li>
 *   <li>exclusion by identifier</li>
 *   <li>{@code exclude_where}</li>
 *   <li>inclusion allow-list</li>
 *   <li>ambiguous-date exclusion</li>
 *   <li>{@code min_date}/{@code max_date}</li>
 *   <li>query expression</li>
 *   <li>missing sequence data</li>
 *   <li>quality thresholds</li>
 * </ol>
 * Force-inclusion runs first so that an identifier on both the exclusion and force-include lists
 * is kept.
 */
public final class PredicatePipeline {

    private final List<RecordPredicate> predicates;

    public PredicatePipeline(List<RecordPredicate> predicates) {
        this.predicates = List.copyOf(Objects.requireNonNull(predicates, "predicates"));
    }

    /**
     * Builds the standard pipeline for {@code config}, validating column references against the
     * input header.
     *
     * @param sequences sequence statistics, or {@code null} when no sequence index was supplied.
     */
    public static PredicatePipeline fromConfig(
            FilterConfig config,
            List<String> columns,
            QueryEvaluator queryEvaluator,
            SequenceStatistics sequences,
            boolean datesConsulted)
            throws ConfigurationException {
        Objects.requireNonNull(config, "config");
        Set<String> known = new HashSet<>(columns);
        List<RecordPredicate> stages = new ArrayList<>();
        stages.add(new MalformedRecordPredicate());

        for (WhereCondition condition : config.getForceIncludeWhere()) {
            requireColumn(known, condition.getColumn(), "force_include_where");
        }
        if (!config.getForceIncludeIds().isEmpty() || !config.getForceIncludeWhere().isEmpty()) {
            stages.add(new ForceIncludePredicate(config.getForceIncludeIds(), config.getForceIncludeWhere()));
        }
        if (datesConsulted) {
            requireColumn(known, config.getDateColumn(), "date");
            stages.add(new MalformedDatePredicate());
        }
        if (config.isExcludeAll()) {
            stages.add(new ExcludeAllPredicate());
        }
        if (!config.getExcludeIds().isEmpty()) {
            stages.add(new ExcludedIdPredicate(config.getExcludeIds()));
        }
        if (!config.getExcludeWhere().isEmpty()) {
            for (WhereCondition condition : config.getExcludeWhere()) {
                requireColumn(known, condition.getColumn(), "exclude_where");
            }
            stages.add(new ExcludeWherePredicate(config.getExcludeWhere()));
        }
        if (config.getIncludeIds() != null) {
            stages.add(new InclusionPredicate(config.getIncludeIds()));
        }
        if (config.getExcludeAmbiguousDatesBy() != null) {
            stages.add(new AmbiguousDatePredicate(config.getExcludeAmbiguousDatesBy()));
        }
        if (config.getMinDate() != null || config.getMaxDate() != null) {
            stages.add(new DateBoundsPredicate(config.getMinDate(), config.getMaxDate()));
        }
        if (config.getQueryExpression() != null) {
            if (queryEvaluator == null) {
                throw new ConfigurationException("A query expression was given but no query evaluator is available");
            }
            Predicate<Record> query = queryEvaluator.compile(config.getQueryExpression(), columns);
            stages.add(new QueryPredicate(query, config.getQueryExpression()));
        }
        if (sequences != null) {
            stages.add(new MissingSequencePredicate(sequences));
        }
        if (!config.getQualityThresholds().isEmpty()) {
            if (sequences == null) {
                throw new ConfigurationException("Quality thresholds require a sequence index");
            }
            stages.add(new QualityThresholdPredicate(sequences, config.getQualityThresholds()));
        }
        return new PredicatePipeline(stages);
    }

    /** Whether {@code config} makes any stage or grouping column read the date cell. */
    public static boolean consultsDates(FilterConfig config, boolean groupingByDate) {
        return groupingByDate
                || config.getMinDate() != null
                || config.getMaxDate() != null
                || config.getExcludeAmbiguousDatesBy() != null;
    }

    /**
     * Evaluate all stages in order.
     *
     * @return the first force-include or drop decision, or {@link Decision#pass()}.
     */
    public Decision evaluate(RecordContext context) {
        for (RecordPredicate predicate : predicates) {
            Decision decision = predicate.evaluate(context);
            if (!decision.isPass()) {
                return decision;
            }
        }
        return Decision.pass();
    }

    public List<RecordPredicate> getPredicates() {
        return predicates;
    }

    private static void requireColumn(Set<String> known, String column, String option) throws ConfigurationException {
        if (!known.contains(column)) {
            throw new ConfigurationException(option + " references unknown column '" + column + "'");
        }
    }
}
