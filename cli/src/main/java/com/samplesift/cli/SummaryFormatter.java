package com.samplesift.cli;

import com.samplesift.config.FilterConfig;
import com.samplesift.outcome.Outcome;
import com.samplesift.predicate.DropReason;
import com.samplesift.predicate.WhereCondition;
import com.samplesift.quality.QualityThreshold;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Renders the end-of-run report printed to standard output. */
final class SummaryFormatter {

    private final FilterConfig config;
    private final List<Path> excludeFiles;
    private final List<Path> includeFiles;
    private final boolean excludeIdsGiven;
    private final boolean forceIncludeIdsGiven;

    /**
     * @param excludeIdsGiven whether identifiers were excluded directly, besides any files.
     * @param forceIncludeIdsGiven whether identifiers were force-included directly, besides any
     *     files.
     */
    SummaryFormatter(
            FilterConfig config,
            List<Path> excludeFiles,
            List<Path> includeFiles,
            boolean excludeIdsGiven,
            boolean forceIncludeIdsGiven) {
        this.config = Objects.requireNonNull(config, "config");
        this.excludeFiles = List.copyOf(excludeFiles);
        this.includeFiles = List.copyOf(includeFiles);
        this.excludeIdsGiven = excludeIdsGiven;
        this.forceIncludeIdsGiven = forceIncludeIdsGiven;
    }

    /**
     * @param withoutMetadata sequence index entries that matched no metadata row; they count as
     *     dropped.
     */
    String format(Outcome outcome, long withoutMetadata) {
        StringBuilder report = new StringBuilder();
        long dropped = outcome.getTotalDropped() + withoutMetadata;
        line(report, "", "{count} strains were dropped during filtering", dropped);
        if (withoutMetadata > 0) {
            line(report, "\t", "{count} had no metadata", withoutMetadata);
        }
        for (Map.Entry<DropReason, Long> entry : outcome.getDropCounts().entrySet()) {
            if (entry.getKey() != DropReason.SUBSAMPLING) {
                line(report, "\t", template(entry.getKey()), entry.getValue());
            }
        }
        if (outcome.getForceIncludedCount() > 0) {
            line(report, "\t", forceIncludeTemplate(), outcome.getForceIncludedCount());
        }
        if (config.isSubsampling()) {
            line(report, "\t", "{count} of these were dropped because of subsampling criteria, using seed "
                    + outcome.getSeed(), outcome.getDropCount(DropReason.SUBSAMPLING));
        }
        line(report, "", "{count} strains passed all filters", outcome.getKeptCount());
        return report.toString();
    }

    private String template(DropReason reason) {
        return switch (reason) {
            case MALFORMED_RECORD -> "{count} of these were dropped because their metadata row could not be parsed";
            case MALFORMED_DATE -> "{count} of these were dropped because their date could not be parsed";
            case EXCLUDE_ALL -> "{count} of these were dropped by `--exclude-all`";
            case EXCLUDED_ID -> "{count} of these were dropped because they were in " + describeExclusions();
            case EXCLUDE_WHERE -> "{count} of these were dropped because of '" + joinConditions(config.getExcludeWhere()) + "'";
            case INCLUSION_MISMATCH -> "{count} of these were dropped because they were not in the inclusion list";
            case AMBIGUOUS_DATE -> "{count} of these were dropped because of their ambiguous date in "
                    + config.getExcludeAmbiguousDatesBy().label();
            case DATE_BOUNDS -> "{count} of these were dropped because they were " + describeBounds() + " or missing a date";
            case QUERY -> "{count} of these were filtered out by the query: \"" + config.getQueryExpression() + "\"";
            case MISSING_SEQUENCE -> "{count} had no sequence data";
            case QUALITY -> "{count} of these were dropped because they failed sequence quality thresholds ("
                    + describeThresholds() + ")";
            case GROUPING_AMBIGUOUS_YEAR -> "{count} were dropped during grouping due to ambiguous year information";
            case GROUPING_AMBIGUOUS_MONTH -> "{count} were dropped during grouping due to ambiguous month information";
            case GROUPING_AMBIGUOUS_DAY -> "{count} were dropped during grouping due to ambiguous day information";
            case SUBSAMPLING -> "{count} of these were dropped because of subsampling criteria";
        };
    }

    private String forceIncludeTemplate() {
        List<String> sources = new ArrayList<>();
        if (!includeFiles.isEmpty()) {
            sources.add("they were in " + describe(includeFiles, ""));
        }
        if (forceIncludeIdsGiven || (includeFiles.isEmpty() && !config.getForceIncludeIds().isEmpty())) {
            sources.add("they were in the force-include list");
        }
        if (!config.getForceIncludeWhere().isEmpty()) {
            sources.add("of '" + joinConditions(config.getForceIncludeWhere()) + "'");
        }
        return "{count} strains were added back because " + String.join(" or because ", sources);
    }

    private String describeExclusions() {
        if (excludeFiles.isEmpty()) {
            return "the exclusion list";
        }
        return excludeIdsGiven ? describe(excludeFiles, "") + " or the exclusion list" : describe(excludeFiles, "");
    }

    private String describeBounds() {
        List<String> parts = new ArrayList<>();
        if (config.getMinDate() != null) {
            parts.add("earlier than " + config.getMinDate());
        }
        if (config.getMaxDate() != null) {
            parts.add("later than " + config.getMaxDate());
        }
        return String.join(" or ", parts);
    }

    private String describeThresholds() {
        List<String> parts = new ArrayList<>();
        for (Map.Entry<QualityThreshold, Long> entry : config.getQualityThresholds().entrySet()) {
            parts.add(entry.getKey().getKey() + "=" + entry.getValue());
        }
        return String.join(", ", parts);
    }

    private static String describe(List<Path> files, String fallback) {
        if (files.isEmpty()) {
            return fallback;
        }
        List<String> names = new ArrayList<>();
        for (Path file : files) {
            names.add(file.toString());
        }
        return String.join(", ", names);
    }

    private static String joinConditions(List<WhereCondition> conditions) {
        List<String> parts = new ArrayList<>();
        for (WhereCondition condition : conditions) {
            parts.add(condition.toString());
        }
        return String.join("', '", parts);
    }

    private static void line(StringBuilder report, String indent, String template, long count) {
        report.append(indent).append(template.replace("{count}", Long.toString(count))).append('\n');
    }
}
