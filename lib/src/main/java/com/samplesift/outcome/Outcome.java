package com.samplesift.outcome;

import com.samplesift.allocation.Allocation;
import com.samplesift.group.GroupKey;
import com.samplesift.predicate.DropReason;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable summary of one filtering run: kept identifiers in input order, drop counts by reason
 * and per-group statistics.
 */
public final class Outcome {
    private final long totalInput;
    private final List<String> keptIds;
    private final Map<DropReason, Long> dropCounts;
    private final long forceIncludedCount;
    private final Map<GroupKey, GroupStats> groupStats;
    private final long seed;
    private final Allocation allocation;

    Outcome(
            long totalInput,
            List<String> keptIds,
            EnumMap<DropReason, Long> dropCounts,
            long forceIncludedCount,
            Map<GroupKey, GroupStats> groupStats,
            long seed,
            Allocation allocation) {
        this.totalInput = totalInput;
        this.keptIds = List.copyOf(keptIds);
        this.dropCounts = Collections.unmodifiableMap(new EnumMap<>(dropCounts));
        this.forceIncludedCount = forceIncludedCount;
        this.groupStats = Collections.unmodifiableMap(new LinkedHashMap<>(groupStats));
        this.seed = seed;
        this.allocation = allocation;
    }

    public long getTotalInput() {
        return totalInput;
    }

    /** Kept identifiers, force-included ones included, in input order. */
    public List<String> getKeptIds() {
        return keptIds;
    }

    public long getKeptCount() {
        return keptIds.size();
    }

    public boolean isEmpty() {
        return keptIds.isEmpty();
    }

    /** Non-zero drop counts in reason order. */
    public Map<DropReason, Long> getDropCounts() {
        return dropCounts;
    }

    public long getDropCount(DropReason reason) {
        return dropCounts.getOrDefault(reason, 0L);
    }

    public long getTotalDropped() {
        long total = 0;
        for (long count : dropCounts.values()) {
            total += count;
        }
        return total;
    }

    public long getForceIncludedCount() {
        return forceIncludedCount;
    }

    /** Per-group statistics in first-seen order; empty when the run did not subsample. */
    public Map<GroupKey, GroupStats> getGroupStats() {
        return groupStats;
    }

    /** The seed used for allocation and default priorities. */
    public long getSeed() {
        return seed;
    }

    /** Quotas of the run, or {@code null} when it did not subsample. */
    public Allocation getAllocation() {
        return allocation;
    }
}
