package com.samplesift.outcome;

import com.samplesift.allocation.Allocation;
import com.samplesift.group.GroupKey;
import com.samplesift.predicate.DropReason;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Collects classification events of a single run and produces the immutable {@link Outcome}.
 *
 * <p>Each record must be reported once: as dropped, force-included or kept. {@link #finish}
 * checks that drops plus kept records account for every input record and freezes the
 * aggregator.</p>
 */
public final class OutcomeAggregator {

    private final OutcomeListener listener;
    private final EnumMap<DropReason, Long> dropCounts = new EnumMap<>(DropReason.class);
    private final Map<GroupKey, GroupTally> groups = new LinkedHashMap<>();
    private final TreeMap<Long, String> kept = new TreeMap<>();
    private long totalInput;
    private long forceIncluded;
    private boolean finished;

    public OutcomeAggregator(OutcomeListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    public void recordSeen() {
        checkOpen();
        totalInput++;
    }

    public void recordDropped(String id, DropReason reason, String detail) {
        checkOpen();
        dropCounts.merge(reason, 1L, Long::sum);
        listener.onDropped(id, reason, detail);
    }

    /**
     * @param key the record's group when it could be resolved, otherwise {@code null}; only used
     *     for group statistics.
     */
    public void recordForceIncluded(String id, long ordinal, String detail, GroupKey key) {
        checkOpen();
        forceIncluded++;
        kept.put(ordinal, id);
        if (key != null) {
            tally(key).forceIncluded++;
        }
        listener.onForceIncluded(id, detail);
    }

    /** Counts a record that entered {@code key}'s population. */
    public void recordGrouped(GroupKey key) {
        checkOpen();
        tally(key).population++;
    }

    public void recordKept(String id, long ordinal, GroupKey key) {
        checkOpen();
        kept.put(ordinal, id);
        tally(key).kept++;
    }

    public long getTotalInput() {
        return totalInput;
    }

    /** Group populations so far, first-seen order. */
    public Map<GroupKey, Long> getPopulations() {
        Map<GroupKey, Long> populations = new LinkedHashMap<>();
        for (Map.Entry<GroupKey, GroupTally> entry : groups.entrySet()) {
            if (entry.getValue().population > 0) {
                populations.put(entry.getKey(), entry.getValue().population);
            }
        }
        return populations;
    }

    /**
     * Freezes the aggregator.
     *
     * @param allocation quotas used for selection, or {@code null} when the run did not subsample.
     * @throws IllegalStateException if the recorded events do not account for every input record.
     */
    public Outcome finish(long seed, Allocation allocation) {
        checkOpen();
        finished = true;
        long dropped = 0;
        for (long count : dropCounts.values()) {
            dropped += count;
        }
        if (dropped + kept.size() != totalInput) {
            throw new IllegalStateException(
                    "Outcome does not balance: " + dropped + " dropped + " + kept.size() + " kept != "
                            + totalInput + " input records");
        }
        Map<GroupKey, GroupStats> stats = new LinkedHashMap<>();
        if (allocation != null) {
            for (Map.Entry<GroupKey, GroupTally> entry : groups.entrySet()) {
                GroupTally tally = entry.getValue();
                stats.put(
                        entry.getKey(),
                        new GroupStats(
                                entry.getKey(),
                                tally.population,
                                allocation.getQuota(entry.getKey()),
                                tally.kept,
                                tally.forceIncluded));
            }
        }
        List<String> keptIds = new ArrayList<>(kept.values());
        return new Outcome(totalInput, keptIds, dropCounts, forceIncluded, stats, seed, allocation);
    }

    private GroupTally tally(GroupKey key) {
        return groups.computeIfAbsent(key, k -> new GroupTally());
    }

    private void checkOpen() {
        if (finished) {
            throw new IllegalStateException("Outcome already finalized");
        }
    }

    private static final class GroupTally {
        private long population;
        private long kept;
        private long forceIncluded;
    }
}
