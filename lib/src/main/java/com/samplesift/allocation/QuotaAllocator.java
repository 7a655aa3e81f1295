package com.samplesift.allocation;

import com.samplesift.group.GroupKey;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.SplittableRandom;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns group populations into per-group quotas.
 *
 * <p>With a target total {@code T} over {@code g} groups the allocator first tries the integer
 * split: {@code base = floor(T/g)} for every group plus one extra for the first {@code T mod g}
 * groups (first-seen order) that can supply it. That split is used when {@code base >= 1} and
 * every group holds at least {@code base} records. Otherwise each group's quota is drawn by
 * stochastic rounding of {@code T/g}: round up with probability equal to its fractional part, then
 * cap at the population. A draw that selects nothing is repeated with the same random stream, up
 * to the configured attempt ceiling.</p>
 *
 * <p>All draws come from one {@link SplittableRandom} seeded per call and consumed in group
 * first-seen order, so identical (seed, populations) inputs always give identical quotas.
 * Callers must therefore pass populations in an insertion-ordered map.</p>
 */
public final class QuotaAllocator {

    private static final Logger LOGGER = Logger.getLogger(QuotaAllocator.class.getName());

    private final long seed;
    private final int maxAttempts;
    private final boolean probabilisticAllowed;

    public QuotaAllocator(long seed, int maxAttempts, boolean probabilisticAllowed) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.seed = seed;
        this.maxAttempts = maxAttempts;
        this.probabilisticAllowed = probabilisticAllowed;
    }

    /** Exact mode: {@code min(population, perGroup)} for each group. No randomness. */
    public static Allocation perGroup(long perGroup, Map<GroupKey, Long> populations) {
        Map<GroupKey, Long> quotas = new LinkedHashMap<>();
        for (Map.Entry<GroupKey, Long> entry : populations.entrySet()) {
            quotas.put(entry.getKey(), Math.min(entry.getValue(), perGroup));
        }
        return new Allocation(Allocation.Mode.PER_GROUP, quotas, perGroup, 0);
    }

    /** Target-total mode. */
    public Allocation forTotal(long total, Map<GroupKey, Long> populations) throws AllocationExhaustedException {
        if (total < 1) {
            throw new IllegalArgumentException("total must be at least 1");
        }
        int groups = populations.size();
        if (groups == 0) {
            return new Allocation(Allocation.Mode.EVEN_SPLIT, Map.of(), 0.0, 0);
        }
        long base = total / groups;
        long remainder = total % groups;
        double target = (double) total / groups;

        boolean everyGroupSuppliesBase = true;
        for (long population : populations.values()) {
            if (population < base) {
                everyGroupSuppliesBase = false;
                break;
            }
        }
        if (base >= 1 && (everyGroupSuppliesBase || !probabilisticAllowed)) {
            Allocation allocation = evenSplit(populations, base, remainder, target);
            LOGGER.log(Level.INFO, "Sampling at {0} per group.", base);
            return allocation;
        }
        if (!probabilisticAllowed) {
            throw new AllocationExhaustedException(
                    String.format(
                            Locale.ROOT,
                            "Asked to provide at most %d records, but there are %d groups. "
                                    + "Enable probabilistic sampling or request fewer groups.",
                            total,
                            groups),
                    0);
        }
        return probabilistic(populations, target, total);
    }

    private static Allocation evenSplit(Map<GroupKey, Long> populations, long base, long remainder, double target) {
        Map<GroupKey, Long> quotas = new LinkedHashMap<>();
        long extrasLeft = remainder;
        for (Map.Entry<GroupKey, Long> entry : populations.entrySet()) {
            long population = entry.getValue();
            long quota = Math.min(population, base);
            if (extrasLeft > 0 && population > base) {
                quota++;
                extrasLeft--;
            }
            quotas.put(entry.getKey(), quota);
        }
        return new Allocation(Allocation.Mode.EVEN_SPLIT, quotas, target, 0);
    }

    private Allocation probabilistic(Map<GroupKey, Long> populations, double target, long total)
            throws AllocationExhaustedException {
        SplittableRandom random = new SplittableRandom(seed);
        long whole = (long) Math.floor(target);
        double fraction = target - whole;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Map<GroupKey, Long> quotas = new LinkedHashMap<>();
            long sum = 0;
            for (Map.Entry<GroupKey, Long> entry : populations.entrySet()) {
                long quota = whole + (random.nextDouble() < fraction ? 1 : 0);
                quota = Math.min(quota, entry.getValue());
                quotas.put(entry.getKey(), quota);
                sum += quota;
            }
            LOGGER.log(Level.FINE, "Probabilistic allocation attempt {0} selected {1} records", new Object[] {attempt, sum});
            if (sum > 0) {
                LOGGER.info(String.format(
                        Locale.ROOT,
                        "Sampling probabilistically at %.4f records per group, meaning it is possible to have more "
                                + "than the requested maximum of %d records after filtering.",
                        target,
                        total));
                return new Allocation(Allocation.Mode.PROBABILISTIC, quotas, target, attempt);
            }
        }
        throw new AllocationExhaustedException(
                String.format(
                        Locale.ROOT,
                        "Subsampling produced no output: %d probabilistic draws at %.4f records per group "
                                + "all selected zero records",
                        maxAttempts,
                        target),
                maxAttempts);
    }
}
