package com.samplesift.allocation;

import com.samplesift.group.GroupKey;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Immutable per-group quotas, iterated in group first-seen order. */
public final class Allocation {

    public enum Mode {
        /** {@code quota = min(population, C)} for a configured per-group count. */
        PER_GROUP,
        /** Integer split of a total: {@code floor(T/g)} each, one extra for {@code T mod g} groups. */
        EVEN_SPLIT,
        /** Stochastic rounding of the fractional per-group target {@code T/g}. */
        PROBABILISTIC
    }

    private final Mode mode;
    private final Map<GroupKey, Long> quotas;
    private final double perGroupTarget;
    private final int attempts;

    Allocation(Mode mode, Map<GroupKey, Long> quotas, double perGroupTarget, int attempts) {
        this.mode = mode;
        this.quotas = Collections.unmodifiableMap(new LinkedHashMap<>(quotas));
        this.perGroupTarget = perGroupTarget;
        this.attempts = attempts;
    }

    public Mode getMode() {
        return mode;
    }

    public Map<GroupKey, Long> getQuotas() {
        return quotas;
    }

    /** Quota of {@code key}; zero for groups the allocation does not know. */
    public long getQuota(GroupKey key) {
        Long quota = quotas.get(key);
        return quota == null ? 0L : quota;
    }

    public long getTotal() {
        long total = 0;
        for (long quota : quotas.values()) {
            total += quota;
        }
        return total;
    }

    /** Requested records per group before capping: {@code C}, or {@code T/g} for total modes. */
    public double getPerGroupTarget() {
        return perGroupTarget;
    }

    /** Number of probabilistic draws made; 0 for the deterministic modes. */
    public int getAttempts() {
        return attempts;
    }

    public boolean isProbabilistic() {
        return mode == Mode.PROBABILISTIC;
    }
}
