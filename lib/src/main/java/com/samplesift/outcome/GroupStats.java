package com.samplesift.outcome;

import com.samplesift.group.GroupKey;

/** Final tallies of one group. Population and quota exclude force-included records. */
public final class GroupStats {
    private final GroupKey key;
    private final long population;
    private final long quota;
    private final long kept;
    private final long forceIncluded;

    public GroupStats(GroupKey key, long population, long quota, long kept, long forceIncluded) {
        this.key = key;
        this.population = population;
        this.quota = quota;
        this.kept = kept;
        this.forceIncluded = forceIncluded;
    }

    public GroupKey getKey() {
        return key;
    }

    public long getPopulation() {
        return population;
    }

    public long getQuota() {
        return quota;
    }

    /** Records selected by quota. */
    public long getKept() {
        return kept;
    }

    public long getForceIncluded() {
        return forceIncluded;
    }

    /** Everything this group contributes to the output. */
    public long getTotalKept() {
        return kept + forceIncluded;
    }

    @Override
    public String toString() {
        return key + ": population=" + population + ", quota=" + quota + ", kept=" + kept
                + ", forceIncluded=" + forceIncluded;
    }
}
