package com.samplesift.io;

import com.samplesift.quality.SequenceStatistics;
import com.samplesift.quality.SequenceStats;
import java.util.Map;
import java.util.Set;

/** In-memory sequence index keyed by identifier. */
public final class SequenceIndex implements SequenceStatistics {
    private final Map<String, SequenceStats> entries;

    SequenceIndex(Map<String, SequenceStats> entries) {
        this.entries = Map.copyOf(entries);
    }

    @Override
    public SequenceStats lookup(String id) {
        return entries.get(id);
    }

    public Set<String> getIds() {
        return entries.keySet();
    }

    public int size() {
        return entries.size();
    }
}
