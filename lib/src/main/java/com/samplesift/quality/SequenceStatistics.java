package com.samplesift.quality;

/** Lookup of {@link SequenceStats} by record identifier. */
public interface SequenceStatistics {

    /**
     * @return the statistics for {@code id}, or {@code null} if no sequence exists for it.
     */
    SequenceStats lookup(String id);
}
