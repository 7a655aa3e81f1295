package com.samplesift.selection;

import java.util.Comparator;
import java.util.Objects;

/** A grouped record competing for its group's quota. */
public final class Candidate {

    /** Best first: higher priority, then earlier input position. */
    public static final Comparator<Candidate> BEST_FIRST =
            Comparator.comparingDouble(Candidate::getPriority).reversed().thenComparingLong(Candidate::getOrdinal);

    private final String id;
    private final long ordinal;
    private final double priority;

    public Candidate(String id, long ordinal, double priority) {
        this.id = Objects.requireNonNull(id, "id");
        this.ordinal = ordinal;
        this.priority = priority;
    }

    public String getId() {
        return id;
    }

    public long getOrdinal() {
        return ordinal;
    }

    public double getPriority() {
        return priority;
    }

    @Override
    public String toString() {
        return id + "#" + ordinal + "(" + priority + ")";
    }
}
