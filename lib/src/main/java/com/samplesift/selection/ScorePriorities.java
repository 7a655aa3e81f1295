package com.samplesift.selection;

import java.util.Map;
import java.util.Objects;

/**
 * Priorities taken from an externally supplied score table. Identifiers without a score rank
 * below every scored record.
 */
public final class ScorePriorities implements PriorityProvider {

    private final Map<String, Double> scores;

    public ScorePriorities(Map<String, Double> scores) {
        this.scores = Map.copyOf(Objects.requireNonNull(scores, "scores"));
    }

    @Override
    public double priorityOf(String id, long ordinal) {
        Double score = scores.get(id);
        return score == null ? Double.NEGATIVE_INFINITY : score;
    }

    public int size() {
        return scores.size();
    }

    public boolean contains(String id) {
        return scores.containsKey(id);
    }
}
