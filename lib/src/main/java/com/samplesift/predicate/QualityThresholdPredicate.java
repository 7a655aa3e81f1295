package com.samplesift.predicate;

import com.samplesift.quality.QualityThreshold;
import com.samplesift.quality.SequenceStatistics;
import com.samplesift.quality.SequenceStats;
import com.samplesift.record.RecordContext;
import java.util.EnumMap;
import java.util.Map;

/** Checks sequence statistics against the configured bounds, in {@link QualityThreshold} order. */
final class QualityThresholdPredicate implements RecordPredicate {
    private final SequenceStatistics sequences;
    private final Map<QualityThreshold, Long> thresholds;

    QualityThresholdPredicate(SequenceStatistics sequences, Map<QualityThreshold, Long> thresholds) {
        this.sequences = sequences;
        this.thresholds = new EnumMap<>(thresholds);
    }

    @Override
    public Decision evaluate(RecordContext context) {
        SequenceStats stats = sequences.lookup(context.getId());
        if (stats == null) {
            return Decision.drop(DropReason.MISSING_SEQUENCE, "");
        }
        for (Map.Entry<QualityThreshold, Long> entry : thresholds.entrySet()) {
            if (!entry.getKey().passes(stats, entry.getValue())) {
                return Decision.drop(DropReason.QUALITY, entry.getKey().getKey() + "=" + entry.getValue());
            }
        }
        return Decision.pass();
    }
}
