package com.samplesift.predicate;

import com.samplesift.quality.SequenceStatistics;
import com.samplesift.record.RecordContext;

final class MissingSequencePredicate implements RecordPredicate {
    private final SequenceStatistics sequences;

    MissingSequencePredicate(SequenceStatistics sequences) {
        this.sequences = sequences;
    }

    @Override
    public Decision evaluate(RecordContext context) {
        if (sequences.lookup(context.getId()) == null) {
            return Decision.drop(DropReason.MISSING_SEQUENCE, "");
        }
        return Decision.pass();
    }
}
