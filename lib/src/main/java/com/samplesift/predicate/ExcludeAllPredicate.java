package com.samplesift.predicate;

import com.samplesift.record.RecordContext;

final class ExcludeAllPredicate implements RecordPredicate {

    @Override
    public Decision evaluate(RecordContext context) {
        return Decision.drop(DropReason.EXCLUDE_ALL, "");
    }
}
