package com.samplesift.predicate;

import com.samplesift.record.RecordContext;

/** Drops rows the record source could not parse. */
final class MalformedRecordPredicate implements RecordPredicate {

    @Override
    public Decision evaluate(RecordContext context) {
        if (context.getRecord().isMalformed()) {
            return Decision.drop(DropReason.MALFORMED_RECORD, context.getRecord().getProblem());
        }
        return Decision.pass();
    }
}
