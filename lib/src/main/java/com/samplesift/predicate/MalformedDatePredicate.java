package com.samplesift.predicate;

import com.samplesift.record.RecordContext;

/** Drops records whose date cell is outside the date grammar. */
final class MalformedDatePredicate implements RecordPredicate {

    @Override
    public Decision evaluate(RecordContext context) {
        if (context.isDateMalformed()) {
            return Decision.drop(DropReason.MALFORMED_DATE, "date=" + context.getRawDate());
        }
        return Decision.pass();
    }
}
