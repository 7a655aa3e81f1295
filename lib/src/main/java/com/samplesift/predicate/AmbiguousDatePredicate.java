package com.samplesift.predicate;

import com.samplesift.date.AmbiguousDateScope;
import com.samplesift.date.DateValue;
import com.samplesift.date.MalformedDateException;
import com.samplesift.record.RecordContext;

final class AmbiguousDatePredicate implements RecordPredicate {
    private final AmbiguousDateScope scope;

    AmbiguousDatePredicate(AmbiguousDateScope scope) {
        this.scope = scope;
    }

    @Override
    public Decision evaluate(RecordContext context) {
        DateValue date;
        try {
            date = context.getDate();
        } catch (MalformedDateException ex) {
            // Unreachable behind MalformedDatePredicate; classify rather than fail the stream.
            return Decision.drop(DropReason.MALFORMED_DATE, "date=" + ex.getRawValue());
        }
        if (scope.isAmbiguous(date)) {
            return Decision.drop(DropReason.AMBIGUOUS_DATE, "ambiguity=" + scope.label());
        }
        return Decision.pass();
    }
}
