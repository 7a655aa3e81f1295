package com.samplesift.predicate;

import com.samplesift.record.RecordContext;
import java.util.Set;

/** Restricts the input to an allow-list of identifiers. */
final class InclusionPredicate implements RecordPredicate {
    private final Set<String> included;

    InclusionPredicate(Set<String> included) {
        this.included = Set.copyOf(included);
    }

    @Override
    public Decision evaluate(RecordContext context) {
        if (!included.contains(context.getId())) {
            return Decision.drop(DropReason.INCLUSION_MISMATCH, "");
        }
        return Decision.pass();
    }
}
