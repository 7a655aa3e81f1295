package com.samplesift.predicate;

import com.samplesift.record.RecordContext;
import java.util.Set;

final class ExcludedIdPredicate implements RecordPredicate {
    private final Set<String> excluded;

    ExcludedIdPredicate(Set<String> excluded) {
        this.excluded = Set.copyOf(excluded);
    }

    @Override
    public Decision evaluate(RecordContext context) {
        if (excluded.contains(context.getId())) {
            return Decision.drop(DropReason.EXCLUDED_ID, "");
        }
        return Decision.pass();
    }
}
