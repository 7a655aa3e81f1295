package com.samplesift.predicate;

import com.samplesift.record.RecordContext;
import java.util.List;

final class ExcludeWherePredicate implements RecordPredicate {
    private final List<WhereCondition> conditions;

    ExcludeWherePredicate(List<WhereCondition> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    @Override
    public Decision evaluate(RecordContext context) {
        for (WhereCondition condition : conditions) {
            if (condition.matches(context.getRecord())) {
                return Decision.drop(DropReason.EXCLUDE_WHERE, "exclude_where=" + condition);
            }
        }
        return Decision.pass();
    }
}
