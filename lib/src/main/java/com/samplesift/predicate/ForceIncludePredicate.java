package com.samplesift.predicate;

import com.samplesift.record.RecordContext;
import java.util.List;
import java.util.Set;

/** Accepts listed identifiers and {@code force_include_where} matches ahead of every other stage. */
final class ForceIncludePredicate implements RecordPredicate {
    private final Set<String> ids;
    private final List<WhereCondition> conditions;

    ForceIncludePredicate(Set<String> ids, List<WhereCondition> conditions) {
        this.ids = Set.copyOf(ids);
        this.conditions = List.copyOf(conditions);
    }

    @Override
    public Decision evaluate(RecordContext context) {
        if (ids.contains(context.getId())) {
            return Decision.forceInclude("force_include_ids");
        }
        for (WhereCondition condition : conditions) {
            if (condition.matches(context.getRecord())) {
                return Decision.forceInclude("force_include_where=" + condition);
            }
        }
        return Decision.pass();
    }
}
