package com.samplesift.predicate;

import com.samplesift.record.Record;
import com.samplesift.record.RecordContext;
import java.util.function.Predicate;

final class QueryPredicate implements RecordPredicate {
    private final Predicate<Record> query;
    private final String expression;

    QueryPredicate(Predicate<Record> query, String expression) {
        this.query = query;
        this.expression = expression;
    }

    @Override
    public Decision evaluate(RecordContext context) {
        if (!query.test(context.getRecord())) {
            return Decision.drop(DropReason.QUERY, "query=" + expression);
        }
        return Decision.pass();
    }
}
