package com.samplesift.predicate;

import com.samplesift.record.RecordContext;

/**
 * One stage of the {@link PredicatePipeline}. Predicates are independent of each other, must not
 * mutate the record and must be safe to evaluate more than once for the same record.
 */
public interface RecordPredicate {

    /**
     * @return {@link Decision#pass()} to continue, or a terminal force-include or drop decision.
     *     Implementations must not return null.
     */
    Decision evaluate(RecordContext context);
}
