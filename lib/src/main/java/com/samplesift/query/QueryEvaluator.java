package com.samplesift.query;

import com.samplesift.config.ConfigurationException;
import com.samplesift.record.Record;
import java.util.List;
import java.util.function.Predicate;

/**
 * Compiles an ad-hoc boolean expression into a per-record predicate. The filtering engine treats
 * the expression language as opaque; {@link ExpressionQueryEvaluator} is the default grammar.
 */
public interface QueryEvaluator {

    /**
     * @param expression the user's query string.
     * @param columns the input's column names, used to reject references to unknown columns.
     * @throws ConfigurationException if the expression cannot be parsed or names an unknown column.
     */
    Predicate<Record> compile(String expression, List<String> columns) throws ConfigurationException;
}
