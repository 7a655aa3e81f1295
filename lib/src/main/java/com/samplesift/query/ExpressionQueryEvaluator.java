package com.samplesift.query;

import com.samplesift.config.ConfigurationException;
import com.samplesift.query.grammar.FilterQueryLexer;
import com.samplesift.query.grammar.FilterQueryParser;
import com.samplesift.record.Record;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/** {@link QueryEvaluator} backed by the ANTLR {@code FilterQuery} grammar. */
public final class ExpressionQueryEvaluator implements QueryEvaluator {

    @Override
    public Predicate<Record> compile(String expression, List<String> columns) throws ConfigurationException {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(columns, "columns");

        FilterQueryLexer lexer = new FilterQueryLexer(CharStreams.fromString(expression, "query"));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        FilterQueryParser parser = new FilterQueryParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        QueryNode root;
        QueryAstBuilder builder = new QueryAstBuilder();
        try {
            if (DebugFlags.isTokenDebugEnabled()) {
                tokens.fill();
                DebugFlags.logTokens(tokens, lexer);
                tokens.seek(0);
            }
            root = builder.build(parser.query());
        } catch (ParseCancellationException ex) {
            throw new ConfigurationException("Invalid query '" + expression + "' at " + ex.getMessage(), ex);
        }

        Set<String> known = new HashSet<>(columns);
        List<String> unknown = new ArrayList<>();
        for (String column : builder.getReferencedColumns()) {
            if (!known.contains(column)) {
                unknown.add(column);
            }
        }
        if (!unknown.isEmpty()) {
            throw new ConfigurationException(
                    "Query '" + expression + "' references unknown column(s): " + String.join(", ", unknown));
        }
        return root::test;
    }
}
