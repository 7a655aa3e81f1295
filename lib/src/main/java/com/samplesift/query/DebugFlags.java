package com.samplesift.query;

import com.samplesift.query.grammar.FilterQueryLexer;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;

final class DebugFlags {
    private static final Logger LOGGER = Logger.getLogger(DebugFlags.class.getName());
    private static final String TOKENS_PROPERTY = "samplesift.debugQueryTokens";
    /** Environment fallback kept for convenience; prefer using system properties. */
    private static final String TOKENS_ENV = "SAMPLESIFT_DEBUG_QUERY_TOKENS";

    private DebugFlags() {}

    static boolean isTokenDebugEnabled() {
        String value = System.getProperty(TOKENS_PROPERTY);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(TOKENS_ENV));
    }

    static void logTokens(CommonTokenStream tokens, FilterQueryLexer lexer) {
        LOGGER.info("Query token dump for debugging:");
        for (Token token : tokens.getTokens()) {
            String symbolic = lexer.getVocabulary().getSymbolicName(token.getType());
            if (symbolic == null) {
                symbolic = String.format(Locale.ROOT, "#%d", token.getType());
            }
            LOGGER.log(
                    Level.INFO,
                    String.format(
                            Locale.ROOT,
                            "  %-12s @ %-3d -> %s",
                            symbolic,
                            token.getCharPositionInLine(),
                            token.getText()));
        }
    }
}
