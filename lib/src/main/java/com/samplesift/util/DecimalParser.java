package com.samplesift.util;

import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.text.ParsePosition;
import java.util.Locale;

/**
 * Locale-neutral decimal parser used for query comparisons and priority scores. Only '.' is a
 * decimal separator and grouping characters are rejected, so "1,5" is text, not a number.
 */
public final class DecimalParser {

    private static final ThreadLocal<DecimalFormat> FORMAT = ThreadLocal.withInitial(DecimalParser::buildFormat);

    private DecimalParser() {}

    /**
     * Parses {@code text} as a decimal. Returns {@code null} for null/empty input. Throws
     * {@link NumberFormatException} for anything that is not a complete decimal literal.
     */
    public static BigDecimal parse(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (trimmed.startsWith("+")) {
            trimmed = trimmed.substring(1);
        }
        ParsePosition position = new ParsePosition(0);
        Number parsed = FORMAT.get().parse(trimmed, position);
        if (parsed == null || position.getIndex() != trimmed.length()) {
            throw new NumberFormatException("Invalid decimal: " + text);
        }
        if (!(parsed instanceof BigDecimal)) {
            return new BigDecimal(parsed.toString());
        }
        return (BigDecimal) parsed;
    }

    /** Like {@link #parse(String)} but returns {@code null} instead of throwing. */
    public static BigDecimal tryParse(String text) {
        try {
            return parse(text);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static DecimalFormat buildFormat() {
        DecimalFormatSymbols symbols = DecimalFormatSymbols.getInstance(Locale.ROOT);
        symbols.setDecimalSeparator('.');
        DecimalFormat format = new DecimalFormat();
        format.setDecimalFormatSymbols(symbols);
        format.setParseBigDecimal(true);
        format.setGroupingUsed(false);
        format.setMaximumFractionDigits(Integer.MAX_VALUE);
        format.setMaximumIntegerDigits(Integer.MAX_VALUE);
        return format;
    }
}
