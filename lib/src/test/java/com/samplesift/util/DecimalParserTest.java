package com.samplesift.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

final class DecimalParserTest {

    @Test
    void parsesPlainDecimals() {
        assertEquals(0, new BigDecimal("12.5").compareTo(DecimalParser.parse("12.5")));
        assertEquals(0, new BigDecimal("-3").compareTo(DecimalParser.parse(" -3 ")));
        assertEquals(0, new BigDecimal("7").compareTo(DecimalParser.parse("+7")));
    }

    @Test
    void emptyInputIsNull() {
        assertNull(DecimalParser.parse(null));
        assertNull(DecimalParser.parse("  "));
    }

    @Test
    void rejectsTrailingGarbageAndCommaDecimals() {
        assertThrows(NumberFormatException.class, () -> DecimalParser.parse("12abc"));
        assertThrows(NumberFormatException.class, () -> DecimalParser.parse("1,5"));
        assertNull(DecimalParser.tryParse("USA"));
    }
}
