package com.samplesift.date;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.samplesift.config.ConfigurationException;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

final class DateBoundsTest {

    @Test
    void partialLowerBoundStartsAtFirstDay() throws Exception {
        assertEquals(LocalDate.of(2020, 1, 1), DateBounds.parseLower("2020"));
        assertEquals(LocalDate.of(2020, 3, 1), DateBounds.parseLower("2020-03"));
    }

    @Test
    void partialUpperBoundEndsAtLastDay() throws Exception {
        assertEquals(LocalDate.of(2020, 12, 31), DateBounds.parseUpper("2020"));
        assertEquals(LocalDate.of(2020, 2, 29), DateBounds.parseUpper("2020-02"));
        assertEquals(LocalDate.of(2020, 5, 3), DateBounds.parseUpper("2020-05-03"));
    }

    @Test
    void blankMeansUnbounded() throws Exception {
        assertNull(DateBounds.parseLower(null));
        assertNull(DateBounds.parseUpper("  "));
    }

    @Test
    void rejectsUnparseableBounds() {
        assertThrows(ConfigurationException.class, () -> DateBounds.parseLower("20-1"));
        assertThrows(ConfigurationException.class, () -> DateBounds.parseUpper("2020-14"));
        assertThrows(ConfigurationException.class, () -> DateBounds.parseUpper("last week"));
    }
}
