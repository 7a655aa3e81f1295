package com.samplesift.query;

import static com.samplesift.testing.TestRecords.record;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.samplesift.config.ConfigurationException;
import com.samplesift.record.Record;
import java.util.List;
import java.util.function.Predicate;
import org.junit.jupiter.api.Test;

final class ExpressionQueryEvaluatorTest {

    private static final List<String> COLUMNS = List.of("strain", "country", "age", "host", "collection date");

    private final ExpressionQueryEvaluator evaluator = new ExpressionQueryEvaluator();

    @Test
    void numericCellsCompareNumerically() throws Exception {
        Predicate<Record> query = evaluator.compile("age > 10", COLUMNS);
        assertFalse(query.test(record("A", "age", "9")));
        assertTrue(query.test(record("B", "age", "11")));
        assertTrue(evaluator.compile("age == 1", COLUMNS).test(record("C", "age", "1.0")));
    }

    @Test
    void textCellsCompareAsStrings() throws Exception {
        assertTrue(evaluator.compile("country == 'USA'", COLUMNS).test(record("A", "country", "USA")));
        assertFalse(evaluator.compile("country == \"USA\"", COLUMNS).test(record("A", "country", "usa")));
        assertTrue(evaluator.compile("country < 'M'", COLUMNS).test(record("A", "country", "Canada")));
    }

    @Test
    void emptyCellNeverSatisfiesOrdering() throws Exception {
        Record blank = record("A", "age", "");
        assertFalse(evaluator.compile("age < 5", COLUMNS).test(blank));
        assertFalse(evaluator.compile("age >= 5", COLUMNS).test(blank));
        assertTrue(evaluator.compile("age == ''", COLUMNS).test(blank));
    }

    @Test
    void membershipAndNegatedMembership() throws Exception {
        Predicate<Record> in = evaluator.compile("country in ['USA', 'Canada']", COLUMNS);
        Predicate<Record> notIn = evaluator.compile("country not in ('USA', 'Canada')", COLUMNS);
        Record usa = record("A", "country", "USA");
        Record peru = record("B", "country", "Peru");
        assertTrue(in.test(usa));
        assertFalse(in.test(peru));
        assertFalse(notIn.test(usa));
        assertTrue(notIn.test(peru));
    }

    @Test
    void andBindsTighterThanOr() throws Exception {
        Predicate<Record> query = evaluator.compile("country == 'A' or host == 'B' and age == 1", COLUMNS);
        assertTrue(query.test(record("X", "country", "A", "host", "Z", "age", "9")));
        assertFalse(query.test(record("Y", "country", "Z", "host", "B", "age", "9")));
        Predicate<Record> grouped = evaluator.compile("(country == 'A' | host == 'B') & age == 1", COLUMNS);
        assertFalse(grouped.test(record("X", "country", "A", "host", "Z", "age", "9")));
    }

    @Test
    void negationAndBooleanLiterals() throws Exception {
        assertTrue(evaluator.compile("~(host == 'human')", COLUMNS).test(record("A", "host", "bat")));
        assertFalse(evaluator.compile("not host == 'bat'", COLUMNS).test(record("A", "host", "bat")));
        assertTrue(evaluator.compile("true", COLUMNS).test(record("A")));
        assertFalse(evaluator.compile("False", COLUMNS).test(record("A")));
    }

    @Test
    void backquotedColumnsMayContainSpaces() throws Exception {
        Predicate<Record> query = evaluator.compile("`collection date` == '2020'", COLUMNS);
        assertTrue(query.test(record("A", "collection date", "2020")));
    }

    @Test
    void literalMayAppearOnEitherSide() throws Exception {
        assertTrue(evaluator.compile("5 < age", COLUMNS).test(record("A", "age", "7")));
    }

    @Test
    void syntaxErrorsAreConfigurationErrors() {
        assertThrows(ConfigurationException.class, () -> evaluator.compile("age >", COLUMNS));
        assertThrows(ConfigurationException.class, () -> evaluator.compile("age == 'open", COLUMNS));
        assertThrows(ConfigurationException.class, () -> evaluator.compile("(age == 1", COLUMNS));
    }

    @Test
    void unknownColumnsAreConfigurationErrors() {
        ConfigurationException ex =
                assertThrows(ConfigurationException.class, () -> evaluator.compile("region == 'x'", COLUMNS));
        assertTrue(ex.getMessage().contains("region"));
    }
}
