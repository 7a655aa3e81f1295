package com.samplesift.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.samplesift.date.AmbiguousDateScope;
import com.samplesift.outcome.EmptyOutputPolicy;
import com.samplesift.quality.QualityThreshold;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class FilterConfigPropertiesTest {

    @Test
    void appliesEveryRecognizedKey() throws Exception {
        Properties properties = new Properties();
        properties.setProperty("group_by", "country, year");
        properties.setProperty("subsample_max_sequences", "50");
        properties.setProperty("subsample_seed", "314");
        properties.setProperty("probabilistic_sampling", "no");
        properties.setProperty("max_allocation_attempts", "7");
        properties.setProperty("min_date", "2020");
        properties.setProperty("date_column", "collected");
        properties.setProperty("exclude_ids", "a b,c");
        properties.setProperty("include_ids", "x");
        properties.setProperty("force_include_ids", "a");
        properties.setProperty("exclude_where", "region=asia; host != human");
        properties.setProperty("include_where", "country=peru");
        properties.setProperty("query", "age > 3");
        properties.setProperty("exclude_ambiguous_dates_by", "month");
        properties.setProperty("empty_output_reporting", "warn");
        properties.setProperty("cache_decisions", "false");
        properties.setProperty("min_length", "29000");

        FilterConfig config = FilterConfigProperties.apply(properties, FilterConfig.builder()).build();

        assertEquals(List.of("country", "year"), config.getGroupBy());
        assertEquals(50L, config.getSubsampleTotal());
        assertEquals(314L, config.getSeed());
        assertFalse(config.isProbabilisticSampling());
        assertEquals(7, config.getMaxAllocationAttempts());
        assertEquals("collected", config.getDateColumn());
        assertEquals(Set.of("a", "b", "c"), config.getExcludeIds());
        assertEquals(Set.of("x"), config.getIncludeIds());
        assertEquals(Set.of("a"), config.getForceIncludeIds());
        assertEquals(2, config.getExcludeWhere().size());
        assertTrue(config.getExcludeWhere().get(1).isNegated());
        assertEquals("country", config.getForceIncludeWhere().get(0).getColumn());
        assertEquals("age > 3", config.getQueryExpression());
        assertEquals(AmbiguousDateScope.MONTH, config.getExcludeAmbiguousDatesBy());
        assertEquals(EmptyOutputPolicy.WARN, config.getEmptyOutputPolicy());
        assertFalse(config.isCacheDecisions());
        assertEquals(29000L, config.getQualityThresholds().get(QualityThreshold.MIN_LENGTH));
    }

    @Test
    void blankValuesAreIgnored() throws Exception {
        Properties properties = new Properties();
        properties.setProperty("query", "   ");
        properties.setProperty("subsample_seed", "");
        FilterConfig config = FilterConfigProperties.apply(properties, FilterConfig.builder()).build();
        assertEquals(null, config.getQueryExpression());
        assertEquals(null, config.getSeed());
    }

    @Test
    void malformedValuesAreConfigurationErrors() {
        assertThrows(ConfigurationException.class, () -> apply("subsample_max_sequences", "many"));
        assertThrows(ConfigurationException.class, () -> apply("exclude_all", "maybe"));
        assertThrows(ConfigurationException.class, () -> apply("empty_output_reporting", "loud"));
        assertThrows(ConfigurationException.class, () -> apply("exclude_ambiguous_dates_by", "week"));
        assertThrows(ConfigurationException.class, () -> apply("max_allocation_attempts", "99999999999"));
        assertThrows(ConfigurationException.class, () -> apply("exclude_where", "no-operator"));
    }

    @Test
    void splitListAcceptsCommasAndWhitespace() {
        assertEquals(List.of("a", "b", "c", "d"), FilterConfigProperties.splitList(" a,b  c,\td, "));
    }

    private static void apply(String key, String value) throws ConfigurationException {
        Properties properties = new Properties();
        properties.setProperty(key, value);
        FilterConfigProperties.apply(properties, FilterConfig.builder());
    }
}
