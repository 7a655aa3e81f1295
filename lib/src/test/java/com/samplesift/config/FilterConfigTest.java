package com.samplesift.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.samplesift.outcome.EmptyOutputPolicy;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

final class FilterConfigTest {

    @Test
    void defaults() throws Exception {
        FilterConfig config = FilterConfig.builder().build();
        assertEquals(FilterConfig.DEFAULT_DATE_COLUMN, config.getDateColumn());
        assertEquals(FilterConfig.DEFAULT_MAX_ALLOCATION_ATTEMPTS, config.getMaxAllocationAttempts());
        assertEquals(EmptyOutputPolicy.ERROR, config.getEmptyOutputPolicy());
        assertTrue(config.isProbabilisticSampling());
        assertTrue(config.isCacheDecisions());
        assertFalse(config.isSubsampling());
        assertNull(config.getSeed());
        assertNull(config.getIncludeIds());
        assertTrue(config.getGroupBy().isEmpty());
    }

    @Test
    void partialDatesWidenToTheirBounds() throws Exception {
        FilterConfig config = FilterConfig.builder().minDate("2020-02").maxDate("2020").build();
        assertEquals(LocalDate.of(2020, 2, 1), config.getMinDate());
        assertEquals(LocalDate.of(2020, 12, 31), config.getMaxDate());
    }

    @Test
    void subsamplingModesAreExclusive() {
        assertThrows(
                ConfigurationException.class,
                () -> FilterConfig.builder().groupBy("country").subsampleTotal(5L).subsamplePerGroup(2L).build());
    }

    @Test
    void subsamplingSizesMustBePositive() {
        assertThrows(ConfigurationException.class, () -> FilterConfig.builder().subsampleTotal(0L).build());
        assertThrows(
                ConfigurationException.class,
                () -> FilterConfig.builder().groupBy("country").subsamplePerGroup(-1L).build());
    }

    @Test
    void groupingNeedsASubsampleSize() {
        assertThrows(ConfigurationException.class, () -> FilterConfig.builder().groupBy("country").build());
        assertThrows(ConfigurationException.class, () -> FilterConfig.builder().subsamplePerGroup(3L).build());
    }

    @Test
    void totalWithoutGroupingIsAllowed() throws Exception {
        FilterConfig config = FilterConfig.builder().subsampleTotal(10L).build();
        assertTrue(config.isSubsampling());
    }

    @Test
    void rejectsInvalidGroupingColumns() {
        assertThrows(
                ConfigurationException.class,
                () -> FilterConfig.builder().groupBy(List.of("country", "country")).subsampleTotal(5L).build());
        assertThrows(
                ConfigurationException.class,
                () -> FilterConfig.builder().groupBy("week", "year").subsampleTotal(5L).build());
    }

    @Test
    void rejectsInvertedDateRange() {
        assertThrows(
                ConfigurationException.class,
                () -> FilterConfig.builder().minDate("2021-06-01").maxDate("2021-01").build());
    }

    @Test
    void includeListPresenceIsTracked() throws Exception {
        FilterConfig config = FilterConfig.builder().includeIds(List.of()).build();
        assertTrue(config.getIncludeIds().isEmpty());
    }
}
