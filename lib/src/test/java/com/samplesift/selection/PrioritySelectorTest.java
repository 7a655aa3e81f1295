package com.samplesift.selection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.samplesift.group.GroupKey;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class PrioritySelectorTest {

    private static final GroupKey USA = GroupKey.of("USA");
    private static final GroupKey PERU = GroupKey.of("Peru");

    @Test
    void eachGroupIsBoundedByItsOwnQuota() {
        Map<GroupKey, Long> quotas = Map.of(USA, 2L, PERU, 1L);
        PrioritySelector selector = new PrioritySelector(quotas::get, new UniformPriorities(3L));
        for (int i = 0; i < 10; i++) {
            selector.offer(i % 2 == 0 ? USA : PERU, "r" + i, i);
        }
        assertEquals(2, selector.getQueues().get(USA).size());
        assertEquals(1, selector.getQueues().get(PERU).size());
        assertEquals(3, selector.selected().size());
        assertEquals(List.of(USA, PERU), List.copyOf(selector.getQueues().keySet()));
    }

    @Test
    void scoresDecideWhoStays() {
        ScorePriorities scores = new ScorePriorities(Map.of("high", 5.0, "mid", 2.0));
        PrioritySelector selector = new PrioritySelector(key -> 1L, scores);
        assertNull(selector.offer(USA, "unscored", 0));
        assertEquals("unscored", selector.offer(USA, "mid", 1).getId());
        assertEquals("mid", selector.offer(USA, "high", 2).getId());
        assertEquals("high", selector.selected().get(0).getId());
        assertTrue(scores.contains("mid"));
        assertFalse(scores.contains("unscored"));
        assertEquals(Double.NEGATIVE_INFINITY, scores.priorityOf("unscored", 0));
    }

    @Test
    void uniformPrioritiesAreDeterministicAndInUnitInterval() {
        UniformPriorities priorities = new UniformPriorities(42L);
        Set<Double> distinct = new HashSet<>();
        for (long ordinal = 0; ordinal < 1000; ordinal++) {
            double value = priorities.priorityOf("ignored", ordinal);
            assertTrue(value >= 0.0 && value < 1.0);
            assertEquals(value, new UniformPriorities(42L).priorityOf("other", ordinal));
            distinct.add(value);
        }
        assertEquals(1000, distinct.size());
        assertNotEquals(priorities.priorityOf("a", 5), new UniformPriorities(43L).priorityOf("a", 5));
    }
}
