package com.samplesift.selection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

final class GroupQueueTest {

    @Test
    void keepsHighestPrioritiesAndReportsEvictions() {
        GroupQueue queue = new GroupQueue(2);
        assertNull(queue.offer(new Candidate("a", 0, 0.1)));
        assertNull(queue.offer(new Candidate("b", 1, 0.9)));
        Candidate evicted = queue.offer(new Candidate("c", 2, 0.5));
        assertEquals("a", evicted.getId());
        Candidate rejected = new Candidate("d", 3, 0.2);
        assertSame(rejected, queue.offer(rejected));
        assertEquals(List.of("b", "c"), ids(queue.selected()));
        assertEquals(2, queue.size());
    }

    @Test
    void tiesGoToEarlierRecords() {
        GroupQueue queue = new GroupQueue(1);
        queue.offer(new Candidate("first", 0, 0.5));
        Candidate late = new Candidate("late", 7, 0.5);
        assertSame(late, queue.offer(late));
        assertEquals(List.of("first"), ids(queue.selected()));
    }

    @Test
    void unscoredCandidatesRankLastAndTieByOrdinal() {
        GroupQueue queue = new GroupQueue(2);
        queue.offer(new Candidate("x", 4, Double.NEGATIVE_INFINITY));
        queue.offer(new Candidate("y", 1, Double.NEGATIVE_INFINITY));
        queue.offer(new Candidate("z", 9, -1000.0));
        assertEquals(List.of("z", "y"), ids(queue.selected()));
    }

    @Test
    void zeroCapacityRejectsEverything() {
        GroupQueue queue = new GroupQueue(0);
        Candidate candidate = new Candidate("a", 0, 1.0);
        assertSame(candidate, queue.offer(candidate));
        assertEquals(0, queue.size());
        assertThrows(IllegalArgumentException.class, () -> new GroupQueue(-1));
    }

    private static List<String> ids(List<Candidate> candidates) {
        return candidates.stream().map(Candidate::getId).collect(Collectors.toList());
    }
}
