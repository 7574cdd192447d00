package com.nowqueue.scoring;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the ranking order of tasks.
 */
class PriorityKeyTest {

    private static final Instant EARLY = Instant.parse("2026-01-11T00:00:00Z");
    private static final Instant LATE = Instant.parse("2026-01-20T00:00:00Z");

    @Test
    @DisplayName("Higher score ranks first")
    void scoreFirst() {
        PriorityKey high = new PriorityKey("Z", 9.0, 0, false, null);
        PriorityKey low = new PriorityKey("A", 8.0, 5, true, EARLY);

        assertTrue(high.compareTo(low) < 0);
    }

    @Test
    @DisplayName("Equal scores fall through the tie-break chain")
    void tieBreakChain() {
        PriorityKey moreUnblock = new PriorityKey("E", 5.0, 2, false, null);
        PriorityKey chainHead = new PriorityKey("D", 5.0, 1, true, null);
        PriorityKey earlyDue = new PriorityKey("C", 5.0, 1, false, EARLY);
        PriorityKey lateDue = new PriorityKey("B", 5.0, 1, false, LATE);
        PriorityKey noDue = new PriorityKey("A", 5.0, 1, false, null);
        PriorityKey noDueLaterId = new PriorityKey("F", 5.0, 1, false, null);

        List<PriorityKey> keys = new ArrayList<>(List.of(noDueLaterId, noDue, lateDue, earlyDue, chainHead, moreUnblock));
        Collections.shuffle(keys, new Random(7));
        Collections.sort(keys);

        assertEquals(List.of("E", "D", "C", "B", "A", "F"), keys.stream().map(PriorityKey::getTaskId).toList());
    }

    @Test
    @DisplayName("Order is total and consistent with equals")
    void totalOrder() {
        PriorityKey a = new PriorityKey("A", 1.0, 0, true, EARLY);
        PriorityKey same = new PriorityKey("A", 1.0, 0, true, EARLY);

        assertEquals(0, a.compareTo(same));
        assertEquals(a, same);
        assertEquals(a.hashCode(), same.hashCode());
        assertNotEquals(a, new PriorityKey("B", 1.0, 0, true, EARLY));
    }
}
