package com.nowqueue.engine;

import com.nowqueue.config.EngineConfig;
import com.nowqueue.core.InMemoryTaskStore;
import com.nowqueue.core.Task;
import com.nowqueue.core.TaskSnapshotFactory;
import com.nowqueue.core.TaskStatus;
import com.nowqueue.exception.GraphCycleException;
import com.nowqueue.explain.UnblockingCut;
import com.nowqueue.graph.DependencyEdge;
import com.nowqueue.phase.FixedPhaseProvider;
import com.nowqueue.scheduler.InclusionReason;
import com.nowqueue.scheduler.NowQueue;
import com.nowqueue.scheduler.QueueEntry;
import com.nowqueue.scoring.FactorBreakdown;
import com.nowqueue.strategy.StrategyType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of refresh, explain and health over an in-memory store.
 */
class DefaultPrioritizationEngineTest {

    private static final Instant NOW = Instant.parse("2026-01-10T00:00:00Z");

    private InMemoryTaskStore store;
    private PrioritizationEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        try (InputStream in = getClass().getResourceAsStream("/tasks-two-courses.json")) {
            store = new InMemoryTaskStore(clock, TaskSnapshotFactory.parse(in));
        }
        engine = new DefaultPrioritizationEngine(EngineConfig.minimal(), store,
                new FixedPhaseProvider("in_term"), clock);
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    // =====================================================================
    // Refresh
    // =====================================================================

    @Test
    @DisplayName("Default refresh fills the 90 minute timebox with T1 and T3")
    void defaultRefresh() {
        NowQueue queue = engine.refresh();

        assertEquals(List.of("T1", "T3"), queue.taskIds());
        assertEquals(90, queue.totalMinutes());
        assertEquals("in_term", queue.phase());
        assertEquals(0, queue.snapshotVersion());
        assertEquals(StrategyType.EXACT, queue.strategy());
        assertFalse(queue.fallbackUsed());
        assertTrue(queue.relaxed().isEmpty());
        assertTrue(queue.cycleReport().isEmpty());
        assertEquals(NOW, queue.generatedAt());

        QueueEntry first = queue.entries().get(0);
        assertEquals(1, first.position());
        assertEquals("Homework 1", first.title());
        assertEquals(InclusionReason.RANKED, first.reason());
        assertTrue(first.score() >= queue.entries().get(1).score());
    }

    @Test
    @DisplayName("Refresh over an unchanged store is deterministic")
    void deterministicRefresh() {
        assertEquals(engine.refresh().entries(), engine.refresh().entries());
    }

    @Test
    @DisplayName("Course filter limits candidates and clamps min courses")
    void courseFilter() {
        NowQueue queue = engine.refresh(90, 3, 2, Set.of("STAT253"));

        assertEquals(List.of("T3", "T5"), queue.taskIds());
        assertTrue(queue.relaxed().isEmpty());
    }

    @Test
    @DisplayName("Done and blocked tasks are never selected")
    void onlyActionableTasks() {
        store.put(Task.builder("T6").course("STAT253").estMinutes(5).dependsOn("T4").build());

        NowQueue queue = engine.refresh(500, 10, 0, Set.of());

        assertFalse(queue.taskIds().contains("T2"));
        assertFalse(queue.taskIds().contains("T6"));
    }

    @Test
    @DisplayName("Explain matches the score shown in the queue")
    void explainMatchesQueue() {
        NowQueue queue = engine.refresh();

        for (QueueEntry entry : queue.entries()) {
            FactorBreakdown breakdown = engine.explain(entry.taskId());
            assertEquals(entry.score(), breakdown.total(), 1e-9);
        }
    }

    @Test
    @DisplayName("Current queue is published only after a refresh")
    void currentQueue() {
        assertTrue(engine.currentQueue().isEmpty());

        NowQueue first = engine.refresh();
        store.updateStatus("T1", TaskStatus.DOING);
        NowQueue second = engine.refresh();

        assertTrue(second.snapshotVersion() > first.snapshotVersion());
        assertSame(second, engine.currentQueue().orElseThrow());
    }

    @Test
    @DisplayName("A cancelled refresh leaves the previous queue in place")
    void cancelledRefreshDiscarded() {
        NowQueue previous = engine.refresh();
        store.updateStatus("T1", TaskStatus.DOING);

        Thread.currentThread().interrupt();
        try {
            engine.refresh();
        } finally {
            Thread.interrupted();
        }

        assertSame(previous, engine.currentQueue().orElseThrow());
    }

    @Test
    @DisplayName("Asynchronous refresh publishes its queue")
    void asyncRefresh() throws Exception {
        NowQueue queue = engine.refreshAsync(90, 3, 2, Set.of()).get(10, TimeUnit.SECONDS);

        assertEquals(List.of("T1", "T3"), queue.taskIds());
        assertSame(queue, engine.currentQueue().orElseThrow());
    }

    // =====================================================================
    // Cycles and health
    // =====================================================================

    @Test
    @DisplayName("Healthy graph reports no cycle")
    void healthyGraph() {
        GraphHealth health = engine.health();

        assertTrue(health.dagOk());
        assertNull(health.cyclePath());
        assertNull(health.breakSuggestion());
    }

    @Test
    @DisplayName("Cycle is reported while the acyclic remainder is still queued")
    void cycleReported() {
        store.put(Task.builder("C1").course("MTH251").estMinutes(10).dependsOn("C2").build());
        store.put(Task.builder("C2").course("MTH251").estMinutes(10).dependsOn("C1").build());

        GraphHealth health = engine.health();
        assertFalse(health.dagOk());
        assertEquals(List.of("C1", "C2"), health.cyclePath());
        assertEquals(new DependencyEdge("C1", "C2"), health.breakSuggestion());

        NowQueue queue = engine.refresh();
        assertEquals(List.of("C1", "C2"), queue.cycleReport().orElseThrow().path());
        assertEquals(List.of("T1", "T3"), queue.taskIds());

        assertThrows(GraphCycleException.class, () -> engine.explain("C1"));
        assertThrows(GraphCycleException.class, () -> engine.minimalUnblockingCut("C2"));
    }

    @Test
    @DisplayName("Unblocking cut lists the open ancestors")
    void unblockingCut() {
        store.put(Task.builder("T7").course("MTH251").dependsOn("T4").build());
        engine.refresh();

        UnblockingCut cut = engine.minimalUnblockingCut("T7");

        assertEquals(List.of("T4"), cut.taskIds());
        assertTrue(engine.minimalUnblockingCut("T1").isEmpty());
    }
}
