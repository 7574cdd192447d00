package com.nowqueue.explain;

import com.nowqueue.config.ScoringConfig;
import com.nowqueue.config.WeightTable;
import com.nowqueue.core.Task;
import com.nowqueue.core.TaskSnapshot;
import com.nowqueue.core.TaskStatus;
import com.nowqueue.exception.GraphCycleException;
import com.nowqueue.exception.TaskNotFoundException;
import com.nowqueue.graph.GraphAnalysis;
import com.nowqueue.graph.GraphAnalyzer;
import com.nowqueue.scoring.Factor;
import com.nowqueue.scoring.FactorBreakdown;
import com.nowqueue.scoring.ScoringEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for factor explanations and minimal unblocking cuts.
 */
class ExplainerTest {

    private static final Instant AS_OF = Instant.parse("2026-01-10T00:00:00Z");

    private Explainer explainer;
    private GraphAnalysis analysis;

    @BeforeEach
    void setUp() {
        explainer = new Explainer(new ScoringEngine(ScoringConfig.defaults(),
                new WeightTable(Map.of("in_term", Map.of("content", 2.0)))));
        analysis = new GraphAnalyzer().analyze(TaskSnapshot.of(1, AS_OF, List.of(
                task("A", TaskStatus.TODO),
                task("B", TaskStatus.BLOCKED, "A"),
                task("C", TaskStatus.BLOCKED, "B"),
                task("D", TaskStatus.BLOCKED, "C", "X"),
                task("X", TaskStatus.DONE, "Y"),
                task("Y", TaskStatus.TODO),
                task("P", TaskStatus.BLOCKED, "Q"),
                task("Q", TaskStatus.BLOCKED, "R"),
                task("R", TaskStatus.BLOCKED, "Q"))));
    }

    // =====================================================================
    // Minimal unblocking cut
    // =====================================================================

    @Test
    @DisplayName("Cut holds every open ancestor in completion order")
    void cutOfDeepTask() {
        UnblockingCut cut = explainer.minimalUnblockingCut(analysis, "D");

        assertTrue(cut.reachable());
        assertEquals(List.of("A", "B", "C"), cut.taskIds());
    }

    @Test
    @DisplayName("Done dependencies end the walk")
    void doneDependencyEndsWalk() {
        assertFalse(explainer.minimalUnblockingCut(analysis, "D").taskIds().contains("Y"));
    }

    @Test
    @DisplayName("Chain-head has an empty cut")
    void chainHeadCut() {
        UnblockingCut cut = explainer.minimalUnblockingCut(analysis, "A");

        assertTrue(cut.isEmpty());
        assertEquals(0, cut.size());
    }

    @Test
    @DisplayName("Ancestry through a cycle is unreachable, not empty")
    void unreachableCut() {
        UnblockingCut cut = explainer.minimalUnblockingCut(analysis, "P");

        assertFalse(cut.reachable());
        assertFalse(cut.isEmpty());
        assertTrue(cut.taskIds().isEmpty());
    }

    @Test
    @DisplayName("Cut of a task on a cycle reports the cycle")
    void cutOfCyclicTask() {
        GraphCycleException e = assertThrows(GraphCycleException.class,
                () -> explainer.minimalUnblockingCut(analysis, "Q"));

        assertEquals(List.of("Q", "R"), e.getCyclePath());
    }

    // =====================================================================
    // Explain
    // =====================================================================

    @Test
    @DisplayName("Explanation sums to the score and is stable across calls")
    void explainStable() {
        FactorBreakdown first = explainer.explain(analysis, "A", "in_term");
        FactorBreakdown second = explainer.explain(analysis, "A", "in_term");

        assertEquals(first, second);
        assertEquals(first.total(), first.factors().stream().mapToDouble(Factor::contribution).sum(), 1e-9);
        assertEquals(2.0, first.factor(ScoringEngine.CATEGORY_WEIGHT).orElseThrow().rawValue());
        assertEquals(ScoringConfig.defaults().chainHeadBonus(),
                first.factor(ScoringEngine.CHAIN_HEAD_BONUS).orElseThrow().contribution());
    }

    @Test
    @DisplayName("Explaining a cyclic or unknown task fails with diagnostics")
    void explainErrors() {
        assertThrows(GraphCycleException.class, () -> explainer.explain(analysis, "R", "in_term"));
        assertThrows(TaskNotFoundException.class, () -> explainer.explain(analysis, "NOPE", "in_term"));
    }

    private static Task task(String id, TaskStatus status, String... deps) {
        return Task.builder(id)
                .status(status)
                .category("content")
                .dueAt(AS_OF.plus(Duration.ofDays(2)))
                .dependsOn(deps)
                .build();
    }
}
