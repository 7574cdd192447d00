package com.nowqueue.graph;

import com.nowqueue.core.Task;
import com.nowqueue.core.TaskSnapshot;
import com.nowqueue.core.TaskStatus;
import com.nowqueue.exception.GraphCycleException;
import com.nowqueue.exception.TaskNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for dependency graph analysis: chain-heads, unblock counts, depth and cycles.
 */
class GraphAnalyzerTest {

    private static final Instant AS_OF = Instant.parse("2026-01-10T00:00:00Z");

    private GraphAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new GraphAnalyzer();
    }

    // =====================================================================
    // Chain-heads
    // =====================================================================

    @Test
    @DisplayName("Task whose only dependency is done is a chain-head")
    void doneDependencyMakesChainHead() {
        GraphAnalysis analysis = analyze(
                task("T1", TaskStatus.TODO, "T2"),
                task("T2", TaskStatus.DONE));

        assertTrue(analysis.metrics("T1").chainHead());
        assertEquals(0, analysis.metrics("T1").depth());
    }

    @Test
    @DisplayName("Task with an open dependency is not a chain-head")
    void openDependencyBlocks() {
        GraphAnalysis analysis = analyze(
                task("T3", TaskStatus.BLOCKED, "T4"),
                task("T4", TaskStatus.DOING));

        assertFalse(analysis.metrics("T3").chainHead());
        assertTrue(analysis.metrics("T4").chainHead());
    }

    @Test
    @DisplayName("Dependencies on unknown ids are ignored")
    void unknownDependencyIgnored() {
        GraphAnalysis analysis = analyze(task("A", TaskStatus.TODO, "GHOST"));

        assertTrue(analysis.metrics("A").chainHead());
        assertTrue(analysis.isAcyclic());
    }

    @Test
    @DisplayName("Chain-head iff every dependency is done, on a mixed graph")
    void chainHeadMatchesDefinition() {
        GraphAnalysis analysis = analyze(diamond());
        TaskSnapshot snapshot = analysis.snapshot();

        for (Task task : snapshot.tasks()) {
            boolean expected = task.dependsOn().stream()
                    .map(snapshot::find)
                    .allMatch(dep -> dep.isEmpty() || dep.get().isDone());
            assertEquals(expected, analysis.metrics(task.id()).chainHead(), task.id());
        }
    }

    // =====================================================================
    // Unblock count
    // =====================================================================

    @Test
    @DisplayName("Unblock count on a diamond")
    void unblockCountOnDiamond() {
        GraphAnalysis analysis = analyze(diamond());

        assertEquals(3, analysis.metrics("A").unblockCount());
        assertEquals(0, analysis.metrics("B").unblockCount());
        assertEquals(0, analysis.metrics("C").unblockCount());
        assertEquals(0, analysis.metrics("D").unblockCount());
        assertEquals(0, analysis.metrics("X").unblockCount());
    }

    @Test
    @DisplayName("Done dependent waiting only on this task is counted")
    void doneDependentCounted() {
        GraphAnalysis analysis = analyze(
                task("R", TaskStatus.DONE, "S"),
                task("S", TaskStatus.TODO));

        assertFalse(analysis.metrics("R").chainHead());
        assertEquals(1, analysis.metrics("S").unblockCount());
    }

    @Test
    @DisplayName("Unblock count equals new chain-heads after completing the task alone")
    void unblockCountMatchesSimulation() {
        List<Task> tasks = diamond();
        GraphAnalysis before = analyze(tasks);

        for (Task target : tasks) {
            if (target.isDone()) {
                continue;
            }
            List<Task> completed = new ArrayList<>();
            for (Task task : tasks) {
                completed.add(task.id().equals(target.id()) ? task.withStatus(TaskStatus.DONE, AS_OF) : task);
            }
            GraphAnalysis after = analyze(completed);

            long promoted = tasks.stream()
                    .filter(t -> !t.id().equals(target.id()))
                    .filter(t -> !before.metrics(t.id()).chainHead() && after.metrics(t.id()).chainHead())
                    .count();
            assertEquals(promoted, before.metrics(target.id()).unblockCount(), target.id());
        }
    }

    // =====================================================================
    // Depth
    // =====================================================================

    @Test
    @DisplayName("Depth counts open dependencies down to a chain-head")
    void depthAlongChain() {
        GraphAnalysis analysis = analyze(diamond());

        assertEquals(0, analysis.metrics("A").depth());
        assertEquals(1, analysis.metrics("B").depth());
        assertEquals(2, analysis.metrics("D").depth());
        assertEquals(1, analysis.metrics("E").depth());
    }

    // =====================================================================
    // Cycles
    // =====================================================================

    @Test
    @DisplayName("A -> B -> C -> A reports cycle [A, B, C] with a break suggestion")
    void threeCycle() {
        GraphAnalysis analysis = analyze(
                task("A", TaskStatus.TODO, "B"),
                task("B", TaskStatus.TODO, "C"),
                task("C", TaskStatus.TODO, "A"));

        assertFalse(analysis.isAcyclic());
        CycleReport report = analysis.cycle().orElseThrow();
        assertEquals(List.of("A", "B", "C"), report.path());
        assertNotNull(report.breakSuggestion());
        assertEquals(Set.of("A", "B", "C"), analysis.cyclicTaskIds());

        GraphCycleException e = assertThrows(GraphCycleException.class, analysis::requireAcyclic);
        assertEquals(List.of("A", "B", "C"), e.getCyclePath());
    }

    @Test
    @DisplayName("Cycle path is rotated to the lowest id whatever the entry point")
    void cyclePathRotationStable() {
        GraphAnalysis analysis = analyze(
                task("0", TaskStatus.TODO, "C"),
                task("A", TaskStatus.TODO, "B"),
                task("B", TaskStatus.TODO, "C"),
                task("C", TaskStatus.TODO, "A"));

        assertEquals(List.of("A", "B", "C"), analysis.cycle().orElseThrow().path());
        assertFalse(analysis.metrics("0").cyclic());
        assertEquals(-1, analysis.metrics("0").depth());
    }

    @Test
    @DisplayName("Break suggestion is the edge with the lowest combined weight")
    void breakSuggestionLowestWeight() {
        GraphAnalysis analysis = analyze(
                Task.builder("A").weight(3.0).dependsOn("B").build(),
                Task.builder("B").weight(1.0).dependsOn("C").build(),
                Task.builder("C").weight(1.0).dependsOn("A").build());

        DependencyEdge edge = analysis.cycle().orElseThrow().breakSuggestion();
        assertEquals(new DependencyEdge("B", "C"), edge);
        assertEquals("B -> C", edge.toString());
    }

    @Test
    @DisplayName("Self dependency is a cycle of one")
    void selfLoop() {
        GraphAnalysis analysis = analyze(task("A", TaskStatus.TODO, "A"));

        assertEquals(List.of("A"), analysis.cycle().orElseThrow().path());
        assertTrue(analysis.metrics("A").cyclic());
    }

    @Test
    @DisplayName("Acyclic remainder is analyzed normally next to a cycle")
    void acyclicRemainder() {
        GraphAnalysis analysis = analyze(
                task("A", TaskStatus.TODO, "B"),
                task("B", TaskStatus.TODO, "A"),
                task("P", TaskStatus.TODO),
                task("Q", TaskStatus.TODO, "P"));

        assertEquals(Set.of("A", "B"), analysis.cyclicTaskIds());
        assertTrue(analysis.metrics("P").chainHead());
        assertEquals(1, analysis.metrics("P").unblockCount());
        assertEquals(1, analysis.metrics("Q").depth());
    }

    // =====================================================================
    // Long chains
    // =====================================================================

    @Test
    @DisplayName("Chain of 20000 tasks is analyzed without deep recursion")
    void longChain() {
        List<Task> tasks = chain(20_000);

        GraphAnalysis analysis = assertDoesNotThrow(() -> analyze(tasks));

        assertTrue(analysis.isAcyclic());
        assertTrue(analysis.metrics(chainId(19_999)).chainHead());
        assertEquals(0, analysis.metrics(chainId(19_999)).depth());
        assertEquals(19_999, analysis.metrics(chainId(0)).depth());
        assertEquals(1, analysis.metrics(chainId(19_999)).unblockCount());
    }

    @Test
    @DisplayName("Cycle through 20000 tasks flags every member")
    void longCycle() {
        List<Task> tasks = new ArrayList<>(chain(20_000));
        tasks.set(19_999, task(chainId(19_999), TaskStatus.TODO, chainId(0)));

        GraphAnalysis analysis = assertDoesNotThrow(() -> analyze(tasks));

        assertEquals(20_000, analysis.cyclicTaskIds().size());
        assertEquals(20_000, analysis.cycle().orElseThrow().path().size());
        assertEquals(-1, analysis.metrics(chainId(0)).depth());
    }

    @Test
    @DisplayName("Unknown task id is rejected")
    void unknownTask() {
        GraphAnalysis analysis = analyze(task("A", TaskStatus.TODO));

        assertThrows(TaskNotFoundException.class, () -> analysis.metrics("Z"));
    }

    // =====================================================================
    // Helper Methods
    // =====================================================================

    /**
     * A; B and C depend on A; D depends on B and C; E depends on A and the done X.
     */
    private List<Task> diamond() {
        return List.of(
                task("A", TaskStatus.TODO),
                task("B", TaskStatus.BLOCKED, "A"),
                task("C", TaskStatus.BLOCKED, "A"),
                task("D", TaskStatus.BLOCKED, "B", "C"),
                task("E", TaskStatus.BLOCKED, "A", "X"),
                task("X", TaskStatus.DONE));
    }

    /**
     * T000000 depends on T000001, which depends on T000002, and so on.
     */
    private List<Task> chain(int length) {
        List<Task> tasks = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            tasks.add(i + 1 < length
                    ? task(chainId(i), TaskStatus.TODO, chainId(i + 1))
                    : task(chainId(i), TaskStatus.TODO));
        }
        return tasks;
    }

    private static String chainId(int i) {
        return String.format("T%06d", i);
    }

    private GraphAnalysis analyze(Task... tasks) {
        return analyze(List.of(tasks));
    }

    private GraphAnalysis analyze(List<Task> tasks) {
        return analyzer.analyze(TaskSnapshot.of(1, AS_OF, tasks));
    }

    private Task task(String id, TaskStatus status, String... deps) {
        return Task.builder(id).status(status).dependsOn(deps).build();
    }
}
