package com.nowqueue.graph;

import com.nowqueue.core.TaskSnapshot;
import com.nowqueue.exception.GraphCycleException;
import com.nowqueue.exception.TaskNotFoundException;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Result of analyzing one snapshot: per-task metrics plus cycle diagnostics.
 */
public final class GraphAnalysis {

    private final TaskSnapshot snapshot;
    private final DependencyGraph graph;
    private final TaskMetrics[] metrics;
    private final CycleReport cycle;

    GraphAnalysis(TaskSnapshot snapshot, DependencyGraph graph, TaskMetrics[] metrics, CycleReport cycle) {
        this.snapshot = snapshot;
        this.graph = graph;
        this.metrics = metrics;
        this.cycle = cycle;
    }

    public TaskSnapshot snapshot() {
        return snapshot;
    }

    public DependencyGraph graph() {
        return graph;
    }

    public TaskMetrics metrics(String taskId) {
        int index = graph.indexOf(taskId);
        if (index < 0) {
            throw new TaskNotFoundException(taskId);
        }
        return metrics[index];
    }

    public TaskMetrics metrics(int index) {
        return metrics[index];
    }

    /**
     * Metrics for all tasks in ascending id order.
     */
    public List<TaskMetrics> allMetrics() {
        return List.of(metrics);
    }

    public boolean isAcyclic() {
        return cycle == null;
    }

    public Optional<CycleReport> cycle() {
        return Optional.ofNullable(cycle);
    }

    /**
     * Ids of every task lying on some cycle.
     */
    public Set<String> cyclicTaskIds() {
        return allMetrics().stream()
                .filter(TaskMetrics::cyclic)
                .map(TaskMetrics::taskId)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * @throws GraphCycleException if a cycle was detected
     */
    public void requireAcyclic() {
        if (cycle != null) {
            throw new GraphCycleException(cycle);
        }
    }
}
