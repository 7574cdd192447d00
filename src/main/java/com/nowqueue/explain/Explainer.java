package com.nowqueue.explain;

import com.nowqueue.exception.GraphCycleException;
import com.nowqueue.graph.CycleReport;
import com.nowqueue.graph.DependencyGraph;
import com.nowqueue.graph.GraphAnalysis;
import com.nowqueue.graph.TaskMetrics;
import com.nowqueue.scoring.FactorBreakdown;
import com.nowqueue.scoring.ScoringEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Answers "why this score" and "what has to finish first" for a single task.
 * <p>
 * Dependencies are conjunctive, so the minimal unblocking cut is every open task
 * reachable over depends_on edges through open tasks. Done tasks end the walk:
 * their own ancestry no longer matters.
 */
public class Explainer {

    private static final Logger log = LoggerFactory.getLogger(Explainer.class);

    private final ScoringEngine scoringEngine;

    public Explainer(ScoringEngine scoringEngine) {
        this.scoringEngine = scoringEngine;
    }

    /**
     * Factor breakdown of one task.
     *
     * @throws com.nowqueue.exception.TaskNotFoundException if the task is not in the analysis
     * @throws GraphCycleException                          if the task lies on a cycle
     */
    public FactorBreakdown explain(GraphAnalysis analysis, String taskId, String phase) {
        TaskMetrics metrics = analysis.metrics(taskId);
        requireNotCyclic(analysis, metrics);
        int index = analysis.graph().indexOf(taskId);
        return scoringEngine.score(analysis.graph().task(index), metrics, phase, analysis.snapshot().asOf());
    }

    /**
     * Minimal set of open ancestors blocking the task.
     *
     * @throws com.nowqueue.exception.TaskNotFoundException if the task is not in the analysis
     * @throws GraphCycleException                          if the task itself lies on a cycle
     */
    public UnblockingCut minimalUnblockingCut(GraphAnalysis analysis, String taskId) {
        TaskMetrics target = analysis.metrics(taskId);
        requireNotCyclic(analysis, target);
        if (target.chainHead()) {
            return UnblockingCut.of(taskId, List.of());
        }

        DependencyGraph graph = analysis.graph();
        int start = graph.indexOf(taskId);
        boolean[] seen = new boolean[graph.size()];
        seen[start] = true;
        Deque<Integer> pending = new ArrayDeque<>();
        pending.push(start);
        List<Integer> ancestors = new ArrayList<>();

        while (!pending.isEmpty()) {
            int node = pending.pop();
            for (int dependency : graph.dependenciesOf(node)) {
                if (seen[dependency] || graph.isDone(dependency)) {
                    continue;
                }
                seen[dependency] = true;
                if (analysis.metrics(dependency).cyclic()) {
                    log.debug("Ancestry of {} reaches cyclic task {}", taskId, graph.id(dependency));
                    return UnblockingCut.unreachable(taskId);
                }
                ancestors.add(dependency);
                pending.push(dependency);
            }
        }

        ancestors.sort(Comparator
                .comparingInt((Integer i) -> analysis.metrics(i).depth())
                .thenComparing(graph::id));
        List<String> ids = ancestors.stream().map(graph::id).toList();
        log.debug("Minimal unblocking cut of {}: {}", taskId, ids);
        return UnblockingCut.of(taskId, ids);
    }

    private static void requireNotCyclic(GraphAnalysis analysis, TaskMetrics metrics) {
        if (metrics.cyclic()) {
            CycleReport report = analysis.cycle()
                    .orElseThrow(() -> new IllegalStateException("Cyclic task without a cycle report"));
            throw new GraphCycleException(report);
        }
    }
}
