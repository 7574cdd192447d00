package com.nowqueue.engine;

import com.nowqueue.graph.DependencyEdge;
import com.nowqueue.graph.GraphAnalysis;

import java.util.List;

/**
 * Structural health of the task graph.
 *
 * @param dagOk           True when no dependency cycle exists
 * @param cyclePath       Ids along the first detected cycle, null when dagOk
 * @param breakSuggestion Edge suggested for removal, null when dagOk
 */
public record GraphHealth(boolean dagOk, List<String> cyclePath, DependencyEdge breakSuggestion) {

    public static GraphHealth of(GraphAnalysis analysis) {
        return analysis.cycle()
                .map(report -> new GraphHealth(false, report.path(), report.breakSuggestion()))
                .orElseGet(() -> new GraphHealth(true, null, null));
    }
}
