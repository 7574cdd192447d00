package com.nowqueue.graph;

import java.util.List;

/**
 * A detected dependency cycle.
 *
 * @param path            Task ids along depends_on edges, starting from the lowest id
 * @param breakSuggestion Edge on the cycle whose removal breaks it, with the lowest
 *                        combined weight of its two tasks
 */
public record CycleReport(List<String> path, DependencyEdge breakSuggestion) {

    public CycleReport {
        path = List.copyOf(path);
    }
}
