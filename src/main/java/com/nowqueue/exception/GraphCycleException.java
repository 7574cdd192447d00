package com.nowqueue.exception;

import com.nowqueue.graph.CycleReport;

import java.util.List;

/**
 * Exception thrown when the dependency graph is not acyclic.
 * Carries the exact cycle path and the edge suggested for removal.
 */
public class GraphCycleException extends NowQueueException {

    private final CycleReport report;

    public GraphCycleException(CycleReport report) {
        super("Dependency cycle detected: " + String.join(" -> ", report.path())
                + " (suggest removing " + report.breakSuggestion() + ")");
        this.report = report;
    }

    public CycleReport getReport() {
        return report;
    }

    public List<String> getCyclePath() {
        return report.path();
    }
}
