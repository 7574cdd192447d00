package com.nowqueue.graph;

/**
 * Directed dependency edge: {@code taskId} depends on {@code dependsOnId}.
 */
public record DependencyEdge(String taskId, String dependsOnId) {

    @Override
    public String toString() {
        return taskId + " -> " + dependsOnId;
    }
}
