package com.nowqueue.explain;

import java.util.List;

/**
 * Open ancestors that must all be done before a task becomes actionable.
 *
 * @param taskId    Target task
 * @param reachable False when the ancestry runs into a dependency cycle; the
 *                  task can then never become actionable and {@code taskIds} is empty
 * @param taskIds   Open ancestors in a valid completion order (shallowest first, then id)
 */
public record UnblockingCut(String taskId, boolean reachable, List<String> taskIds) {

    public UnblockingCut {
        taskIds = List.copyOf(taskIds);
    }

    public static UnblockingCut of(String taskId, List<String> taskIds) {
        return new UnblockingCut(taskId, true, taskIds);
    }

    public static UnblockingCut unreachable(String taskId) {
        return new UnblockingCut(taskId, false, List.of());
    }

    public boolean isEmpty() {
        return reachable && taskIds.isEmpty();
    }

    public int size() {
        return taskIds.size();
    }
}
