package com.nowqueue.graph;

/**
 * Graph facts about one task.
 *
 * @param taskId       Task id
 * @param chainHead    True iff every dependency is done, whatever the task's own status
 * @param unblockCount Tasks, done ones included, that become chain-heads if this task
 *                     alone is completed
 * @param depth        Longest chain of open dependencies down to a chain-head,
 *                     -1 when the chain runs into a cycle
 * @param cyclic       True if the task lies on a dependency cycle
 */
public record TaskMetrics(
        String taskId,
        boolean chainHead,
        int unblockCount,
        int depth,
        boolean cyclic
) {
}
