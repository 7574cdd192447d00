package com.nowqueue.scheduler;

/**
 * One row of the Now Queue.
 *
 * @param position   1-based position, by descending score
 * @param taskId     Task id
 * @param course     Course label, empty when unknown
 * @param title      Task title
 * @param estMinutes Estimated minutes
 * @param score      Priority score
 * @param reason     Inclusion annotation
 */
public record QueueEntry(
        int position,
        String taskId,
        String course,
        String title,
        int estMinutes,
        double score,
        InclusionReason reason
) {
}
