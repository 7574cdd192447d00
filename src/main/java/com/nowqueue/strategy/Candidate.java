package com.nowqueue.strategy;

import com.nowqueue.core.TaskStatus;
import com.nowqueue.scoring.PriorityKey;

import java.util.Objects;

/**
 * A task eligible for the Now Queue.
 *
 * @param taskId     Task id
 * @param course     Course label, empty when unknown
 * @param estMinutes Estimated minutes
 * @param status     Current status
 * @param key        Ranking key (carries the score)
 */
public record Candidate(
        String taskId,
        String course,
        int estMinutes,
        TaskStatus status,
        PriorityKey key
) implements Comparable<Candidate> {

    public Candidate {
        Objects.requireNonNull(taskId, "taskId cannot be null");
        Objects.requireNonNull(key, "key cannot be null");
        course = course == null ? "" : course;
    }

    public double score() {
        return key.getScore();
    }

    public boolean hasCourse() {
        return !course.isEmpty();
    }

    @Override
    public int compareTo(Candidate other) {
        return key.compareTo(other.key);
    }
}
