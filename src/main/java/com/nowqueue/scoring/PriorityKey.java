package com.nowqueue.scoring;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Ranking key for task comparison.
 * Encapsulates: Score + UnblockCount + ChainHead + DueAt + TaskId
 * <p>
 * Comparison order (first = higher priority):
 * 1. Score (higher first)
 * 2. UnblockCount (higher first)
 * 3. ChainHead (chain-heads first)
 * 4. DueAt (earlier first, missing due date last)
 * 5. TaskId (lexicographically smaller first)
 * <p>
 * Task ids are unique, so the order is total.
 */
public final class PriorityKey implements Comparable<PriorityKey> {

    /**
     * Tie-break order applied when scores are equal.
     */
    public static final Comparator<PriorityKey> TIE_BREAK = Comparator
            .comparingInt(PriorityKey::getUnblockCount).reversed()
            .thenComparing(PriorityKey::isChainHead, Comparator.reverseOrder())
            .thenComparing(PriorityKey::getDueAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing(PriorityKey::getTaskId);

    private final String taskId;
    private final double score;
    private final int unblockCount;
    private final boolean chainHead;
    private final Instant dueAt;

    public PriorityKey(String taskId, double score, int unblockCount, boolean chainHead, Instant dueAt) {
        this.taskId = Objects.requireNonNull(taskId, "taskId cannot be null");
        this.score = score;
        this.unblockCount = unblockCount;
        this.chainHead = chainHead;
        this.dueAt = dueAt;
    }

    public String getTaskId() {
        return taskId;
    }

    public double getScore() {
        return score;
    }

    public int getUnblockCount() {
        return unblockCount;
    }

    public boolean isChainHead() {
        return chainHead;
    }

    public Instant getDueAt() {
        return dueAt;
    }

    @Override
    public int compareTo(PriorityKey other) {
        // 1. Higher score wins
        int scoreCmp = Double.compare(other.score, this.score);
        if (scoreCmp != 0) {
            return scoreCmp;
        }
        // 2-5. Tie-break
        return TIE_BREAK.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PriorityKey that = (PriorityKey) o;
        return Double.compare(score, that.score) == 0 &&
                unblockCount == that.unblockCount &&
                chainHead == that.chainHead &&
                Objects.equals(dueAt, that.dueAt) &&
                taskId.equals(that.taskId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskId, score, unblockCount, chainHead, dueAt);
    }

    @Override
    public String toString() {
        return "PriorityKey{" +
                "task=" + taskId +
                ", score=" + score +
                ", unblockCount=" + unblockCount +
                ", chainHead=" + chainHead +
                ", dueAt=" + dueAt +
                '}';
    }
}
