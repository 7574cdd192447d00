package com.nowqueue.exception;

/**
 * Exception thrown when the exact selection strategy exceeds its time budget.
 * Always recovered by falling back to the greedy strategy.
 */
public class SolverTimeoutException extends NowQueueException {

    private final long timeoutMs;

    public SolverTimeoutException(long timeoutMs) {
        super("Exact solver exceeded its budget of " + timeoutMs + " ms");
        this.timeoutMs = timeoutMs;
    }

    public SolverTimeoutException(long timeoutMs, Throwable cause) {
        super("Exact solver exceeded its budget of " + timeoutMs + " ms", cause);
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
