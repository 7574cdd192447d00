package com.nowqueue.exception;

import com.nowqueue.core.TaskStatus;

/**
 * Exception thrown when a status change is not permitted by the task lifecycle.
 * No partial mutation takes place.
 */
public class InvalidTransitionException extends NowQueueException {

    private final String taskId;
    private final TaskStatus from;
    private final TaskStatus to;

    public InvalidTransitionException(String taskId, TaskStatus from, TaskStatus to) {
        super("Invalid transition for task " + taskId + ": " + from + " -> " + to);
        this.taskId = taskId;
        this.from = from;
        this.to = to;
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskStatus getFrom() {
        return from;
    }

    public TaskStatus getTo() {
        return to;
    }
}
