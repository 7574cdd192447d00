package com.nowqueue.exception;

/**
 * Exception thrown when a task id is not present in the snapshot.
 */
public class TaskNotFoundException extends NowQueueException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("Task not found: " + taskId);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
