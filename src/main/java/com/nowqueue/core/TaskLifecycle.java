package com.nowqueue.core;

import com.nowqueue.exception.InvalidTransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Status state machine for tasks.
 * <p>
 * Rules:
 * - Ordinary transitions move exactly one step along BLOCKED -> TODO -> DOING -> REVIEW -> DONE
 * - DONE is terminal for ordinary transitions; leaving it requires {@link #reopen}
 * - BLOCKED is re-entered only through {@link #block} (dependency added) or {@link #reopen}
 * <p>
 * All operations return a new Task and never mutate their input.
 */
public final class TaskLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TaskLifecycle.class);

    private TaskLifecycle() {
    }

    public static boolean isAllowed(TaskStatus from, TaskStatus to) {
        return from.next().map(next -> next == to).orElse(false);
    }

    /**
     * Apply an ordinary transition.
     *
     * @throws InvalidTransitionException if the move is not a single forward step
     */
    public static Task transition(Task task, TaskStatus to, Instant at) {
        if (!isAllowed(task.status(), to)) {
            throw new InvalidTransitionException(task.id(), task.status(), to);
        }
        log.debug("Task {} transition {} -> {}", task.id(), task.status(), to);
        return task.withStatus(to, at);
    }

    /**
     * Reopen a completed task. Lands on TODO, or BLOCKED when one of its
     * dependencies is still open.
     *
     * @throws InvalidTransitionException if the task is not DONE
     */
    public static Task reopen(Task task, boolean dependenciesDone, Instant at) {
        if (!task.isDone()) {
            throw new InvalidTransitionException(task.id(), task.status(), TaskStatus.TODO);
        }
        TaskStatus target = dependenciesDone ? TaskStatus.TODO : TaskStatus.BLOCKED;
        log.info("Reopening task {} as {}", task.id(), target);
        return task.withStatus(target, at);
    }

    /**
     * Move an open task back to BLOCKED after it gained an unfinished dependency.
     *
     * @throws InvalidTransitionException if the task is DONE
     */
    public static Task block(Task task, Instant at) {
        if (task.isDone()) {
            throw new InvalidTransitionException(task.id(), task.status(), TaskStatus.BLOCKED);
        }
        if (task.status() == TaskStatus.BLOCKED) {
            return task;
        }
        log.debug("Task {} blocked (was {})", task.id(), task.status());
        return task.withStatus(TaskStatus.BLOCKED, at);
    }
}
