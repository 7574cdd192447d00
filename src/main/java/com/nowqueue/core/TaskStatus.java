package com.nowqueue.core;

import java.util.Locale;
import java.util.Optional;

/**
 * Task status. The ordinary lifecycle is linear:
 * BLOCKED -> TODO -> DOING -> REVIEW -> DONE.
 */
public enum TaskStatus {

    BLOCKED,
    TODO,
    DOING,
    REVIEW,
    DONE;

    /**
     * The only status an ordinary transition may move to, empty for DONE.
     */
    public Optional<TaskStatus> next() {
        return switch (this) {
            case BLOCKED -> Optional.of(TODO);
            case TODO -> Optional.of(DOING);
            case DOING -> Optional.of(REVIEW);
            case REVIEW -> Optional.of(DONE);
            case DONE -> Optional.empty();
        };
    }

    public boolean isDone() {
        return this == DONE;
    }

    /**
     * Parse a status label. Accepts "in_progress" as an alias of DOING.
     */
    public static TaskStatus parse(String value) {
        if (value == null || value.isBlank()) {
            return TODO;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if (normalized.equals("IN_PROGRESS")) {
            return DOING;
        }
        return TaskStatus.valueOf(normalized);
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
