package com.nowqueue.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Immutable task record as read from the task store.
 *
 * @param id         Unique, stable task id
 * @param course     Course label
 * @param title      Human-readable title
 * @param status     Lifecycle status
 * @param dueAt      Due timestamp, null when undefined
 * @param estMinutes Estimated effort in minutes (non-negative)
 * @param weight     Positive task weight (default 1.0)
 * @param category   Category key into the phase weight table
 * @param anchor     Whether the task carries fixed elevated priority
 * @param dependsOn  Ids of tasks this task depends on, sorted and distinct
 * @param createdAt  Creation timestamp, may be null
 * @param updatedAt  Last update timestamp, may be null
 */
public record Task(
        String id,
        String course,
        String title,
        TaskStatus status,
        Instant dueAt,
        int estMinutes,
        double weight,
        String category,
        boolean anchor,
        List<String> dependsOn,
        Instant createdAt,
        Instant updatedAt
) {

    public static final double DEFAULT_WEIGHT = 1.0;

    public Task {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id cannot be null or empty");
        }
        Objects.requireNonNull(status, "status cannot be null");
        if (estMinutes < 0) {
            throw new IllegalArgumentException("est_minutes must be non-negative for task " + id);
        }
        if (!(weight > 0.0) || Double.isInfinite(weight)) {
            throw new IllegalArgumentException("weight must be positive for task " + id);
        }
        course = course == null ? "" : course;
        title = title == null ? "" : title;
        category = category == null ? "" : category;
        dependsOn = dependsOn == null ? List.of() : List.copyOf(new TreeSet<>(dependsOn));
    }

    public boolean isDone() {
        return status.isDone();
    }

    public Task withStatus(TaskStatus newStatus, Instant at) {
        return new Task(id, course, title, newStatus, dueAt, estMinutes, weight, category,
                anchor, dependsOn, createdAt, at);
    }

    public Task withDependency(String dependencyId, Instant at) {
        List<String> deps = new ArrayList<>(dependsOn);
        deps.add(dependencyId);
        return new Task(id, course, title, status, dueAt, estMinutes, weight, category,
                anchor, deps, createdAt, at);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Builder for Task.
     */
    public static class Builder {
        private final String id;
        private String course = "";
        private String title = "";
        private TaskStatus status = TaskStatus.TODO;
        private Instant dueAt;
        private int estMinutes;
        private double weight = DEFAULT_WEIGHT;
        private String category = "";
        private boolean anchor;
        private final List<String> dependsOn = new ArrayList<>();
        private Instant createdAt;
        private Instant updatedAt;

        private Builder(String id) {
            this.id = id;
        }

        public Builder course(String course) {
            this.course = course;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder dueAt(Instant dueAt) {
            this.dueAt = dueAt;
            return this;
        }

        public Builder estMinutes(int estMinutes) {
            this.estMinutes = estMinutes;
            return this;
        }

        public Builder weight(double weight) {
            this.weight = weight;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder anchor(boolean anchor) {
            this.anchor = anchor;
            return this;
        }

        public Builder dependsOn(String... ids) {
            this.dependsOn.addAll(List.of(ids));
            return this;
        }

        public Builder dependsOn(Collection<String> ids) {
            this.dependsOn.addAll(ids);
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Task build() {
            return new Task(id, course, title, status, dueAt, estMinutes, weight, category,
                    anchor, dependsOn, createdAt, updatedAt);
        }
    }
}
