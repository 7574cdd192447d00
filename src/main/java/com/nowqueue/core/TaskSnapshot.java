package com.nowqueue.core;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable point-in-time view of the task store.
 * Read once at the start of a computation and never re-read mid-computation.
 * Tasks are held in ascending id order.
 */
public final class TaskSnapshot {

    private final long version;
    private final Instant asOf;
    private final Map<String, Task> tasks;

    private TaskSnapshot(long version, Instant asOf, Map<String, Task> tasks) {
        this.version = version;
        this.asOf = asOf;
        this.tasks = tasks;
    }

    public static TaskSnapshot of(long version, Instant asOf, Collection<Task> tasks) {
        Objects.requireNonNull(asOf, "asOf cannot be null");
        Map<String, Task> byId = new LinkedHashMap<>();
        tasks.stream()
                .sorted((a, b) -> a.id().compareTo(b.id()))
                .forEach(t -> {
                    if (byId.putIfAbsent(t.id(), t) != null) {
                        throw new IllegalArgumentException("Duplicate task id in snapshot: " + t.id());
                    }
                });
        return new TaskSnapshot(version, asOf, Collections.unmodifiableMap(byId));
    }

    public long version() {
        return version;
    }

    /**
     * Reference instant used for all time-dependent computation on this snapshot.
     */
    public Instant asOf() {
        return asOf;
    }

    public List<Task> tasks() {
        return List.copyOf(tasks.values());
    }

    public Optional<Task> find(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public boolean contains(String taskId) {
        return tasks.containsKey(taskId);
    }

    public int size() {
        return tasks.size();
    }

    public Set<String> courses() {
        return tasks.values().stream()
                .map(Task::course)
                .filter(c -> !c.isEmpty())
                .collect(Collectors.toCollection(TreeSet::new));
    }

    public Map<String, Task> asMap() {
        return tasks;
    }

    @Override
    public String toString() {
        return "TaskSnapshot{version=" + version + ", asOf=" + asOf + ", tasks=" + tasks.size() + '}';
    }
}
