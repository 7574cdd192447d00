package com.nowqueue.core;

import com.nowqueue.exception.InvalidTransitionException;
import com.nowqueue.exception.TaskNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Copy-on-write task store held in memory.
 * Every mutation publishes a new immutable state with a higher version, so snapshots
 * taken concurrently are never affected by later writes.
 */
public class InMemoryTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskStore.class);

    private record State(long version, Map<String, Task> tasks) {
    }

    private final AtomicReference<State> state;
    private final Clock clock;

    public InMemoryTaskStore(Clock clock) {
        this(clock, List.of());
    }

    public InMemoryTaskStore(Clock clock, Collection<Task> initial) {
        this.clock = clock;
        Map<String, Task> tasks = new LinkedHashMap<>();
        for (Task task : initial) {
            tasks.put(task.id(), task);
        }
        this.state = new AtomicReference<>(new State(0, Collections.unmodifiableMap(tasks)));
        log.info("InMemoryTaskStore initialized with {} tasks", tasks.size());
    }

    @Override
    public TaskSnapshot snapshot(Instant asOf) {
        State current = state.get();
        return TaskSnapshot.of(current.version(), asOf, current.tasks().values());
    }

    public long version() {
        return state.get().version();
    }

    public Task get(String taskId) {
        Task task = state.get().tasks().get(taskId);
        if (task == null) {
            throw new TaskNotFoundException(taskId);
        }
        return task;
    }

    /**
     * Insert or replace a task.
     */
    public void put(Task task) {
        mutate(tasks -> {
            tasks.put(task.id(), task);
            return tasks;
        });
    }

    /**
     * Apply an ordinary lifecycle transition.
     *
     * @throws InvalidTransitionException if the lifecycle does not permit the move
     */
    public Task updateStatus(String taskId, TaskStatus to) {
        return update(taskId, (tasks, task) -> TaskLifecycle.transition(task, to, clock.instant()));
    }

    /**
     * Reopen a completed task through the explicit reopen path.
     */
    public Task reopen(String taskId) {
        return update(taskId, (tasks, task) ->
                TaskLifecycle.reopen(task, dependenciesDone(tasks, task), clock.instant()));
    }

    /**
     * Add a dependency edge. An open task that gains an unfinished dependency is blocked.
     */
    public Task addDependency(String taskId, String dependencyId) {
        return update(taskId, (tasks, task) -> {
            Task dependency = tasks.get(dependencyId);
            if (dependency == null) {
                throw new TaskNotFoundException(dependencyId);
            }
            Instant now = clock.instant();
            Task updated = task.withDependency(dependencyId, now);
            if (!updated.isDone() && !dependency.isDone()) {
                updated = TaskLifecycle.block(updated, now);
            }
            return updated;
        });
    }

    private interface TaskUpdate {
        Task apply(Map<String, Task> tasks, Task task);
    }

    private Task update(String taskId, TaskUpdate update) {
        Task[] result = new Task[1];
        mutate(tasks -> {
            Task task = tasks.get(taskId);
            if (task == null) {
                throw new TaskNotFoundException(taskId);
            }
            Task updated = update.apply(tasks, task);
            tasks.put(taskId, updated);
            result[0] = updated;
            return tasks;
        });
        return result[0];
    }

    private void mutate(UnaryOperator<Map<String, Task>> change) {
        state.updateAndGet(current -> {
            Map<String, Task> copy = change.apply(new LinkedHashMap<>(current.tasks()));
            return new State(current.version() + 1, Collections.unmodifiableMap(copy));
        });
    }

    private static boolean dependenciesDone(Map<String, Task> tasks, Task task) {
        return task.dependsOn().stream()
                .map(tasks::get)
                .allMatch(dep -> dep == null || dep.isDone());
    }
}
