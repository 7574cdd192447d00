package com.nowqueue.graph;

import com.nowqueue.core.Task;
import com.nowqueue.core.TaskSnapshot;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dependency graph over a flat task array.
 * Tasks are addressed by index; indices follow ascending task id, and adjacency
 * lists are sorted, so every traversal visits nodes in the same order.
 * Dependencies on ids missing from the snapshot are ignored.
 */
public final class DependencyGraph {

    private final List<Task> tasks;
    private final Map<String, Integer> indexById;
    private final int[][] dependencies;
    private final int[][] dependents;

    private DependencyGraph(List<Task> tasks, Map<String, Integer> indexById,
                            int[][] dependencies, int[][] dependents) {
        this.tasks = tasks;
        this.indexById = indexById;
        this.dependencies = dependencies;
        this.dependents = dependents;
    }

    public static DependencyGraph build(TaskSnapshot snapshot) {
        List<Task> tasks = snapshot.tasks();
        int n = tasks.size();
        Map<String, Integer> indexById = new HashMap<>(n * 2);
        for (int i = 0; i < n; i++) {
            indexById.put(tasks.get(i).id(), i);
        }

        int[][] dependencies = new int[n][];
        List<List<Integer>> reverse = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            reverse.add(new ArrayList<>());
        }
        for (int i = 0; i < n; i++) {
            dependencies[i] = tasks.get(i).dependsOn().stream()
                    .map(indexById::get)
                    .filter(j -> j != null)
                    .mapToInt(Integer::intValue)
                    .sorted()
                    .toArray();
            for (int j : dependencies[i]) {
                reverse.get(j).add(i);
            }
        }

        int[][] dependents = new int[n][];
        for (int i = 0; i < n; i++) {
            // filled in ascending i, already sorted
            dependents[i] = reverse.get(i).stream().mapToInt(Integer::intValue).toArray();
        }
        return new DependencyGraph(tasks, indexById, dependencies, dependents);
    }

    public int size() {
        return tasks.size();
    }

    public Task task(int index) {
        return tasks.get(index);
    }

    public String id(int index) {
        return tasks.get(index).id();
    }

    /**
     * Index of a task id, or -1 if absent.
     */
    public int indexOf(String taskId) {
        Integer index = indexById.get(taskId);
        return index != null ? index : -1;
    }

    public boolean isDone(int index) {
        return tasks.get(index).isDone();
    }

    public int[] dependenciesOf(int index) {
        return Arrays.copyOf(dependencies[index], dependencies[index].length);
    }

    public int[] dependentsOf(int index) {
        return Arrays.copyOf(dependents[index], dependents[index].length);
    }

    int[] dependenciesView(int index) {
        return dependencies[index];
    }

    int[] dependentsView(int index) {
        return dependents[index];
    }
}
