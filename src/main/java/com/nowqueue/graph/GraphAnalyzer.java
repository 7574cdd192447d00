package com.nowqueue.graph;

import com.nowqueue.core.TaskSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Builds the dependency graph of a snapshot and computes per-task facts.
 * <p>
 * Cycles are reported, never fatal: tasks on a cycle are flagged and the
 * rest of the graph is analyzed normally.
 */
public class GraphAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(GraphAnalyzer.class);

    private static final int UNVISITED = 0;
    private static final int ON_STACK = 1;
    private static final int FINISHED = 2;

    public GraphAnalysis analyze(TaskSnapshot snapshot) {
        DependencyGraph graph = DependencyGraph.build(snapshot);
        int n = graph.size();

        CycleReport cycle = findCycle(graph);
        boolean[] cyclic = new boolean[n];
        int[] order = stronglyConnected(graph, cyclic);

        boolean[] chainHead = new boolean[n];
        for (int i = 0; i < n; i++) {
            chainHead[i] = allDone(graph, graph.dependenciesView(i), -1);
        }

        int[] depth = depths(graph, order, chainHead, cyclic);
        TaskMetrics[] metrics = new TaskMetrics[n];
        for (int i = 0; i < n; i++) {
            metrics[i] = new TaskMetrics(graph.id(i), chainHead[i], unblockCount(graph, i), depth[i], cyclic[i]);
        }

        if (cycle != null) {
            log.warn("Dependency cycle detected: {} (suggest removing {})",
                    String.join(" -> ", cycle.path()), cycle.breakSuggestion());
        }
        log.debug("Analyzed {} tasks (snapshot v{}), acyclic={}", n, snapshot.version(), cycle == null);
        return new GraphAnalysis(snapshot, graph, metrics, cycle);
    }

    /**
     * Count dependents for which {@code index} is the last unfinished dependency,
     * whatever their own status. Completing one task can only promote its direct
     * dependents: a deeper descendant still waits on the intermediate task.
     */
    private int unblockCount(DependencyGraph graph, int index) {
        if (graph.isDone(index)) {
            return 0;
        }
        int count = 0;
        for (int dependent : graph.dependentsView(index)) {
            if (allDone(graph, graph.dependenciesView(dependent), index)) {
                count++;
            }
        }
        return count;
    }

    private static boolean allDone(DependencyGraph graph, int[] deps, int ignored) {
        for (int dep : deps) {
            if (dep != ignored && !graph.isDone(dep)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Depths in component completion order, which places every dependency of an
     * acyclic task before the task itself.
     */
    private int[] depths(DependencyGraph graph, int[] order, boolean[] chainHead, boolean[] cyclic) {
        int[] depth = new int[graph.size()];
        for (int index : order) {
            if (cyclic[index]) {
                depth[index] = -1;
                continue;
            }
            int result = 0;
            if (!chainHead[index]) {
                for (int dep : graph.dependenciesView(index)) {
                    if (graph.isDone(dep)) {
                        continue;
                    }
                    if (depth[dep] < 0) {
                        result = -1;
                        break;
                    }
                    result = Math.max(result, depth[dep] + 1);
                }
            }
            depth[index] = result;
        }
        return depth;
    }

    /**
     * Depth-first search along depends_on edges with an on-stack marker.
     * Returns the first cycle found, rotated to start at its lowest id.
     */
    private CycleReport findCycle(DependencyGraph graph) {
        int n = graph.size();
        int[] state = new int[n];
        int[] nextEdge = new int[n];
        Deque<Integer> stack = new ArrayDeque<>();

        for (int root = 0; root < n; root++) {
            if (state[root] != UNVISITED) {
                continue;
            }
            stack.push(root);
            state[root] = ON_STACK;
            while (!stack.isEmpty()) {
                int u = stack.peek();
                int[] deps = graph.dependenciesView(u);
                if (nextEdge[u] < deps.length) {
                    int v = deps[nextEdge[u]++];
                    if (state[v] == UNVISITED) {
                        state[v] = ON_STACK;
                        stack.push(v);
                    } else if (state[v] == ON_STACK) {
                        return toReport(graph, stack, v);
                    }
                } else {
                    state[u] = FINISHED;
                    stack.pop();
                }
            }
        }
        return null;
    }

    private CycleReport toReport(DependencyGraph graph, Deque<Integer> stack, int start) {
        // stack iterates top-down; the cycle is the segment from start up to the top
        List<Integer> segment = new ArrayList<>();
        for (int node : stack) {
            segment.add(node);
            if (node == start) {
                break;
            }
        }
        Collections.reverse(segment);
        int lowest = 0;
        for (int i = 1; i < segment.size(); i++) {
            if (segment.get(i) < segment.get(lowest)) {
                lowest = i;
            }
        }
        List<Integer> rotated = new ArrayList<>(segment.size());
        for (int i = 0; i < segment.size(); i++) {
            rotated.add(segment.get((lowest + i) % segment.size()));
        }

        DependencyEdge suggestion = null;
        double bestWeight = Double.POSITIVE_INFINITY;
        for (int i = 0; i < rotated.size(); i++) {
            int from = rotated.get(i);
            int to = rotated.get((i + 1) % rotated.size());
            double combined = graph.task(from).weight() + graph.task(to).weight();
            if (combined < bestWeight) {
                bestWeight = combined;
                suggestion = new DependencyEdge(graph.id(from), graph.id(to));
            }
        }
        return new CycleReport(rotated.stream().map(graph::id).toList(), suggestion);
    }

    /**
     * Tarjan's strongly connected components with an explicit call stack. Flags nodes
     * lying on a cycle (members of components with more than one node, or nodes
     * depending on themselves) and returns all nodes in component completion order.
     */
    private int[] stronglyConnected(DependencyGraph graph, boolean[] cyclic) {
        int n = graph.size();
        int[] index = new int[n];
        int[] low = new int[n];
        int[] nextEdge = new int[n];
        boolean[] onStack = new boolean[n];
        Arrays.fill(index, -1);
        int counter = 0;
        int[] order = new int[n];
        int emitted = 0;
        Deque<Integer> components = new ArrayDeque<>();
        Deque<Integer> calls = new ArrayDeque<>();

        for (int root = 0; root < n; root++) {
            if (index[root] != -1) {
                continue;
            }
            index[root] = counter;
            low[root] = counter++;
            components.push(root);
            onStack[root] = true;
            calls.push(root);

            while (!calls.isEmpty()) {
                int v = calls.peek();
                int[] deps = graph.dependenciesView(v);
                if (nextEdge[v] < deps.length) {
                    int w = deps[nextEdge[v]++];
                    if (w == v) {
                        cyclic[v] = true;
                    }
                    if (index[w] == -1) {
                        index[w] = counter;
                        low[w] = counter++;
                        components.push(w);
                        onStack[w] = true;
                        calls.push(w);
                    } else if (onStack[w]) {
                        low[v] = Math.min(low[v], index[w]);
                    }
                    continue;
                }

                calls.pop();
                if (low[v] == index[v]) {
                    int size = 0;
                    int w;
                    do {
                        w = components.pop();
                        onStack[w] = false;
                        order[emitted + size++] = w;
                    } while (w != v);
                    if (size > 1) {
                        for (int i = emitted; i < emitted + size; i++) {
                            cyclic[order[i]] = true;
                        }
                    }
                    emitted += size;
                }
                if (!calls.isEmpty()) {
                    int parent = calls.peek();
                    low[parent] = Math.min(low[parent], low[v]);
                }
            }
        }
        return order;
    }
}
