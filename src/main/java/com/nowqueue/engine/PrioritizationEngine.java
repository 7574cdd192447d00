package com.nowqueue.engine;

import com.nowqueue.explain.UnblockingCut;
import com.nowqueue.scheduler.NowQueue;
import com.nowqueue.scoring.FactorBreakdown;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Future;

/**
 * Caller-facing operations of the prioritization engine.
 * <p>
 * Every refresh reads one snapshot from the task store and computes graph facts,
 * scores and the Now Queue from it alone. The engine never writes task state.
 */
public interface PrioritizationEngine {

    /**
     * Compute a new Now Queue and make it current.
     *
     * @param timeboxMinutes Total minutes budget
     * @param k              Maximum number of tasks
     * @param minCourses     Distinct courses to represent when achievable
     * @param coursesFilter  Courses to draw candidates from, empty or null for all
     * @return The computed queue
     */
    NowQueue refresh(int timeboxMinutes, int k, int minCourses, Set<String> coursesFilter);

    /**
     * Refresh with the configured defaults and no course filter.
     */
    NowQueue refresh();

    /**
     * Refresh on a background thread. Cancelling the future discards the result
     * and leaves the current queue in place.
     */
    Future<NowQueue> refreshAsync(int timeboxMinutes, int k, int minCourses, Set<String> coursesFilter);

    /**
     * The latest queue, if any refresh has completed.
     */
    Optional<NowQueue> currentQueue();

    /**
     * Factor breakdown of a task, from the latest refresh.
     *
     * @throws com.nowqueue.exception.TaskNotFoundException if the task is unknown
     * @throws com.nowqueue.exception.GraphCycleException   if the task lies on a cycle
     */
    FactorBreakdown explain(String taskId);

    /**
     * Open ancestors that must finish before the task becomes actionable.
     *
     * @throws com.nowqueue.exception.TaskNotFoundException if the task is unknown
     * @throws com.nowqueue.exception.GraphCycleException   if the task lies on a cycle
     */
    UnblockingCut minimalUnblockingCut(String taskId);

    /**
     * Cycle diagnostics for the store's current state.
     */
    GraphHealth health();

    /**
     * Stop background threads.
     */
    void shutdown();
}
