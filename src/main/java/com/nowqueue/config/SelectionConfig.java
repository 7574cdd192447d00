package com.nowqueue.config;

import com.nowqueue.exception.ConfigurationException;
import com.nowqueue.strategy.StrategyType;

/**
 * Now Queue selection settings.
 *
 * @param strategy              Preferred selection strategy
 * @param exactSolverEnabled    Whether the exact strategy may run at all
 * @param solverTimeoutMs       Wall-clock budget of the exact strategy
 * @param defaultK              Default maximum queue length
 * @param defaultTimeboxMinutes Default total minutes budget
 * @param minCourses            Default number of distinct courses to represent
 * @param minSize               Minimum queue length when enough candidates exist
 * @param heavyThresholdMinutes Estimate at or above which a task counts as heavy
 * @param maxHeavy              Maximum number of heavy tasks in the queue
 * @param wipCap                Maximum number of tasks already in progress, null for no cap
 */
public record SelectionConfig(
        StrategyType strategy,
        boolean exactSolverEnabled,
        long solverTimeoutMs,
        int defaultK,
        int defaultTimeboxMinutes,
        int minCourses,
        int minSize,
        int heavyThresholdMinutes,
        int maxHeavy,
        Integer wipCap
) {

    public SelectionConfig {
        strategy = strategy != null ? strategy : StrategyType.EXACT;
        if (solverTimeoutMs <= 0) {
            throw new ConfigurationException("solver-timeout-ms must be positive, got " + solverTimeoutMs);
        }
        if (defaultK < 1) {
            throw new ConfigurationException("default-k must be at least 1, got " + defaultK);
        }
        if (defaultTimeboxMinutes < 0) {
            throw new ConfigurationException("default-timebox-minutes must be non-negative");
        }
        if (minCourses < 0 || minSize < 0 || maxHeavy < 0) {
            throw new ConfigurationException("min-courses, min-size and max-heavy must be non-negative");
        }
        if (minSize > defaultK) {
            throw new ConfigurationException("min-size (" + minSize + ") exceeds default-k (" + defaultK + ")");
        }
        if (heavyThresholdMinutes <= 0) {
            throw new ConfigurationException("heavy-threshold-minutes must be positive");
        }
        if (wipCap != null && wipCap < 0) {
            throw new ConfigurationException("wip-cap must be non-negative");
        }
    }

    /**
     * Strategy that will actually be tried first.
     */
    public StrategyType effectiveStrategy() {
        return exactSolverEnabled ? strategy : StrategyType.GREEDY;
    }

    public static SelectionConfig defaults() {
        return new SelectionConfig(StrategyType.EXACT, true, 2000, 3, 90, 2, 1, 60, 1, 3);
    }
}
