package com.nowqueue.strategy;

/**
 * Available Now Queue selection strategies.
 */
public enum StrategyType {
    /**
     * Exact Strategy: branch and bound over the 0/1 selection problem.
     * Optimal for small candidate sets; runs under a wall-clock budget.
     */
    EXACT,

    /**
     * Greedy Strategy: rank-ordered fill followed by a bounded diversity repair.
     * Always available; used as the fallback of EXACT.
     */
    GREEDY
}
