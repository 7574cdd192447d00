package com.nowqueue.strategy;

/**
 * Soft selection constraints that may be relaxed when they cannot be met.
 */
public enum RelaxedConstraint {
    /**
     * Minimum number of distinct courses.
     */
    MIN_COURSES,

    /**
     * Minimum queue length.
     */
    MIN_SIZE
}
