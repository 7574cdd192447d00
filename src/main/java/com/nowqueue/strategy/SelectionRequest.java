package com.nowqueue.strategy;

/**
 * Constraints for one selection.
 *
 * @param timeboxMinutes        Hard budget on the sum of estimated minutes
 * @param k                     Hard maximum number of selected tasks
 * @param minSize               Soft minimum number of selected tasks
 * @param minCourses            Soft minimum number of distinct non-empty courses
 * @param heavyThresholdMinutes Estimate at or above which a task counts as heavy
 * @param maxHeavy              Hard maximum number of heavy tasks
 * @param wipCap                Hard maximum of tasks already in progress, null for none
 */
public record SelectionRequest(
        int timeboxMinutes,
        int k,
        int minSize,
        int minCourses,
        int heavyThresholdMinutes,
        int maxHeavy,
        Integer wipCap
) {

    public SelectionRequest {
        if (timeboxMinutes < 0) {
            throw new IllegalArgumentException("timebox must be non-negative, got " + timeboxMinutes);
        }
        if (k < 0) {
            throw new IllegalArgumentException("k must be non-negative, got " + k);
        }
        if (minCourses < 0 || maxHeavy < 0) {
            throw new IllegalArgumentException("min-courses and max-heavy must be non-negative");
        }
        minSize = Math.max(0, Math.min(minSize, k));
    }

    public boolean isHeavy(Candidate candidate) {
        return candidate.estMinutes() >= heavyThresholdMinutes;
    }

    /**
     * Copy of this request with a soft constraint switched off.
     */
    public SelectionRequest relax(RelaxedConstraint constraint) {
        return switch (constraint) {
            case MIN_COURSES -> new SelectionRequest(timeboxMinutes, k, minSize, 0,
                    heavyThresholdMinutes, maxHeavy, wipCap);
            case MIN_SIZE -> new SelectionRequest(timeboxMinutes, k, 0, minCourses,
                    heavyThresholdMinutes, maxHeavy, wipCap);
        };
    }

    /**
     * Request with only the capacity and cardinality constraints.
     */
    public static SelectionRequest of(int timeboxMinutes, int k) {
        return new SelectionRequest(timeboxMinutes, k, 0, 0, Integer.MAX_VALUE, Integer.MAX_VALUE, null);
    }
}
