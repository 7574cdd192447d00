package com.nowqueue.strategy;

import java.util.List;

/**
 * Strategy interface for choosing the Now Queue out of the ranked candidates.
 * <p>
 * Scores are computed once per refresh by the scoring engine; the strategy only
 * decides which subset to keep under the request's constraints:
 * - Hard: timebox, k, heavy limit, WIP cap (never violated)
 * - Soft: minimum size, minimum distinct courses (relaxed and flagged when unmet)
 * <p>
 * Implementations must be deterministic: equal inputs give equal selections.
 */
public interface SelectionStrategy {

    /**
     * Get the strategy name.
     */
    String getName();

    /**
     * Get the strategy type.
     */
    StrategyType getType();

    /**
     * Select a subset of the candidates.
     *
     * @param candidates Eligible candidates, in any order
     * @param request    Constraints
     * @return Selected candidates in rank order plus any relaxed constraints
     */
    SelectionResult select(List<Candidate> candidates, SelectionRequest request);
}
