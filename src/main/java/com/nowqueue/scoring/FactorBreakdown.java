package com.nowqueue.scoring;

import java.util.List;
import java.util.Optional;

/**
 * Score record of one task: the total and the ordered factors that produced it.
 * Computed against one snapshot and one configuration; never persisted by the engine.
 *
 * @param taskId  Task id
 * @param phase   Phase whose weight-table row was used
 * @param total   Sum of all factor contributions, in factor order
 * @param factors Factors in fixed order: urgency, impact, category_weight, anchor_bonus, chain_head_bonus
 */
public record FactorBreakdown(String taskId, String phase, double total, List<Factor> factors) {

    public FactorBreakdown {
        factors = List.copyOf(factors);
    }

    static FactorBreakdown of(String taskId, String phase, List<Factor> factors) {
        double total = 0.0;
        for (Factor factor : factors) {
            total += factor.contribution();
        }
        return new FactorBreakdown(taskId, phase, total, factors);
    }

    public Optional<Factor> factor(String name) {
        return factors.stream().filter(f -> f.name().equals(name)).findFirst();
    }
}
