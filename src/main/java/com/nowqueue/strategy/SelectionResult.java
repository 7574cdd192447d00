package com.nowqueue.strategy;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of one selection.
 *
 * @param selected Selected candidates in rank order
 * @param relaxed  Soft constraints that had to be dropped
 * @param strategy Strategy that produced the selection
 */
public record SelectionResult(
        List<Candidate> selected,
        Set<RelaxedConstraint> relaxed,
        StrategyType strategy
) {

    public SelectionResult {
        selected = List.copyOf(selected);
        relaxed = relaxed.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(relaxed));
    }

    public int totalMinutes() {
        return selected.stream().mapToInt(Candidate::estMinutes).sum();
    }

    public double totalScore() {
        double total = 0.0;
        for (Candidate candidate : selected) {
            total += candidate.score();
        }
        return total;
    }

    public List<String> taskIds() {
        return selected.stream().map(Candidate::taskId).toList();
    }
}
