package com.nowqueue.strategy;

import com.nowqueue.exception.InfeasibleSelectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Shared ranking and constraint relaxation for selection strategies.
 * <p>
 * Subclasses solve a single request and throw {@link InfeasibleSelectionException}
 * naming the soft constraint that cannot be met; the request is then retried with
 * that constraint switched off and the result flagged.
 */
public abstract class AbstractSelectionStrategy implements SelectionStrategy {

    private static final Logger log = LoggerFactory.getLogger(AbstractSelectionStrategy.class);

    @Override
    public SelectionResult select(List<Candidate> candidates, SelectionRequest request) {
        List<Candidate> ranked = new ArrayList<>(candidates);
        Collections.sort(ranked);

        Set<RelaxedConstraint> relaxed = EnumSet.noneOf(RelaxedConstraint.class);
        SelectionRequest effective = request;
        while (true) {
            try {
                List<Candidate> selected = solve(ranked, effective);
                log.debug("{} selected {} of {} candidates (relaxed: {})",
                        getName(), selected.size(), ranked.size(), relaxed);
                return new SelectionResult(selected, relaxed, getType());
            } catch (InfeasibleSelectionException e) {
                if (!relaxed.add(e.getConstraint())) {
                    throw new IllegalStateException(
                            "Constraint " + e.getConstraint() + " reported infeasible after relaxation", e);
                }
                log.info("{}: {}; relaxing {}", getName(), e.getMessage(), e.getConstraint());
                effective = effective.relax(e.getConstraint());
            }
        }
    }

    /**
     * Solve one request.
     *
     * @param ranked  Candidates sorted by rank, best first
     * @param request Constraints to honor
     * @return Selected candidates in rank order
     * @throws InfeasibleSelectionException if a soft constraint cannot be met
     */
    protected abstract List<Candidate> solve(List<Candidate> ranked, SelectionRequest request);

    /**
     * Number of distinct non-empty courses among the candidates.
     */
    protected static int distinctCourses(List<Candidate> candidates) {
        return (int) candidates.stream()
                .filter(Candidate::hasCourse)
                .map(Candidate::course)
                .distinct()
                .count();
    }
}
