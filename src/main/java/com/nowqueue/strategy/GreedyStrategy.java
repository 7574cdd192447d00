package com.nowqueue.strategy;

import com.nowqueue.exception.InfeasibleSelectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Greedy Selection Strategy.
 * <p>
 * Walks candidates in rank order and keeps each one that still fits the hard
 * constraints. When fewer courses than requested are represented, a bounded
 * repair swaps the lowest-ranked member of an over-represented course for the
 * best candidate of a missing course, as long as the hard constraints hold.
 * <p>
 * Linear in the number of candidates for the fill; the repair runs at most once
 * per missing course.
 */
public class GreedyStrategy extends AbstractSelectionStrategy {

    private static final Logger log = LoggerFactory.getLogger(GreedyStrategy.class);

    @Override
    public String getName() {
        return "GREEDY";
    }

    @Override
    public StrategyType getType() {
        return StrategyType.GREEDY;
    }

    @Override
    protected List<Candidate> solve(List<Candidate> ranked, SelectionRequest request) {
        Tally tally = new Tally(request);
        List<Candidate> selected = new ArrayList<>();
        for (Candidate candidate : ranked) {
            if (tally.canAdd(candidate)) {
                tally.add(candidate);
                selected.add(candidate);
            }
        }

        if (tally.distinctCourses() < request.minCourses()) {
            repairDiversity(ranked, request, tally, selected);
            if (tally.distinctCourses() < request.minCourses()) {
                throw new InfeasibleSelectionException(RelaxedConstraint.MIN_COURSES,
                        "only " + tally.distinctCourses() + " of " + request.minCourses()
                                + " courses fit the constraints");
            }
        }
        if (selected.size() < request.minSize()) {
            throw new InfeasibleSelectionException(RelaxedConstraint.MIN_SIZE,
                    "only " + selected.size() + " of " + request.minSize() + " tasks fit the constraints");
        }

        selected.sort(Comparator.naturalOrder());
        return selected;
    }

    private void repairDiversity(List<Candidate> ranked, SelectionRequest request,
                                 Tally tally, List<Candidate> selected) {
        // Each successful step adds one course without removing any, so this is bounded by minCourses.
        while (tally.distinctCourses() < request.minCourses()) {
            if (!repairStep(ranked, tally, selected)) {
                return;
            }
        }
    }

    private boolean repairStep(List<Candidate> ranked, Tally tally, List<Candidate> selected) {
        for (Candidate incoming : ranked) {
            if (!incoming.hasCourse() || tally.represents(incoming.course())) {
                continue;
            }
            if (tally.canAdd(incoming)) {
                tally.add(incoming);
                selected.add(incoming);
                log.debug("Diversity repair added {} ({})", incoming.taskId(), incoming.course());
                return true;
            }
            // Lowest-ranked members first; their course must stay represented after removal.
            for (int i = selected.size() - 1; i >= 0; i--) {
                Candidate outgoing = selected.get(i);
                if (outgoing.hasCourse() && tally.courseCount(outgoing.course()) < 2) {
                    continue;
                }
                tally.remove(outgoing);
                if (tally.canAdd(incoming)) {
                    tally.add(incoming);
                    selected.set(i, incoming);
                    selected.sort(Comparator.naturalOrder());
                    log.debug("Diversity repair swapped {} for {} ({})",
                            outgoing.taskId(), incoming.taskId(), incoming.course());
                    return true;
                }
                tally.add(outgoing);
            }
        }
        return false;
    }
}
