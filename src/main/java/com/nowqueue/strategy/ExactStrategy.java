package com.nowqueue.strategy;

import com.nowqueue.exception.InfeasibleSelectionException;
import com.nowqueue.exception.SolverTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Exact Selection Strategy.
 * <p>
 * Depth-first branch and bound over include/exclude decisions, in rank order,
 * include first. A partial selection is only replaced by a strictly better one,
 * so among equal-score optima the one preferring higher-ranked tasks wins.
 * <p>
 * Pruning:
 * - Upper bound: current score plus the best remaining scores for the open slots
 * - Hard constraints checked on every include
 * - Soft constraints: prune when the remaining candidates cannot reach them
 * <p>
 * The search checks its wall-clock budget and the thread's interrupt flag
 * periodically and throws {@link SolverTimeoutException} when either trips.
 */
public class ExactStrategy extends AbstractSelectionStrategy {

    private static final Logger log = LoggerFactory.getLogger(ExactStrategy.class);

    private static final int BUDGET_CHECK_MASK = 0xFF;

    private final long timeoutMs;

    public ExactStrategy(long timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive, got " + timeoutMs);
        }
        this.timeoutMs = timeoutMs;
    }

    @Override
    public String getName() {
        return "EXACT";
    }

    @Override
    public StrategyType getType() {
        return StrategyType.EXACT;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    @Override
    protected List<Candidate> solve(List<Candidate> ranked, SelectionRequest request) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);

        if (request.minCourses() > 0 && distinctCourses(ranked) < request.minCourses()) {
            throw new InfeasibleSelectionException(RelaxedConstraint.MIN_COURSES,
                    "only " + distinctCourses(ranked) + " of " + request.minCourses() + " courses available");
        }

        Optional<List<Candidate>> best = new Search(ranked, request, deadline).run();
        if (best.isPresent()) {
            return best.get();
        }

        if (request.minCourses() > 0) {
            SelectionRequest withoutDiversity = request.relax(RelaxedConstraint.MIN_COURSES);
            if (request.minSize() == 0
                    || new Search(ranked, withoutDiversity, deadline).run().isPresent()) {
                throw new InfeasibleSelectionException(RelaxedConstraint.MIN_COURSES,
                        request.minCourses() + " courses do not fit the constraints");
            }
        }
        throw new InfeasibleSelectionException(RelaxedConstraint.MIN_SIZE,
                request.minSize() + " tasks do not fit the constraints");
    }

    /**
     * One branch and bound run.
     */
    private final class Search {

        private final List<Candidate> ranked;
        private final SelectionRequest request;
        private final long deadline;
        private final int n;
        private final double[] positivePrefix;
        private final List<Set<String>> suffixCourses;
        private final Tally tally;
        private final boolean[] chosen;

        private boolean[] best;
        private double bestScore = Double.NEGATIVE_INFINITY;
        private long nodes;

        Search(List<Candidate> ranked, SelectionRequest request, long deadline) {
            this.ranked = ranked;
            this.request = request;
            this.deadline = deadline;
            this.n = ranked.size();
            this.tally = new Tally(request);
            this.chosen = new boolean[n];

            this.positivePrefix = new double[n + 1];
            for (int i = 0; i < n; i++) {
                positivePrefix[i + 1] = positivePrefix[i] + Math.max(0.0, ranked.get(i).score());
            }

            this.suffixCourses = new ArrayList<>(n + 1);
            for (int i = 0; i <= n; i++) {
                suffixCourses.add(null);
            }
            Set<String> seen = new HashSet<>();
            suffixCourses.set(n, Set.copyOf(seen));
            for (int i = n - 1; i >= 0; i--) {
                Candidate candidate = ranked.get(i);
                if (candidate.hasCourse()) {
                    seen.add(candidate.course());
                }
                suffixCourses.set(i, Set.copyOf(seen));
            }
        }

        Optional<List<Candidate>> run() {
            branch(0, 0.0);
            log.debug("Exact search visited {} nodes, best score {}", nodes, bestScore);
            if (best == null) {
                return Optional.empty();
            }
            List<Candidate> selected = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                if (best[i]) {
                    selected.add(ranked.get(i));
                }
            }
            return Optional.of(selected);
        }

        private void branch(int i, double score) {
            checkBudget();

            if (tally.count() >= request.minSize()
                    && tally.distinctCourses() >= request.minCourses()
                    && score > bestScore) {
                bestScore = score;
                best = chosen.clone();
            }
            if (i == n || tally.count() == request.k()) {
                return;
            }

            int open = request.k() - tally.count();
            double bound = score + positivePrefix[Math.min(n, i + open)] - positivePrefix[i];
            if (best != null && bound <= bestScore) {
                return;
            }
            if (!canStillSatisfy(i, open)) {
                return;
            }

            Candidate candidate = ranked.get(i);
            if (tally.canAdd(candidate)) {
                tally.add(candidate);
                chosen[i] = true;
                branch(i + 1, score + candidate.score());
                chosen[i] = false;
                tally.remove(candidate);
            }
            branch(i + 1, score);
        }

        private boolean canStillSatisfy(int i, int open) {
            if (tally.count() + (n - i) < request.minSize()) {
                return false;
            }
            int missing = request.minCourses() - tally.distinctCourses();
            if (missing <= 0) {
                return true;
            }
            if (missing > open) {
                return false;
            }
            int reachable = 0;
            for (String course : suffixCourses.get(i)) {
                if (!tally.represents(course)) {
                    reachable++;
                }
            }
            return reachable >= missing;
        }

        private void checkBudget() {
            if ((++nodes & BUDGET_CHECK_MASK) != 0) {
                return;
            }
            if (Thread.currentThread().isInterrupted() || System.nanoTime() > deadline) {
                throw new SolverTimeoutException(timeoutMs);
            }
        }
    }
}
