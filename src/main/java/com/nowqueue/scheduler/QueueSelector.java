package com.nowqueue.scheduler;

import com.nowqueue.config.SelectionConfig;
import com.nowqueue.exception.SolverTimeoutException;
import com.nowqueue.strategy.Candidate;
import com.nowqueue.strategy.RelaxedConstraint;
import com.nowqueue.strategy.SelectionRequest;
import com.nowqueue.strategy.SelectionResult;
import com.nowqueue.strategy.SelectionStrategy;
import com.nowqueue.strategy.SelectionStrategyFactory;
import com.nowqueue.strategy.StrategyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the primary selection strategy under its time budget and falls back to
 * greedy when it times out or fails, then annotates every selected task.
 * <p>
 * The exact strategy runs on a solver thread so a runaway search can be
 * abandoned; the search also stops by itself once it sees the interrupt.
 */
public class QueueSelector implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(QueueSelector.class);

    private static final AtomicInteger SOLVER_THREADS = new AtomicInteger();

    private final SelectionStrategy primary;
    private final SelectionStrategy fallback;
    private final long timeoutMs;
    private final ExecutorService solverExecutor;

    public QueueSelector(SelectionConfig config) {
        this(SelectionStrategyFactory.create(config), SelectionStrategyFactory.createDefault(),
                config.solverTimeoutMs());
    }

    public QueueSelector(SelectionStrategy primary, SelectionStrategy fallback, long timeoutMs) {
        this.primary = primary;
        this.fallback = fallback;
        this.timeoutMs = timeoutMs;
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "nowqueue-solver-" + SOLVER_THREADS.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        this.solverExecutor = Executors.newCachedThreadPool(threadFactory);
        log.info("QueueSelector initialized (primary={}, fallback={}, timeoutMs={})",
                primary.getName(), fallback.getName(), timeoutMs);
    }

    /**
     * Select and annotate.
     *
     * @param candidates Eligible candidates, in any order
     * @param request    Constraints
     * @return Selection with fallback flag and inclusion annotations
     */
    public QueueSelection select(List<Candidate> candidates, SelectionRequest request) {
        List<Candidate> ranked = new ArrayList<>(candidates);
        Collections.sort(ranked);

        SelectionResult result;
        boolean fallbackUsed = false;
        if (primary.getType() == StrategyType.GREEDY) {
            result = primary.select(ranked, request);
        } else {
            try {
                result = runPrimary(ranked, request);
            } catch (SolverTimeoutException e) {
                log.warn("{}, falling back to {}", e.getMessage(), fallback.getName());
                result = fallback.select(ranked, request);
                fallbackUsed = true;
            } catch (RuntimeException e) {
                log.error("{} strategy failed, falling back to {}", primary.getName(), fallback.getName(), e);
                result = fallback.select(ranked, request);
                fallbackUsed = true;
            }
        }

        return new QueueSelection(result, fallbackUsed, annotate(ranked, result, request));
    }

    private SelectionResult runPrimary(List<Candidate> ranked, SelectionRequest request) {
        Future<SelectionResult> future = solverExecutor.submit(() -> primary.select(ranked, request));
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SolverTimeoutException(timeoutMs, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SolverTimeoutException(timeoutMs, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Selection failed", cause);
        }
    }

    /**
     * Annotate each selected candidate, the same way for every strategy.
     * <p>
     * A task is a diversity swap when diversity was enforced, it is the only
     * member of its course, and a higher-ranked task of a represented course was
     * left out. Otherwise it is a capacity cutoff when any higher-ranked task was
     * left out, and top-ranked when none was.
     */
    Map<String, InclusionReason> annotate(List<Candidate> ranked, SelectionResult result,
                                          SelectionRequest request) {
        Set<String> selectedIds = new HashSet<>(result.taskIds());
        Map<String, Integer> courseCounts = new HashMap<>();
        for (Candidate candidate : result.selected()) {
            if (candidate.hasCourse()) {
                courseCounts.merge(candidate.course(), 1, Integer::sum);
            }
        }
        boolean diversityEnforced = request.minCourses() >= 2
                && !result.relaxed().contains(RelaxedConstraint.MIN_COURSES);

        Map<String, InclusionReason> reasons = new HashMap<>();
        boolean skippedHigher = false;
        boolean skippedRepresented = false;
        for (Candidate candidate : ranked) {
            if (!selectedIds.contains(candidate.taskId())) {
                skippedHigher = true;
                if (candidate.hasCourse() && courseCounts.containsKey(candidate.course())) {
                    skippedRepresented = true;
                }
                continue;
            }
            boolean soleOfCourse = candidate.hasCourse() && courseCounts.get(candidate.course()) == 1;
            InclusionReason reason;
            if (diversityEnforced && soleOfCourse && skippedRepresented) {
                reason = InclusionReason.DIVERSITY_SWAP;
            } else if (skippedHigher) {
                reason = InclusionReason.CAPACITY_CUTOFF;
            } else {
                reason = InclusionReason.RANKED;
            }
            reasons.put(candidate.taskId(), reason);
        }
        return reasons;
    }

    public SelectionStrategy getPrimary() {
        return primary;
    }

    @Override
    public void close() {
        solverExecutor.shutdownNow();
        log.info("QueueSelector closed");
    }
}
