package com.nowqueue.engine;

import com.nowqueue.config.EngineConfig;
import com.nowqueue.config.SelectionConfig;
import com.nowqueue.core.Task;
import com.nowqueue.core.TaskSnapshot;
import com.nowqueue.core.TaskStore;
import com.nowqueue.explain.Explainer;
import com.nowqueue.explain.UnblockingCut;
import com.nowqueue.graph.GraphAnalysis;
import com.nowqueue.graph.GraphAnalyzer;
import com.nowqueue.graph.TaskMetrics;
import com.nowqueue.phase.PhaseProvider;
import com.nowqueue.phase.PhaseProviders;
import com.nowqueue.scheduler.NowQueue;
import com.nowqueue.scheduler.QueueEntry;
import com.nowqueue.scheduler.QueueSelection;
import com.nowqueue.scheduler.QueueSelector;
import com.nowqueue.scoring.FactorBreakdown;
import com.nowqueue.scoring.PriorityKey;
import com.nowqueue.scoring.ScoringEngine;
import com.nowqueue.strategy.Candidate;
import com.nowqueue.strategy.SelectionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Default implementation of PrioritizationEngine.
 * <p>
 * Pipeline per refresh: snapshot, graph analysis, scoring, selection. The
 * resulting queue is swapped in atomically; a queue built from an older snapshot
 * never replaces one built from a newer snapshot, and an interrupted refresh
 * publishes nothing.
 */
public class DefaultPrioritizationEngine implements PrioritizationEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultPrioritizationEngine.class);

    private static final AtomicInteger REFRESH_THREADS = new AtomicInteger();

    private final EngineConfig config;
    private final TaskStore store;
    private final PhaseProvider phaseProvider;
    private final Clock clock;
    private final GraphAnalyzer analyzer = new GraphAnalyzer();
    private final ScoringEngine scoringEngine;
    private final Explainer explainer;
    private final QueueSelector selector;
    private final AtomicReference<RefreshState> current = new AtomicReference<>();
    private final ExecutorService refreshExecutor;

    public DefaultPrioritizationEngine(EngineConfig config, TaskStore store) {
        this(config, store, PhaseProviders.from(config.phase()), Clock.systemUTC());
    }

    public DefaultPrioritizationEngine(EngineConfig config, TaskStore store,
                                       PhaseProvider phaseProvider, Clock clock) {
        this(config, store, phaseProvider, clock, new QueueSelector(config.selection()));
    }

    public DefaultPrioritizationEngine(EngineConfig config, TaskStore store, PhaseProvider phaseProvider,
                                       Clock clock, QueueSelector selector) {
        this.config = config;
        this.store = store;
        this.phaseProvider = phaseProvider;
        this.clock = clock;
        this.scoringEngine = new ScoringEngine(config.scoring(), config.weightTable());
        this.explainer = new Explainer(scoringEngine);
        this.selector = selector;
        this.refreshExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "nowqueue-refresh-" + REFRESH_THREADS.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        log.info("PrioritizationEngine initialized: {} (strategy={}, phase={})",
                config.name(), selector.getPrimary().getName(), phaseProvider);
    }

    @Override
    public NowQueue refresh() {
        SelectionConfig selection = config.selection();
        return refresh(selection.defaultTimeboxMinutes(), selection.defaultK(), selection.minCourses(), Set.of());
    }

    @Override
    public NowQueue refresh(int timeboxMinutes, int k, int minCourses, Set<String> coursesFilter) {
        Set<String> filter = coursesFilter != null ? Set.copyOf(coursesFilter) : Set.of();
        Instant asOf = clock.instant();
        TaskSnapshot snapshot = store.snapshot(asOf);
        String phase = phaseProvider.currentPhase(asOf);

        GraphAnalysis analysis = analyzer.analyze(snapshot);
        analysis.cycle().ifPresent(cycle ->
                log.warn("Dependency cycle {} excluded from scoring (suggest removing {})",
                        cycle.path(), cycle.breakSuggestion()));
        Map<String, FactorBreakdown> scores = scoringEngine.scoreAll(analysis, phase);

        List<Candidate> candidates = new ArrayList<>();
        for (Task task : snapshot.tasks()) {
            TaskMetrics metrics = analysis.metrics(task.id());
            if (metrics.cyclic() || !metrics.chainHead() || task.isDone()) {
                continue;
            }
            if (!filter.isEmpty() && !filter.contains(task.course())) {
                continue;
            }
            PriorityKey key = new PriorityKey(task.id(), scores.get(task.id()).total(),
                    metrics.unblockCount(), metrics.chainHead(), task.dueAt());
            candidates.add(new Candidate(task.id(), task.course(), task.estMinutes(), task.status(), key));
        }

        int effectiveMinCourses = filter.isEmpty() ? minCourses : Math.min(minCourses, filter.size());
        SelectionConfig selection = config.selection();
        SelectionRequest request = new SelectionRequest(timeboxMinutes, k, selection.minSize(),
                effectiveMinCourses, selection.heavyThresholdMinutes(), selection.maxHeavy(), selection.wipCap());
        QueueSelection outcome = selector.select(candidates, request);

        List<QueueEntry> entries = new ArrayList<>();
        for (Candidate candidate : outcome.result().selected()) {
            Task task = snapshot.find(candidate.taskId()).orElseThrow();
            entries.add(new QueueEntry(entries.size() + 1, task.id(), task.course(), task.title(),
                    task.estMinutes(), candidate.score(), outcome.reasonFor(candidate)));
        }
        NowQueue queue = new NowQueue(entries, phase, snapshot.version(), timeboxMinutes, k,
                outcome.result().strategy(), outcome.fallbackUsed(), outcome.result().relaxed(),
                analysis.cycle().orElse(null), asOf);

        log.info("Refreshed Now Queue from snapshot v{}: {} of {} candidates, {} min, strategy={}{}",
                snapshot.version(), queue.size(), candidates.size(), queue.totalMinutes(), queue.strategy(),
                queue.fallbackUsed() ? " (fallback)" : "");
        if (!queue.relaxed().isEmpty()) {
            log.warn("Relaxed constraints for snapshot v{}: {}", snapshot.version(), queue.relaxed());
        }

        publish(new RefreshState(queue, analysis, phase));
        return queue;
    }

    private void publish(RefreshState state) {
        if (Thread.currentThread().isInterrupted()) {
            log.info("Refresh of snapshot v{} was cancelled, keeping the current queue",
                    state.queue().snapshotVersion());
            return;
        }
        current.accumulateAndGet(state, (previous, next) ->
                previous == null || next.queue().snapshotVersion() >= previous.queue().snapshotVersion()
                        ? next
                        : previous);
    }

    @Override
    public Future<NowQueue> refreshAsync(int timeboxMinutes, int k, int minCourses, Set<String> coursesFilter) {
        return refreshExecutor.submit(() -> refresh(timeboxMinutes, k, minCourses, coursesFilter));
    }

    @Override
    public Optional<NowQueue> currentQueue() {
        return Optional.ofNullable(current.get()).map(RefreshState::queue);
    }

    @Override
    public FactorBreakdown explain(String taskId) {
        RefreshState state = latestOrFresh();
        return explainer.explain(state.analysis(), taskId, state.phase());
    }

    @Override
    public UnblockingCut minimalUnblockingCut(String taskId) {
        return explainer.minimalUnblockingCut(latestOrFresh().analysis(), taskId);
    }

    @Override
    public GraphHealth health() {
        return GraphHealth.of(analyzer.analyze(store.snapshot(clock.instant())));
    }

    @Override
    public void shutdown() {
        refreshExecutor.shutdownNow();
        selector.close();
        log.info("PrioritizationEngine shut down: {}", config.name());
    }

    /**
     * Explanations refer to the snapshot of the current queue so they match what
     * the caller sees; before the first refresh a fresh snapshot is analyzed.
     */
    private RefreshState latestOrFresh() {
        RefreshState state = current.get();
        if (state != null) {
            return state;
        }
        Instant asOf = clock.instant();
        return new RefreshState(null, analyzer.analyze(store.snapshot(asOf)), phaseProvider.currentPhase(asOf));
    }

    private record RefreshState(NowQueue queue, GraphAnalysis analysis, String phase) {
    }
}
