package com.nowqueue.scoring;

import com.nowqueue.config.ScoringConfig;
import com.nowqueue.config.UrgencyDecayConfig;
import com.nowqueue.config.ImpactConfig;
import com.nowqueue.config.WeightTable;
import com.nowqueue.core.Task;
import com.nowqueue.graph.GraphAnalysis;
import com.nowqueue.graph.TaskMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic, explainable task scoring.
 * <p>
 * {@code score = urgency + impact + category_weight + anchor_bonus + chain_head_bonus},
 * each term a raw value times its configured coefficient. The only notion of time is the
 * snapshot's reference instant, so identical inputs give bit-identical scores.
 */
public class ScoringEngine {

    private static final Logger log = LoggerFactory.getLogger(ScoringEngine.class);

    public static final String URGENCY = "urgency";
    public static final String IMPACT = "impact";
    public static final String CATEGORY_WEIGHT = "category_weight";
    public static final String ANCHOR_BONUS = "anchor_bonus";
    public static final String CHAIN_HEAD_BONUS = "chain_head_bonus";

    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private final ScoringConfig config;
    private final WeightTable weightTable;

    public ScoringEngine(ScoringConfig config, WeightTable weightTable) {
        this.config = config;
        this.weightTable = weightTable;
    }

    /**
     * Score one task.
     *
     * @param task    Task record
     * @param metrics Graph facts for the task
     * @param phase   Active phase label
     * @param asOf    Reference instant of the snapshot
     * @return Breakdown whose contributions sum to the total
     */
    public FactorBreakdown score(Task task, TaskMetrics metrics, String phase, Instant asOf) {
        List<Factor> factors = List.of(
                Factor.of(URGENCY, urgency(task.dueAt(), asOf), config.urgency().weight()),
                Factor.of(IMPACT, impact(metrics.unblockCount()), config.impact().weight()),
                Factor.of(CATEGORY_WEIGHT, weightTable.lookup(phase, task.category()), config.categoryWeight()),
                Factor.of(ANCHOR_BONUS, task.anchor() ? 1.0 : 0.0, config.anchorBonus()),
                Factor.of(CHAIN_HEAD_BONUS, metrics.chainHead() ? 1.0 : 0.0, config.chainHeadBonus())
        );
        FactorBreakdown breakdown = FactorBreakdown.of(task.id(), phase, factors);
        log.trace("Scored task {}: {}", task.id(), breakdown);
        return breakdown;
    }

    /**
     * Score every task of an analysis that is not on a cycle.
     *
     * @return Breakdowns keyed by task id, in ascending id order
     */
    public Map<String, FactorBreakdown> scoreAll(GraphAnalysis analysis, String phase) {
        Map<String, FactorBreakdown> scores = new LinkedHashMap<>();
        Instant asOf = analysis.snapshot().asOf();
        for (Task task : analysis.snapshot().tasks()) {
            TaskMetrics metrics = analysis.metrics(task.id());
            if (metrics.cyclic()) {
                log.debug("Skipping cyclic task {}", task.id());
                continue;
            }
            scores.put(task.id(), score(task, metrics, phase, asOf));
        }
        log.debug("Scored {} of {} tasks for phase {}", scores.size(), analysis.snapshot().size(), phase);
        return scores;
    }

    /**
     * Decay of the time remaining until the due date. No due date means no urgency;
     * an overdue task gets the maximum.
     */
    double urgency(Instant dueAt, Instant asOf) {
        if (dueAt == null) {
            return 0.0;
        }
        UrgencyDecayConfig urgency = config.urgency();
        double days = Duration.between(asOf, dueAt).toMillis() / MILLIS_PER_DAY;
        if (days <= 0) {
            return urgency.maxValue();
        }
        return urgency.maxValue() * StrictMath.pow(2.0, -days / urgency.halfLifeDays());
    }

    /**
     * Bounded, strictly increasing in the unblock count.
     */
    double impact(int unblockCount) {
        if (unblockCount <= 0) {
            return 0.0;
        }
        ImpactConfig impact = config.impact();
        return impact.maxValue() * unblockCount / (unblockCount + impact.halfSaturation());
    }
}
