package com.nowqueue.scheduler;

import com.nowqueue.graph.CycleReport;
import com.nowqueue.strategy.RelaxedConstraint;
import com.nowqueue.strategy.StrategyType;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The ordered short list produced by a refresh.
 *
 * @param entries         Selected tasks, best score first
 * @param phase           Phase the scores were computed for
 * @param snapshotVersion Version of the task snapshot the queue was built from
 * @param timeboxMinutes  Requested timebox
 * @param k               Requested maximum length
 * @param strategy        Strategy that produced the selection
 * @param fallbackUsed    Whether the exact strategy failed and greedy answered
 * @param relaxed         Soft constraints that could not be met
 * @param cycle           First detected dependency cycle, null when the graph is a DAG
 * @param generatedAt     Snapshot time the queue was computed for
 */
public record NowQueue(
        List<QueueEntry> entries,
        String phase,
        long snapshotVersion,
        int timeboxMinutes,
        int k,
        StrategyType strategy,
        boolean fallbackUsed,
        Set<RelaxedConstraint> relaxed,
        CycleReport cycle,
        Instant generatedAt
) {

    public NowQueue {
        entries = List.copyOf(entries);
        relaxed = Set.copyOf(relaxed);
    }

    public int totalMinutes() {
        return entries.stream().mapToInt(QueueEntry::estMinutes).sum();
    }

    public double totalScore() {
        double total = 0.0;
        for (QueueEntry entry : entries) {
            total += entry.score();
        }
        return total;
    }

    public List<String> taskIds() {
        return entries.stream().map(QueueEntry::taskId).toList();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Optional<CycleReport> cycleReport() {
        return Optional.ofNullable(cycle);
    }

    public boolean isRelaxed(RelaxedConstraint constraint) {
        return relaxed.contains(constraint);
    }
}
