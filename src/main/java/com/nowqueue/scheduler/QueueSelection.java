package com.nowqueue.scheduler;

import com.nowqueue.strategy.Candidate;
import com.nowqueue.strategy.SelectionResult;

import java.util.Map;

/**
 * Selection plus the bookkeeping the queue reports.
 *
 * @param result       Strategy output
 * @param fallbackUsed Whether the primary strategy failed and greedy answered
 * @param reasons      Inclusion annotation per selected task id
 */
public record QueueSelection(
        SelectionResult result,
        boolean fallbackUsed,
        Map<String, InclusionReason> reasons
) {

    public QueueSelection {
        reasons = Map.copyOf(reasons);
    }

    public InclusionReason reasonFor(Candidate candidate) {
        return reasons.getOrDefault(candidate.taskId(), InclusionReason.RANKED);
    }
}
