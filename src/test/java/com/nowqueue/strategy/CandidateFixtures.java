package com.nowqueue.strategy;

import com.nowqueue.core.TaskStatus;
import com.nowqueue.scoring.PriorityKey;

import java.util.List;

/**
 * Shared candidate builders for selection tests.
 */
public final class CandidateFixtures {

    private CandidateFixtures() {
    }

    public static Candidate candidate(String id, String course, int minutes, double score) {
        return candidate(id, course, minutes, score, TaskStatus.TODO);
    }

    public static Candidate candidate(String id, String course, int minutes, double score, TaskStatus status) {
        return new Candidate(id, course, minutes, status, new PriorityKey(id, score, 0, true, null));
    }

    /**
     * T1(30m, 9), T3(60m, 8), T4(45m, 7), T5(20m, 6) across two courses.
     */
    public static List<Candidate> twoCourseScenario() {
        return List.of(
                candidate("T1", "MTH251", 30, 9.0),
                candidate("T3", "STAT253", 60, 8.0),
                candidate("T4", "MTH251", 45, 7.0),
                candidate("T5", "STAT253", 20, 6.0));
    }

    /**
     * Timebox and k only; no heavy limit, no WIP cap, no soft constraints.
     */
    public static SelectionRequest plain(int timebox, int k) {
        return SelectionRequest.of(timebox, k);
    }

    public static SelectionRequest withDiversity(int timebox, int k, int minCourses) {
        return new SelectionRequest(timebox, k, 0, minCourses, Integer.MAX_VALUE, Integer.MAX_VALUE, null);
    }
}
