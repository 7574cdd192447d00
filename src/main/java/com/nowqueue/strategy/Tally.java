package com.nowqueue.strategy;

import com.nowqueue.core.TaskStatus;

import java.util.HashMap;
import java.util.Map;

/**
 * Running totals of a partial selection, used to test the hard constraints.
 */
final class Tally {

    private final SelectionRequest request;
    private int count;
    private int minutes;
    private int heavy;
    private int doing;
    private final Map<String, Integer> courses = new HashMap<>();

    Tally(SelectionRequest request) {
        this.request = request;
    }

    boolean canAdd(Candidate candidate) {
        if (count + 1 > request.k()) {
            return false;
        }
        if ((long) minutes + candidate.estMinutes() > request.timeboxMinutes()) {
            return false;
        }
        if (request.isHeavy(candidate) && heavy + 1 > request.maxHeavy()) {
            return false;
        }
        return request.wipCap() == null
                || candidate.status() != TaskStatus.DOING
                || doing + 1 <= request.wipCap();
    }

    void add(Candidate candidate) {
        count++;
        minutes += candidate.estMinutes();
        if (request.isHeavy(candidate)) {
            heavy++;
        }
        if (candidate.status() == TaskStatus.DOING) {
            doing++;
        }
        if (candidate.hasCourse()) {
            courses.merge(candidate.course(), 1, Integer::sum);
        }
    }

    void remove(Candidate candidate) {
        count--;
        minutes -= candidate.estMinutes();
        if (request.isHeavy(candidate)) {
            heavy--;
        }
        if (candidate.status() == TaskStatus.DOING) {
            doing--;
        }
        if (candidate.hasCourse()) {
            courses.computeIfPresent(candidate.course(), (c, n) -> n > 1 ? n - 1 : null);
        }
    }

    int count() {
        return count;
    }

    int distinctCourses() {
        return courses.size();
    }

    int courseCount(String course) {
        return courses.getOrDefault(course, 0);
    }

    boolean represents(String course) {
        return courses.containsKey(course);
    }
}
