package com.nowqueue.strategy;

import com.nowqueue.config.SelectionConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static com.nowqueue.strategy.CandidateFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Exact and greedy strategies must agree wherever the greedy answer is optimal.
 */
class StrategyAgreementTest {

    private final SelectionStrategy exact = new ExactStrategy(2000);
    private final SelectionStrategy greedy = new GreedyStrategy();

    @ParameterizedTest(name = "single candidate {0}m, timebox {1}, minCourses {2}")
    @CsvSource({
            "30, 90,  0",
            "90, 90,  0",
            "30, 90,  2",
            "0,  0,   1",
            "10, 200, 3"
    })
    @DisplayName("Single eligible candidate within capacity")
    void singleCandidate(int minutes, int timebox, int minCourses) {
        List<Candidate> candidates = List.of(candidate("T1", "MTH", minutes, 4.2));
        SelectionRequest request = new SelectionRequest(timebox, 3, 1, minCourses, 60, 1, 3);

        SelectionResult fromExact = exact.select(candidates, request);
        SelectionResult fromGreedy = greedy.select(candidates, request);

        assertEquals(List.of("T1"), fromExact.taskIds());
        assertEquals(fromExact.taskIds(), fromGreedy.taskIds());
        assertEquals(fromExact.relaxed(), fromGreedy.relaxed());
    }

    @Test
    @DisplayName("Two-course scenario selects the same set")
    void twoCourseScenarioAgrees() {
        SelectionRequest request = new SelectionRequest(90, 3, 1, 2, 60, 1, 3);

        assertEquals(exact.select(twoCourseScenario(), request).taskIds(),
                greedy.select(twoCourseScenario(), request).taskIds());
    }

    @Test
    @DisplayName("Factory honors the exact-solver switch")
    void factory() {
        assertInstanceOf(ExactStrategy.class, SelectionStrategyFactory.create(SelectionConfig.defaults()));
        SelectionConfig disabled = new SelectionConfig(StrategyType.EXACT, false, 2000, 3, 90, 2, 1, 60, 1, 3);
        assertInstanceOf(GreedyStrategy.class, SelectionStrategyFactory.create(disabled));
        assertInstanceOf(GreedyStrategy.class, SelectionStrategyFactory.create(null));
        assertEquals(2000, ((ExactStrategy) SelectionStrategyFactory.create(SelectionConfig.defaults())).getTimeoutMs());
    }
}
