package com.nowqueue.config;

import java.util.Map;
import java.util.Objects;

/**
 * Root configuration of the prioritization engine.
 *
 * @param name        Configuration name
 * @param version     Configuration version
 * @param scoring     Scoring coefficients
 * @param weightTable Category weights per phase
 * @param selection   Now Queue selection settings
 * @param phase       Phase selection settings
 */
public record EngineConfig(
        String name,
        String version,
        ScoringConfig scoring,
        WeightTable weightTable,
        SelectionConfig selection,
        PhaseConfig phase
) {

    public EngineConfig {
        Objects.requireNonNull(scoring, "scoring cannot be null");
        Objects.requireNonNull(selection, "selection cannot be null");
        Objects.requireNonNull(phase, "phase cannot be null");
        weightTable = weightTable != null ? weightTable : WeightTable.empty();
    }

    /**
     * Create a minimal configuration for testing.
     */
    public static EngineConfig minimal() {
        return new EngineConfig(
                "test-engine",
                "1.0",
                ScoringConfig.defaults(),
                new WeightTable(Map.of(PhaseConfig.IN_TERM, Map.of("assessment", 3.0, "content", 2.0))),
                SelectionConfig.defaults(),
                PhaseConfig.fixed(PhaseConfig.IN_TERM)
        );
    }

    public EngineConfig withSelection(SelectionConfig newSelection) {
        return new EngineConfig(name, version, scoring, weightTable, newSelection, phase);
    }
}
