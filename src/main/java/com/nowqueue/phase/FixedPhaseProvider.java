package com.nowqueue.phase;

import java.time.Instant;
import java.util.Objects;

/**
 * Always reports the same phase.
 */
public class FixedPhaseProvider implements PhaseProvider {

    private final String phase;

    public FixedPhaseProvider(String phase) {
        Objects.requireNonNull(phase, "phase cannot be null");
        if (phase.isBlank()) {
            throw new IllegalArgumentException("phase cannot be blank");
        }
        this.phase = phase.trim();
    }

    @Override
    public String currentPhase(Instant asOf) {
        return phase;
    }

    @Override
    public String toString() {
        return "FixedPhaseProvider{" + phase + "}";
    }
}
