package com.nowqueue.phase;

import java.time.Instant;

/**
 * Supplies the phase label that selects the category weight row.
 */
public interface PhaseProvider {

    /**
     * Phase in effect at the given instant.
     *
     * @param asOf Snapshot time of the refresh
     * @return Phase label, e.g. "in_term"
     */
    String currentPhase(Instant asOf);
}
