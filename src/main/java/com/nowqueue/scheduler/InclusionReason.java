package com.nowqueue.scheduler;

/**
 * Why a task made it into the Now Queue.
 */
public enum InclusionReason {

    /**
     * No higher-ranked candidate was left out.
     */
    RANKED("top-ranked"),

    /**
     * A higher-ranked candidate did not fit the timebox or another hard limit.
     */
    CAPACITY_CUTOFF("capacity-bound cutoff"),

    /**
     * Included to represent its course while a higher-ranked task of an already
     * represented course was left out.
     */
    DIVERSITY_SWAP("diversity swap");

    private final String label;

    InclusionReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
