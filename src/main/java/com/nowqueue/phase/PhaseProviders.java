package com.nowqueue.phase;

import com.nowqueue.config.PhaseConfig;

import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Factory for creating PhaseProvider instances.
 */
public final class PhaseProviders {

    private PhaseProviders() {
    }

    /**
     * Fixed provider when a current phase is configured, calendar provider otherwise.
     */
    public static PhaseProvider from(PhaseConfig config) {
        return from(config, ZoneOffset.UTC);
    }

    public static PhaseProvider from(PhaseConfig config, ZoneId zone) {
        if (config.isFixed()) {
            return new FixedPhaseProvider(config.current());
        }
        return new CalendarPhaseProvider(config, zone);
    }
}
