package com.nowqueue.phase;

import com.nowqueue.config.PhaseConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Derives the phase from the day offset to the semester start.
 * <p>
 * Windows are inclusive and checked in order: pre_launch, launch_week,
 * week_one. Any other offset, including far before the start, is in_term.
 */
public class CalendarPhaseProvider implements PhaseProvider {

    private static final Logger log = LoggerFactory.getLogger(CalendarPhaseProvider.class);

    private final PhaseConfig config;
    private final ZoneId zone;

    public CalendarPhaseProvider(PhaseConfig config, ZoneId zone) {
        Objects.requireNonNull(config.semesterStart(), "semesterStart cannot be null");
        this.config = config;
        this.zone = Objects.requireNonNull(zone, "zone cannot be null");
    }

    @Override
    public String currentPhase(Instant asOf) {
        String phase = phaseOn(asOf.atZone(zone).toLocalDate());
        log.trace("Phase at {} is {}", asOf, phase);
        return phase;
    }

    /**
     * Phase on a calendar date.
     */
    public String phaseOn(LocalDate date) {
        long day = ChronoUnit.DAYS.between(config.semesterStart(), date);
        if (config.preLaunch().contains(day)) {
            return PhaseConfig.PRE_LAUNCH;
        }
        if (config.launchWeek().contains(day)) {
            return PhaseConfig.LAUNCH_WEEK;
        }
        if (config.weekOne().contains(day)) {
            return PhaseConfig.WEEK_ONE;
        }
        return PhaseConfig.IN_TERM;
    }
}
