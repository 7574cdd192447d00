package com.nowqueue.config;

import com.nowqueue.exception.ConfigurationException;

import java.time.LocalDate;

/**
 * Phase selection settings. Either a fixed phase label, or a semester start date
 * from which the phase is derived by day offset.
 *
 * @param current       Fixed phase label (takes precedence when set)
 * @param semesterStart Semester start date for calendar-based detection
 * @param preLaunch     Day window for "pre_launch"
 * @param launchWeek    Day window for "launch_week"
 * @param weekOne       Day window for "week_one"
 */
public record PhaseConfig(
        String current,
        LocalDate semesterStart,
        Window preLaunch,
        Window launchWeek,
        Window weekOne
) {

    public static final String PRE_LAUNCH = "pre_launch";
    public static final String LAUNCH_WEEK = "launch_week";
    public static final String WEEK_ONE = "week_one";
    public static final String IN_TERM = "in_term";

    public PhaseConfig {
        if ((current == null || current.isBlank()) && semesterStart == null) {
            throw new ConfigurationException("phase requires either 'current' or 'semester-start'");
        }
        preLaunch = preLaunch != null ? preLaunch : new Window(-30, -8);
        launchWeek = launchWeek != null ? launchWeek : new Window(-7, 0);
        weekOne = weekOne != null ? weekOne : new Window(1, 7);
    }

    public boolean isFixed() {
        return current != null && !current.isBlank();
    }

    public static PhaseConfig fixed(String phase) {
        return new PhaseConfig(phase, null, null, null, null);
    }

    public static PhaseConfig calendar(LocalDate semesterStart) {
        return new PhaseConfig(null, semesterStart, null, null, null);
    }

    /**
     * Inclusive range of day offsets relative to the semester start.
     */
    public record Window(int fromDay, int toDay) {

        public Window {
            if (fromDay > toDay) {
                throw new ConfigurationException("phase window [" + fromDay + ", " + toDay + "] is empty");
            }
        }

        public boolean contains(long day) {
            return day >= fromDay && day <= toDay;
        }
    }
}
