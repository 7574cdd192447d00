package com.nowqueue.config;

import com.nowqueue.exception.ConfigurationException;

/**
 * Parameters of the urgency decay curve.
 * Raw urgency is {@code maxValue * 2^(-daysRemaining / halfLifeDays)}, capped at
 * {@code maxValue} once the due date has passed.
 *
 * @param weight       Coefficient applied to the raw urgency
 * @param maxValue     Raw urgency at or after the due date
 * @param halfLifeDays Days of remaining time that halve the raw urgency
 */
public record UrgencyDecayConfig(double weight, double maxValue, double halfLifeDays) {

    public UrgencyDecayConfig {
        if (!ScoringConfig.isNonNegative(weight) || !ScoringConfig.isNonNegative(maxValue)) {
            throw new ConfigurationException("urgency weight and max-value must be finite and non-negative");
        }
        if (!(halfLifeDays > 0) || Double.isInfinite(halfLifeDays)) {
            throw new ConfigurationException("urgency half-life-days must be positive and finite, got " + halfLifeDays);
        }
    }

    public static UrgencyDecayConfig defaults() {
        return new UrgencyDecayConfig(1.0, 10.0, 3.0);
    }
}
