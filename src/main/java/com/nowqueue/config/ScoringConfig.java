package com.nowqueue.config;

import com.nowqueue.exception.ConfigurationException;

import java.util.Objects;

/**
 * Coefficients of the scoring formula.
 *
 * @param urgency        Urgency decay parameters
 * @param impact         Unblock impact parameters
 * @param categoryWeight Coefficient applied to the phase/category table value
 * @param anchorBonus    Additive bonus for anchor tasks
 * @param chainHeadBonus Additive bonus for chain-head tasks
 */
public record ScoringConfig(
        UrgencyDecayConfig urgency,
        ImpactConfig impact,
        double categoryWeight,
        double anchorBonus,
        double chainHeadBonus
) {

    public ScoringConfig {
        Objects.requireNonNull(urgency, "urgency cannot be null");
        Objects.requireNonNull(impact, "impact cannot be null");
        if (!isNonNegative(categoryWeight) || !isNonNegative(anchorBonus) || !isNonNegative(chainHeadBonus)) {
            throw new ConfigurationException(
                    "category-weight, anchor-bonus and chain-head-bonus must be finite and non-negative");
        }
    }

    /**
     * False for negative, NaN and infinite values.
     */
    static boolean isNonNegative(double value) {
        return value >= 0 && Double.isFinite(value);
    }

    public static ScoringConfig defaults() {
        return new ScoringConfig(UrgencyDecayConfig.defaults(), ImpactConfig.defaults(), 1.0, 15.0, 10.0);
    }
}
