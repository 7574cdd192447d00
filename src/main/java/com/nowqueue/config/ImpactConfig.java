package com.nowqueue.config;

import com.nowqueue.exception.ConfigurationException;

/**
 * Parameters of the bounded unblock-impact curve.
 * Raw impact is {@code maxValue * u / (u + halfSaturation)} for unblock count {@code u}.
 *
 * @param weight         Coefficient applied to the raw impact
 * @param maxValue       Upper bound approached as the unblock count grows
 * @param halfSaturation Unblock count at which half of maxValue is reached
 */
public record ImpactConfig(double weight, double maxValue, double halfSaturation) {

    public ImpactConfig {
        if (!ScoringConfig.isNonNegative(weight) || !ScoringConfig.isNonNegative(maxValue)) {
            throw new ConfigurationException("impact weight and max-value must be finite and non-negative");
        }
        if (!(halfSaturation > 0) || Double.isInfinite(halfSaturation)) {
            throw new ConfigurationException("impact half-saturation must be positive and finite, got " + halfSaturation);
        }
    }

    public static ImpactConfig defaults() {
        return new ImpactConfig(3.0, 10.0, 2.0);
    }
}
