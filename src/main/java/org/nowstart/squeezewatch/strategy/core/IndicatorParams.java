package org.nowstart.squeezewatch.strategy.core;

import org.nowstart.squeezewatch.data.type.SqueezePolicy;

public record IndicatorParams(
        int bbPeriod,
        double bbStdMultiplier,
        int rsiPeriod,
        int volatilityLookback,
        double volatilityThreshold,
        SqueezePolicy squeezePolicy,
        int squeezeWindow,
        double squeezeMinFactor,
        int volumePeriod
) {

    public static final IndicatorParams DEFAULTS = new IndicatorParams(
            20, 2.0, 14, 50, 0.2, SqueezePolicy.ROLLING_MIN, 20, 1.1, 20
    );

    public IndicatorParams {
        if (bbPeriod <= 1 || rsiPeriod <= 0 || volatilityLookback <= 0 || squeezeWindow <= 0 || volumePeriod <= 0) {
            throw new IllegalArgumentException("indicator periods must be positive (bbPeriod > 1)");
        }
        if (!Double.isFinite(bbStdMultiplier) || bbStdMultiplier < 0.0) {
            throw new IllegalArgumentException("bbStdMultiplier must be finite and >= 0");
        }
        if (!Double.isFinite(volatilityThreshold) || volatilityThreshold <= 0.0 || volatilityThreshold > 1.0) {
            throw new IllegalArgumentException("volatilityThreshold must be in (0, 1]");
        }
        if (squeezePolicy == null) {
            throw new IllegalArgumentException("squeezePolicy is required");
        }
    }

    public int warmupBars() {
        return Math.max(Math.max(bbPeriod, rsiPeriod), volatilityLookback);
    }
}
