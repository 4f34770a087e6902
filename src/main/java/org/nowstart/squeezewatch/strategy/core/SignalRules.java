package org.nowstart.squeezewatch.strategy.core;

import org.nowstart.squeezewatch.data.type.BuyRule;
import org.nowstart.squeezewatch.data.type.StrategyProfile;

/**
 * Thresholds resolved once from the configured profile and buy rule.
 */
public record SignalRules(
        StrategyProfile profile,
        BuyRule buyRule,
        double rsiOverbought,
        double sell50Threshold,
        double sellAllThreshold,
        double rsiOversold,
        double breakoutVolumeRatio,
        double breakoutRsiLower,
        double breakoutRsiUpper
) {

    public static SignalRules of(StrategyProfile profile, BuyRule buyRule) {
        return new SignalRules(
                profile,
                buyRule,
                profile.rsiOverbought(),
                profile.sell50Threshold(),
                profile.sellAllThreshold(),
                30.0,
                1.2,
                50.0,
                80.0
        );
    }
}
