package org.nowstart.squeezewatch.strategy;

import org.nowstart.squeezewatch.data.type.BuyRule;
import org.nowstart.squeezewatch.strategy.core.IndicatorRow;
import org.nowstart.squeezewatch.strategy.core.SignalRules;
import org.nowstart.squeezewatch.strategy.core.SignalSet;
import org.springframework.stereotype.Component;

/**
 * Turns indicator rows into buy / sell-50 / sell-all flags.
 * Every comparison against a NaN operand evaluates to "no signal".
 */
@Component
public class SqueezeSignalEvaluator {

    public SignalSet evaluate(IndicatorRow current, IndicatorRow previous, SignalRules rules) {
        if (rules == null) {
            throw new IllegalArgumentException("rules are required");
        }
        if (current == null) {
            return SignalSet.NONE;
        }

        boolean buy = rules.buyRule() == BuyRule.THRESHOLD
                ? thresholdBuy(current, rules)
                : breakoutBuy(current, previous, rules);
        boolean sell50 = current.hasBbPosition() && current.bbPosition() >= rules.sell50Threshold();
        boolean sellAll = (current.hasBbPosition() && current.bbPosition() <= rules.sellAllThreshold())
                || (current.hasRsi() && current.rsi() < rules.rsiOversold());

        return new SignalSet(buy, sell50, sellAll);
    }

    public boolean isSqueezeBreakout(IndicatorRow current, IndicatorRow previous, SignalRules rules) {
        if (current == null || previous == null || !previous.squeeze()) {
            return false;
        }
        boolean outsideBands = current.close() > current.upperBand() || current.close() < current.lowerBand();
        return outsideBands && current.volumeRatio() > rules.breakoutVolumeRatio();
    }

    private boolean breakoutBuy(IndicatorRow current, IndicatorRow previous, SignalRules rules) {
        if (!isSqueezeBreakout(current, previous, rules) || !current.hasRsi()) {
            return false;
        }
        return current.close() > current.upperBand()
                && current.rsi() > rules.breakoutRsiLower()
                && current.rsi() < rules.breakoutRsiUpper();
    }

    private boolean thresholdBuy(IndicatorRow current, SignalRules rules) {
        return current.hasRsi() && current.rsi() > rules.rsiOverbought() && current.squeeze();
    }
}
