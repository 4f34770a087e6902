package org.nowstart.squeezewatch.backtest.model;

import java.time.Instant;

public record EquityPoint(
        Instant timestamp,
        double close,
        double cash,
        double holdingsValue
) {

    public double portfolioValue() {
        return cash + holdingsValue;
    }
}
