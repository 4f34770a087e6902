package org.nowstart.squeezewatch.strategy.core;

import java.time.Instant;

/**
 * Indicator values of one bar once every rolling window is full.
 * {@code bbPosition} is NaN when the bands collapse to zero width.
 */
public record IndicatorRow(
        Instant timestamp,
        double close,
        double sma,
        double stddev,
        double upperBand,
        double lowerBand,
        double bandWidth,
        boolean squeeze,
        double bbPosition,
        double rsi,
        double volumeRatio
) {

    public boolean hasBbPosition() {
        return Double.isFinite(bbPosition);
    }

    public boolean hasRsi() {
        return Double.isFinite(rsi);
    }
}
