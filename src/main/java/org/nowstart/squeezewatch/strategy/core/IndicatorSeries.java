package org.nowstart.squeezewatch.strategy.core;

import java.util.List;

public record IndicatorSeries(
        List<PriceBar> bars,
        int firstDefinedIndex,
        double[] sma,
        double[] stddev,
        double[] upperBand,
        double[] lowerBand,
        double[] bandWidth,
        boolean[] squeeze,
        double[] bbPosition,
        double[] rsi,
        double[] volumeRatio
) {

    public int size() {
        return bars.size();
    }

    public boolean isDefined(int index) {
        return index >= firstDefinedIndex && index >= 0 && index < bars.size();
    }

    public IndicatorRow row(int index) {
        if (!isDefined(index)) {
            return null;
        }
        return new IndicatorRow(
                bars.get(index).timestamp(),
                bars.get(index).close(),
                sma[index],
                stddev[index],
                upperBand[index],
                lowerBand[index],
                bandWidth[index],
                squeeze[index],
                bbPosition[index],
                rsi[index],
                volumeRatio[index]
        );
    }

    public IndicatorRow latest() {
        return row(bars.size() - 1);
    }

    public IndicatorRow previous() {
        return row(bars.size() - 2);
    }

    public int definedCount() {
        return Math.max(0, bars.size() - firstDefinedIndex);
    }
}
