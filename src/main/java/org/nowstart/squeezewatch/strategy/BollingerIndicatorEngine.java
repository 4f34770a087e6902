package org.nowstart.squeezewatch.strategy;

import java.util.Arrays;
import java.util.List;
import org.nowstart.squeezewatch.data.type.SqueezePolicy;
import org.nowstart.squeezewatch.strategy.core.IndicatorParams;
import org.nowstart.squeezewatch.strategy.core.IndicatorSeries;
import org.nowstart.squeezewatch.strategy.core.PriceBar;
import org.springframework.stereotype.Component;

@Component
public class BollingerIndicatorEngine {

    public IndicatorSeries compute(List<PriceBar> bars, IndicatorParams params) {
        if (bars == null || params == null) {
            throw new IllegalArgumentException("bars and params are required");
        }

        List<PriceBar> series = List.copyOf(bars);
        int n = series.size();
        double[] close = series.stream().mapToDouble(PriceBar::close).toArray();
        double[] volume = series.stream().mapToDouble(PriceBar::volume).toArray();

        double[] sma = rollingMean(close, params.bbPeriod());
        double[] stddev = rollingPopulationStd(close, sma, params.bbPeriod());
        double[] upper = fillNaN(n);
        double[] lower = fillNaN(n);
        double[] bandWidth = fillNaN(n);
        double[] bbPosition = fillNaN(n);

        for (int i = 0; i < n; i++) {
            if (!Double.isFinite(sma[i]) || !Double.isFinite(stddev[i])) {
                continue;
            }
            upper[i] = sma[i] + (params.bbStdMultiplier() * stddev[i]);
            lower[i] = sma[i] - (params.bbStdMultiplier() * stddev[i]);
            if (sma[i] != 0.0) {
                bandWidth[i] = (upper[i] - lower[i]) / sma[i];
            }
            double range = upper[i] - lower[i];
            if (range > 0.0) {
                bbPosition[i] = (close[i] - lower[i]) / range;
            }
        }

        boolean[] squeeze = params.squeezePolicy() == SqueezePolicy.QUANTILE
                ? quantileSqueeze(bandWidth, params.volatilityLookback(), params.volatilityThreshold())
                : rollingMinSqueeze(bandWidth, params.squeezeWindow(), params.squeezeMinFactor());
        double[] rsi = simpleRsi(close, params.rsiPeriod());
        double[] volumeRatio = volumeRatio(volume, params.volumePeriod());

        return new IndicatorSeries(
                series,
                params.warmupBars() - 1,
                sma,
                stddev,
                upper,
                lower,
                bandWidth,
                squeeze,
                bbPosition,
                rsi,
                volumeRatio
        );
    }

    double[] rollingMean(double[] values, int window) {
        int n = values.length;
        double[] mean = fillNaN(n);
        if (window <= 0 || n < window) {
            return mean;
        }

        for (int i = window - 1; i < n; i++) {
            double sum = 0.0;
            for (int j = i - window + 1; j <= i; j++) {
                sum += values[j];
            }
            mean[i] = sum / window;
        }
        return mean;
    }

    double[] rollingPopulationStd(double[] values, double[] mean, int window) {
        int n = values.length;
        double[] std = fillNaN(n);
        for (int i = window - 1; i < n; i++) {
            if (!Double.isFinite(mean[i])) {
                continue;
            }
            double squares = 0.0;
            for (int j = i - window + 1; j <= i; j++) {
                double diff = values[j] - mean[i];
                squares += diff * diff;
            }
            std[i] = Math.sqrt(squares / window);
        }
        return std;
    }

    boolean[] rollingMinSqueeze(double[] bandWidth, int window, double factor) {
        int n = bandWidth.length;
        boolean[] squeeze = new boolean[n];
        for (int i = window - 1; i < n; i++) {
            if (!Double.isFinite(bandWidth[i])) {
                continue;
            }
            double min = Double.POSITIVE_INFINITY;
            boolean complete = true;
            for (int j = i - window + 1; j <= i; j++) {
                if (!Double.isFinite(bandWidth[j])) {
                    complete = false;
                    break;
                }
                min = Math.min(min, bandWidth[j]);
            }
            squeeze[i] = complete && bandWidth[i] < min * factor;
        }
        return squeeze;
    }

    boolean[] quantileSqueeze(double[] bandWidth, int lookback, double threshold) {
        int n = bandWidth.length;
        boolean[] squeeze = new boolean[n];
        for (int i = lookback - 1; i < n; i++) {
            if (!Double.isFinite(bandWidth[i])) {
                continue;
            }
            double[] window = Arrays.copyOfRange(bandWidth, i - lookback + 1, i + 1);
            if (Arrays.stream(window).anyMatch(value -> !Double.isFinite(value))) {
                continue;
            }
            squeeze[i] = bandWidth[i] < quantile(window, threshold);
        }
        return squeeze;
    }

    double[] simpleRsi(double[] close, int period) {
        int n = close.length;
        double[] rsi = fillNaN(n);
        if (period <= 0 || n <= period) {
            return rsi;
        }

        for (int i = period; i < n; i++) {
            double gain = 0.0;
            double loss = 0.0;
            for (int j = i - period + 1; j <= i; j++) {
                double delta = close[j] - close[j - 1];
                if (delta > 0.0) {
                    gain += delta;
                } else {
                    loss -= delta;
                }
            }
            gain /= period;
            loss /= period;
            rsi[i] = loss == 0.0 ? 100.0 : 100.0 - (100.0 / (1.0 + (gain / loss)));
        }
        return rsi;
    }

    double[] volumeRatio(double[] volume, int period) {
        int n = volume.length;
        double[] ratio = new double[n];
        Arrays.fill(ratio, 1.0);
        double[] mean = rollingMean(volume, period);
        for (int i = 0; i < n; i++) {
            if (Double.isFinite(mean[i]) && mean[i] > 0.0 && Double.isFinite(volume[i])) {
                ratio[i] = volume[i] / mean[i];
            }
        }
        return ratio;
    }

    // Linear interpolation between closest ranks.
    double quantile(double[] values, double q) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double position = q * (sorted.length - 1);
        int lowerIndex = (int) Math.floor(position);
        int upperIndex = (int) Math.ceil(position);
        double weight = position - lowerIndex;
        return sorted[lowerIndex] + ((sorted[upperIndex] - sorted[lowerIndex]) * weight);
    }

    private double[] fillNaN(int size) {
        double[] values = new double[size];
        Arrays.fill(values, Double.NaN);
        return values;
    }
}
