package org.nowstart.squeezewatch.backtest.model;

/**
 * Percentages are expressed in percent units (50.0 means 50%). {@code profitFactor} is
 * positive infinity when no round-trip lost money.
 */
public record BacktestMetrics(
        double totalReturnPct,
        int totalTrades,
        int winningTrades,
        double winRatePct,
        double avgProfitPct,
        double avgLossPct,
        double profitFactor,
        double maxDrawdownPct,
        double finalValue,
        int testPeriodDays
) {

    public double annualizedReturnPct(double initialCapital) {
        if (testPeriodDays <= 0 || initialCapital <= 0.0 || finalValue <= 0.0) {
            return Double.NaN;
        }
        return (Math.pow(finalValue / initialCapital, 365.0 / testPeriodDays) - 1.0) * 100.0;
    }
}
