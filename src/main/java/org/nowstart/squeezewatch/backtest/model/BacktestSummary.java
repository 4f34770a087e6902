package org.nowstart.squeezewatch.backtest.model;

/**
 * Aggregate statistics over the instruments that completed a backtest. Return figures are in
 * percent units; {@code sharpeLike} is mean return divided by the population standard deviation
 * of returns.
 */
public record BacktestSummary(
        int totalInstruments,
        int profitableInstruments,
        double averageReturnPct,
        double medianReturnPct,
        String bestMarket,
        double bestReturnPct,
        String worstMarket,
        double worstReturnPct,
        double returnStdPct,
        double sharpeLike,
        double valueAtRisk95Pct,
        double averageWinRatePct,
        double averageMaxDrawdownPct,
        double averageProfit
) {

    public double successRatePct() {
        return totalInstruments == 0 ? 0.0 : profitableInstruments * 100.0 / totalInstruments;
    }
}
