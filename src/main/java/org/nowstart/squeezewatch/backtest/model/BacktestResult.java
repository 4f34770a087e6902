package org.nowstart.squeezewatch.backtest.model;

import java.util.List;

public record BacktestResult(
        String market,
        double initialCapital,
        double finalCash,
        List<TradeRecord> trades,
        List<CompletedTrade> completedTrades,
        List<EquityPoint> equityCurve,
        BacktestMetrics metrics
) {

    public double profit() {
        return finalCash - initialCapital;
    }
}
