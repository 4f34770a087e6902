package org.nowstart.squeezewatch.backtest.model;

public record BacktestFailure(
        String market,
        String code,
        String reason
) {}
