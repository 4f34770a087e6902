package org.nowstart.squeezewatch.backtest.model;

import org.nowstart.squeezewatch.data.type.TradeAction;

import java.time.Instant;

public record TradeRecord(
        String market,
        TradeAction action,
        Instant timestamp,
        double price,
        double quantity,
        double cashValue
) {}
