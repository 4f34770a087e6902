package org.nowstart.squeezewatch.backtest.model;

import java.time.Instant;

/**
 * A BUY paired with one closing sell, partial or full. Profit is measured from the BUY price.
 */
public record CompletedTrade(
        Instant entryTime,
        Instant exitTime,
        double entryPrice,
        double exitPrice,
        double profitPct
) {

    public boolean isWinning() {
        return profitPct > 0.0;
    }
}
