package org.nowstart.squeezewatch.backtest.model;

import java.util.List;

/**
 * Results sorted by descending total return. {@code summary} is null when no instrument succeeded.
 */
public record BacktestBatchReport(
        List<BacktestResult> results,
        List<BacktestFailure> failures,
        BacktestSummary summary
) {

    public int attempted() {
        return results.size() + failures.size();
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }
}
