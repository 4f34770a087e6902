package org.nowstart.squeezewatch.strategy.core;

import java.time.Instant;

public record PriceBar(
        Instant timestamp,
        double open,
        double high,
        double low,
        double close,
        double volume
) {
}
