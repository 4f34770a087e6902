package org.nowstart.squeezewatch.data.dto;

import java.time.Instant;
import java.util.List;
import org.nowstart.squeezewatch.data.type.SignalKind;

public record MarketAnalysisDto(
        String market,
        String displayName,
        Instant timestamp,
        double price,
        double rsi,
        double bbPosition,
        double bandWidth,
        boolean squeeze,
        boolean squeezeBreakout,
        double volumeRatio,
        List<SignalKind> signals
) {
}
