package org.nowstart.squeezewatch.data.dto;

import java.time.Instant;
import java.util.List;

public record MarketOverviewDto(
        Instant generatedAt,
        List<MarketAnalysisDto> markets,
        List<String> failedMarkets
) {
}
