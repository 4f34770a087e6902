package org.nowstart.squeezewatch.data.dto;

import java.util.List;

public record ManualScanResultDto(
        List<String> markets,
        int signalsSent,
        List<String> failedMarkets
) {
}
