package org.nowstart.squeezewatch.data.dto;

import java.time.Duration;
import java.time.Instant;
import org.nowstart.squeezewatch.data.type.MonitorRunState;

public record MonitorStatusDto(
        MonitorRunState state,
        Instant startTime,
        Duration uptime,
        long scanCount,
        long signalsSent,
        Instant lastSignalTime,
        Instant lastHeartbeat,
        int watchlistCount,
        int alertRecordCount,
        boolean telegramConfigured,
        Duration scanInterval
) {

    public boolean running() {
        return state == MonitorRunState.RUNNING;
    }
}
