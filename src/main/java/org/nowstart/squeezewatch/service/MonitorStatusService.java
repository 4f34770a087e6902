package org.nowstart.squeezewatch.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.nowstart.squeezewatch.data.dto.MonitorStatusDto;
import org.nowstart.squeezewatch.data.property.MonitorProperties;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MonitorStatusService {

    private final MonitorState monitorState;
    private final WatchlistService watchlistService;
    private final AlertCooldownService alertCooldownService;
    private final NotificationService notificationService;
    private final MonitorProperties monitorProperties;
    private final Clock clock;

    public MonitorStatusDto status() {
        MonitorState.Snapshot snapshot = monitorState.snapshot();
        Instant now = clock.instant();
        Duration uptime = snapshot.startTime() == null ? Duration.ZERO : Duration.between(snapshot.startTime(), now);
        Duration interval = snapshot.interval().isZero() ? monitorProperties.interval() : snapshot.interval();

        return new MonitorStatusDto(
                snapshot.runState(),
                snapshot.startTime(),
                uptime,
                snapshot.scanCount(),
                snapshot.signalsSent(),
                snapshot.lastSignalTime(),
                snapshot.lastHeartbeat(),
                watchlistService.size(),
                alertCooldownService.recordCount(),
                notificationService.isConfigured(),
                interval
        );
    }
}
