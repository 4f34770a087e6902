package org.nowstart.squeezewatch.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.squeezewatch.data.property.MonitorProperties;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "squeezewatch.monitor", name = "auto-start", havingValue = "true", matchIfMissing = true)
public class MonitorLauncher implements ApplicationRunner {

    private final MonitorScheduler monitorScheduler;
    private final MonitorProperties monitorProperties;

    @Override
    public void run(ApplicationArguments args) {
        log.info("event=monitor_launch interval={} watchlist={}", monitorProperties.interval(), monitorProperties.watchlist());
        monitorScheduler.start(monitorProperties.interval());
    }
}
