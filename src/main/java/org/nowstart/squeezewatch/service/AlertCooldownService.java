package org.nowstart.squeezewatch.service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.squeezewatch.data.property.MonitorProperties;
import org.nowstart.squeezewatch.data.type.SignalKind;
import org.springframework.stereotype.Service;

/**
 * Suppresses repeat alerts for the same (market, signal) pair within the cooldown window.
 * A permitted check records its timestamp immediately, whether or not delivery later succeeds.
 */
@Slf4j
@Service
public class AlertCooldownService {

    private final Duration cooldown;
    private final Map<AlertKey, Instant> lastFired = new ConcurrentHashMap<>();

    public AlertCooldownService(MonitorProperties monitorProperties) {
        this(monitorProperties.alertCooldown());
    }

    AlertCooldownService(Duration cooldown) {
        if (cooldown == null || cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must be >= 0");
        }
        this.cooldown = cooldown;
    }

    public boolean shouldFire(String market, SignalKind kind, Instant now) {
        AtomicBoolean fire = new AtomicBoolean(false);
        lastFired.compute(new AlertKey(market, kind), (key, previous) -> {
            if (previous == null || Duration.between(previous, now).compareTo(cooldown) >= 0) {
                fire.set(true);
                return now;
            }
            return previous;
        });
        if (!fire.get()) {
            log.debug("event=alert_suppressed market={} signal={}", market, kind);
        }
        return fire.get();
    }

    public int recordCount() {
        return lastFired.size();
    }

    public void clear() {
        lastFired.clear();
    }

    private record AlertKey(String market, SignalKind kind) {
    }
}
