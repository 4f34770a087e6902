package org.nowstart.squeezewatch.service;

import java.time.Duration;
import java.time.Instant;
import org.nowstart.squeezewatch.data.type.MonitorRunState;
import org.springframework.stereotype.Component;

/**
 * Run state and counters shared by the scan loop, heartbeat loop, command listener and REST API.
 */
@Component
public class MonitorState {

    private MonitorRunState runState = MonitorRunState.STOPPED;
    private Instant startTime;
    private Duration interval = Duration.ZERO;
    private long scanCount;
    private long signalsSent;
    private Instant lastSignalTime;
    private Instant lastHeartbeat;

    // Resets counters; false when already running.
    public synchronized boolean markStarted(Instant now, Duration scanInterval) {
        if (runState == MonitorRunState.RUNNING) {
            return false;
        }
        runState = MonitorRunState.RUNNING;
        startTime = now;
        interval = scanInterval;
        scanCount = 0L;
        signalsSent = 0L;
        lastSignalTime = null;
        lastHeartbeat = null;
        return true;
    }

    public synchronized boolean markStopped() {
        if (runState == MonitorRunState.STOPPED) {
            return false;
        }
        runState = MonitorRunState.STOPPED;
        return true;
    }

    public synchronized boolean isRunning() {
        return runState == MonitorRunState.RUNNING;
    }

    public synchronized long incrementScanCount() {
        return ++scanCount;
    }

    public synchronized void recordSignalSent(Instant now) {
        signalsSent++;
        lastSignalTime = now;
    }

    public synchronized void recordHeartbeat(Instant now) {
        lastHeartbeat = now;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(runState, startTime, interval, scanCount, signalsSent, lastSignalTime, lastHeartbeat);
    }

    public record Snapshot(
            MonitorRunState runState,
            Instant startTime,
            Duration interval,
            long scanCount,
            long signalsSent,
            Instant lastSignalTime,
            Instant lastHeartbeat
    ) {
    }
}
