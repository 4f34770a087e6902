package org.nowstart.squeezewatch.scheduler;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.squeezewatch.data.dto.ManualScanResultDto;
import org.nowstart.squeezewatch.data.dto.MarketAnalysisDto;
import org.nowstart.squeezewatch.data.dto.NotificationTestDto;
import org.nowstart.squeezewatch.data.property.MonitorProperties;
import org.nowstart.squeezewatch.data.property.TelegramProperties;
import org.nowstart.squeezewatch.data.type.SignalKind;
import org.nowstart.squeezewatch.service.AlertCooldownService;
import org.nowstart.squeezewatch.service.AlertMessageFormatter;
import org.nowstart.squeezewatch.service.MarketAnalysisService;
import org.nowstart.squeezewatch.service.MarketDataService;
import org.nowstart.squeezewatch.service.MonitorState;
import org.nowstart.squeezewatch.service.MonitorStatusService;
import org.nowstart.squeezewatch.service.NotificationService;
import org.nowstart.squeezewatch.service.TelegramCommandListener;
import org.nowstart.squeezewatch.service.WatchlistService;
import org.springframework.stereotype.Service;

/**
 * Drives the scan loop and the heartbeat loop. {@link #start(Duration)} blocks the caller until the
 * scan loop ends; {@link #stop()} may be called from any other thread. Every sleep waits on the stop
 * latch so cancellation takes effect at the next sleep boundary.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MonitorScheduler {

    private final MonitorProperties monitorProperties;
    private final TelegramProperties telegramProperties;
    private final MonitorState monitorState;
    private final MonitorStatusService monitorStatusService;
    private final WatchlistService watchlistService;
    private final MarketAnalysisService marketAnalysisService;
    private final AlertCooldownService alertCooldownService;
    private final NotificationService notificationService;
    private final AlertMessageFormatter alertMessageFormatter;
    private final TelegramCommandListener telegramCommandListener;
    private final Clock clock;

    private final Object lifecycleLock = new Object();
    private CountDownLatch stopSignal = new CountDownLatch(1);
    private ExecutorService loopExecutor;

    public void start(Duration interval) {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be > 0");
        }

        Future<?> scanLoop;
        synchronized (lifecycleLock) {
            if (!monitorState.markStarted(clock.instant(), interval)) {
                log.warn("event=monitor_start_ignored reason=already_running");
                return;
            }
            CountDownLatch signal = new CountDownLatch(1);
            stopSignal = signal;
            loopExecutor = Executors.newFixedThreadPool(2, namedThreadFactory());

            log.info("event=monitor_started interval={} markets={}", interval, watchlistService.size());
            if (telegramProperties.hasToken()) {
                notificationService.send(alertMessageFormatter.started(
                        monitorStatusService.status(),
                        monitorProperties.heartbeatInterval()
                ));
            }
            telegramCommandListener.start();
            loopExecutor.submit(() -> heartbeatLoop(signal));
            scanLoop = loopExecutor.submit(() -> scanLoop(interval, signal));
        }

        try {
            scanLoop.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("event=monitor_wait_interrupted");
            stop();
        } catch (ExecutionException e) {
            log.error("event=scan_loop_crashed", e.getCause());
            stop();
        }
    }

    public void stop() {
        ExecutorService executor;
        synchronized (lifecycleLock) {
            if (!monitorState.markStopped()) {
                log.warn("event=monitor_stop_ignored reason=not_running");
                return;
            }
            stopSignal.countDown();
            telegramCommandListener.stop();
            executor = loopExecutor;
            loopExecutor = null;
        }

        if (executor != null) {
            executor.shutdown();
            awaitTermination(executor);
        }

        if (telegramProperties.hasToken()) {
            notificationService.send(alertMessageFormatter.stopped(monitorStatusService.status(), clock.instant()));
        }
        log.info("event=monitor_stopped scans={} signals_sent={}",
                monitorState.snapshot().scanCount(), monitorState.snapshot().signalsSent());
    }

    @PreDestroy
    public void shutdown() {
        if (monitorState.isRunning()) {
            stop();
        }
    }

    /**
     * One pass over the watchlist in order. Per-market failures are logged and skipped.
     *
     * @return number of alerts delivered during the pass
     */
    public int runScanPass() {
        long scan = monitorState.incrementScanCount();
        CountDownLatch signal;
        synchronized (lifecycleLock) {
            signal = stopSignal;
        }
        ManualScanResultDto result = scanMarkets(String.valueOf(scan), watchlistService.markets(), signal);

        if (scan % monitorProperties.summaryEvery() == 0 && telegramProperties.hasToken()) {
            notificationService.send(alertMessageFormatter.summary(monitorStatusService.status(), clock.instant()));
        }
        return result.signalsSent();
    }

    /**
     * One-off scan outside the loop, through the same cooldown and delivery path. Does not count as a
     * scheduled pass. A single market propagates its failure; a watchlist scan skips failing markets.
     *
     * @param market market or symbol to scan, or {@code null} for the whole watchlist
     */
    public ManualScanResultDto manualScan(String market) {
        if (market == null) {
            log.info("event=manual_scan scope=watchlist");
            return scanMarkets("manual", watchlistService.markets(), new CountDownLatch(1));
        }
        String normalized = MarketDataService.normalizeMarket(market);
        log.info("event=manual_scan scope=market market={}", normalized);
        return new ManualScanResultDto(List.of(normalized), scanMarket(normalized), List.of());
    }

    public NotificationTestDto sendTestNotification() {
        Instant now = clock.instant();
        boolean configured = notificationService.isConfigured();
        boolean delivered = notificationService.send(alertMessageFormatter.connectionTest(now));
        if (delivered) {
            log.info("event=telegram_test_sent");
        } else {
            log.error("event=telegram_test_failed configured={}", configured);
        }
        return new NotificationTestDto(configured, delivered, now);
    }

    public void sendHeartbeat() {
        if (!telegramProperties.hasToken()) {
            return;
        }
        Instant now = clock.instant();
        if (notificationService.send(alertMessageFormatter.heartbeat(monitorStatusService.status(), now))) {
            monitorState.recordHeartbeat(now);
            log.info("event=heartbeat_sent uptime={}", monitorStatusService.status().uptime());
        } else {
            log.error("event=heartbeat_failed");
        }
    }

    int scanMarket(String market) {
        MarketAnalysisDto analysis = marketAnalysisService.analyze(market);
        int delivered = 0;
        for (SignalKind kind : analysis.signals()) {
            Instant now = clock.instant();
            if (!alertCooldownService.shouldFire(market, kind, now)) {
                continue;
            }
            if (notificationService.send(alertMessageFormatter.alert(analysis, kind))) {
                monitorState.recordSignalSent(now);
                delivered++;
                log.info("event=signal_sent market={} signal={} price={} rsi={} bb_position={}",
                        market, kind, analysis.price(), analysis.rsi(), analysis.bbPosition());
            } else {
                log.warn("event=signal_not_delivered market={} signal={}", market, kind);
            }
        }
        return delivered;
    }

    private ManualScanResultDto scanMarkets(String scan, List<String> markets, CountDownLatch cancel) {
        log.info("event=scan_pass_started scan={} markets={}", scan, markets.size());

        List<String> scanned = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        int delivered = 0;
        for (int i = 0; i < markets.size(); i++) {
            if (cancel.getCount() == 0) {
                log.info("event=scan_pass_aborted scan={} processed={}", scan, i);
                break;
            }
            String market = markets.get(i);
            if ((i + 1) % monitorProperties.progressEvery() == 0) {
                log.info("event=scan_progress scan={} processed={} total={} pct={}",
                        scan, i + 1, markets.size(), (i + 1) * 100 / markets.size());
            }

            try {
                delivered += scanMarket(market);
                scanned.add(market);
            } catch (Exception e) {
                log.error("event=market_scan_failed scan={} market={} error={}", scan, market, e.getMessage());
                failed.add(market);
            }

            if (i < markets.size() - 1 && await(cancel, monitorProperties.pacingDelay())) {
                break;
            }
        }

        if (!failed.isEmpty()) {
            log.warn("event=scan_pass_failures scan={} markets={}", scan, String.join(",", failed));
        }
        log.info("event=scan_pass_completed scan={} signals_sent={} failed={}", scan, delivered, failed.size());
        return new ManualScanResultDto(List.copyOf(scanned), delivered, List.copyOf(failed));
    }

    private void scanLoop(Duration interval, CountDownLatch signal) {
        while (signal.getCount() > 0) {
            long startedAt = System.nanoTime();
            try {
                runScanPass();
            } catch (Exception e) {
                log.error("event=scan_loop_error backoff={}", monitorProperties.errorBackoff(), e);
                if (await(signal, monitorProperties.errorBackoff())) {
                    break;
                }
                continue;
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
            Duration wait = interval.minus(elapsed);
            log.info("event=next_scan_scheduled in={}", wait.isNegative() ? Duration.ZERO : wait);
            if (await(signal, wait)) {
                break;
            }
        }
        log.info("event=scan_loop_exited");
    }

    private void heartbeatLoop(CountDownLatch signal) {
        while (!await(signal, monitorProperties.heartbeatInterval())) {
            try {
                sendHeartbeat();
            } catch (Exception e) {
                log.error("event=heartbeat_loop_error", e);
            }
        }
    }

    // True when stop was requested before the delay elapsed.
    private boolean await(CountDownLatch signal, Duration delay) {
        if (delay.isNegative() || delay.isZero()) {
            return signal.getCount() == 0;
        }
        try {
            return signal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private void awaitTermination(ExecutorService executor) {
        Duration timeout = monitorProperties.shutdownTimeout();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("event=monitor_loops_abandoned timeout={}", timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("event=monitor_stop_wait_interrupted");
        }
    }

    private ThreadFactory namedThreadFactory() {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "monitor-loop-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
