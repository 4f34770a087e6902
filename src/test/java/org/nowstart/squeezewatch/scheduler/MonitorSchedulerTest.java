package org.nowstart.squeezewatch.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.squeezewatch.data.dto.ManualScanResultDto;
import org.nowstart.squeezewatch.data.dto.MarketAnalysisDto;
import org.nowstart.squeezewatch.data.dto.MonitorStatusDto;
import org.nowstart.squeezewatch.data.dto.NotificationTestDto;
import org.nowstart.squeezewatch.data.exception.MarketDataException;
import org.nowstart.squeezewatch.data.property.MonitorProperties;
import org.nowstart.squeezewatch.data.property.TelegramProperties;
import org.nowstart.squeezewatch.data.type.MonitorRunState;
import org.nowstart.squeezewatch.data.type.SignalKind;
import org.nowstart.squeezewatch.service.AlertCooldownService;
import org.nowstart.squeezewatch.service.AlertMessageFormatter;
import org.nowstart.squeezewatch.service.MarketAnalysisService;
import org.nowstart.squeezewatch.service.MonitorState;
import org.nowstart.squeezewatch.service.MonitorStatusService;
import org.nowstart.squeezewatch.service.NotificationService;
import org.nowstart.squeezewatch.service.TelegramCommandListener;
import org.nowstart.squeezewatch.service.WatchlistService;

@ExtendWith(MockitoExtension.class)
class MonitorSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

    @Mock
    private MonitorStatusService monitorStatusService;

    @Mock
    private WatchlistService watchlistService;

    @Mock
    private MarketAnalysisService marketAnalysisService;

    @Mock
    private NotificationService notificationService;

    @Mock
    private AlertMessageFormatter alertMessageFormatter;

    @Mock
    private TelegramCommandListener telegramCommandListener;

    private final MonitorState monitorState = new MonitorState();

    @Test
    void runScanPass_countsOnlyDeliveredAlerts() {
        MarketAnalysisDto btc = analysis("KRW-BTC", List.of(SignalKind.BUY, SignalKind.SELL_50));
        MarketAnalysisDto eth = analysis("KRW-ETH", List.of());
        when(watchlistService.markets()).thenReturn(List.of("KRW-BTC", "KRW-ETH"));
        when(marketAnalysisService.analyze("KRW-BTC")).thenReturn(btc);
        when(marketAnalysisService.analyze("KRW-ETH")).thenReturn(eth);
        when(alertMessageFormatter.alert(btc, SignalKind.BUY)).thenReturn("buy");
        when(alertMessageFormatter.alert(btc, SignalKind.SELL_50)).thenReturn("sell50");
        when(notificationService.send("buy")).thenReturn(true);
        when(notificationService.send("sell50")).thenReturn(false);

        int delivered = scheduler("").runScanPass();

        MonitorState.Snapshot snapshot = monitorState.snapshot();
        assertThat(delivered).isEqualTo(1);
        assertThat(snapshot.scanCount()).isEqualTo(1);
        assertThat(snapshot.signalsSent()).isEqualTo(1);
        assertThat(snapshot.lastSignalTime()).isEqualTo(NOW);
    }

    @Test
    void runScanPass_cooldownSuppressesRepeatAlert() {
        MarketAnalysisDto btc = analysis("KRW-BTC", List.of(SignalKind.BUY));
        when(watchlistService.markets()).thenReturn(List.of("KRW-BTC"));
        when(marketAnalysisService.analyze("KRW-BTC")).thenReturn(btc);
        when(alertMessageFormatter.alert(btc, SignalKind.BUY)).thenReturn("buy");
        when(notificationService.send("buy")).thenReturn(true);
        MonitorScheduler scheduler = scheduler("");

        int first = scheduler.runScanPass();
        int second = scheduler.runScanPass();

        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        verify(notificationService, times(1)).send("buy");
        assertThat(monitorState.snapshot().scanCount()).isEqualTo(2);
    }

    @Test
    void runScanPass_skipsFailingMarket() {
        MarketAnalysisDto eth = analysis("KRW-ETH", List.of(SignalKind.SELL_ALL));
        when(watchlistService.markets()).thenReturn(List.of("KRW-BAD", "KRW-ETH"));
        when(marketAnalysisService.analyze("KRW-BAD"))
                .thenThrow(new MarketDataException("KRW-BAD", "fetch_failed", "down"));
        when(marketAnalysisService.analyze("KRW-ETH")).thenReturn(eth);
        when(alertMessageFormatter.alert(eth, SignalKind.SELL_ALL)).thenReturn("sell all");
        when(notificationService.send("sell all")).thenReturn(true);

        int delivered = scheduler("").runScanPass();

        assertThat(delivered).isEqualTo(1);
        assertThat(monitorState.snapshot().signalsSent()).isEqualTo(1);
    }

    @Test
    void runScanPass_sendsSummaryEveryFifthPass() {
        MonitorStatusDto status = status();
        when(watchlistService.markets()).thenReturn(List.of());
        when(monitorStatusService.status()).thenReturn(status);
        when(alertMessageFormatter.summary(status, NOW)).thenReturn("summary");
        MonitorScheduler scheduler = scheduler("token");

        for (int i = 0; i < 6; i++) {
            scheduler.runScanPass();
        }

        verify(notificationService, times(1)).send("summary");
    }

    @Test
    void manualScan_singleMarketUsesCooldownWithoutCountingPass() {
        MarketAnalysisDto btc = analysis("KRW-BTC", List.of(SignalKind.BUY));
        when(marketAnalysisService.analyze("KRW-BTC")).thenReturn(btc);
        when(alertMessageFormatter.alert(btc, SignalKind.BUY)).thenReturn("buy");
        when(notificationService.send("buy")).thenReturn(true);
        MonitorScheduler scheduler = scheduler("");

        ManualScanResultDto first = scheduler.manualScan("btc");
        ManualScanResultDto second = scheduler.manualScan("KRW-BTC");

        assertThat(first.markets()).containsExactly("KRW-BTC");
        assertThat(first.signalsSent()).isEqualTo(1);
        assertThat(second.signalsSent()).isZero();
        assertThat(monitorState.snapshot().scanCount()).isZero();
        assertThat(monitorState.snapshot().signalsSent()).isEqualTo(1);
    }

    @Test
    void manualScan_singleMarketPropagatesFailure() {
        when(marketAnalysisService.analyze("KRW-BAD"))
                .thenThrow(new MarketDataException("KRW-BAD", "insufficient_data", "short"));

        assertThatThrownBy(() -> scheduler("").manualScan("bad"))
                .isInstanceOf(MarketDataException.class)
                .extracting("code")
                .isEqualTo("insufficient_data");
    }

    @Test
    void manualScan_watchlistSkipsFailingMarkets() {
        MarketAnalysisDto eth = analysis("KRW-ETH", List.of(SignalKind.SELL_ALL));
        when(watchlistService.markets()).thenReturn(List.of("KRW-BAD", "KRW-ETH"));
        when(marketAnalysisService.analyze("KRW-BAD"))
                .thenThrow(new MarketDataException("KRW-BAD", "fetch_failed", "down"));
        when(marketAnalysisService.analyze("KRW-ETH")).thenReturn(eth);
        when(alertMessageFormatter.alert(eth, SignalKind.SELL_ALL)).thenReturn("sell all");
        when(notificationService.send("sell all")).thenReturn(true);

        ManualScanResultDto result = scheduler("").manualScan(null);

        assertThat(result.markets()).containsExactly("KRW-ETH");
        assertThat(result.failedMarkets()).containsExactly("KRW-BAD");
        assertThat(result.signalsSent()).isEqualTo(1);
        assertThat(monitorState.snapshot().scanCount()).isZero();
    }

    @Test
    void sendTestNotification_reportsDelivery() {
        when(notificationService.isConfigured()).thenReturn(true);
        when(alertMessageFormatter.connectionTest(NOW)).thenReturn("test");
        when(notificationService.send("test")).thenReturn(true);

        NotificationTestDto result = scheduler("token").sendTestNotification();

        assertThat(result).isEqualTo(new NotificationTestDto(true, true, NOW));
    }

    @Test
    void sendHeartbeat_recordsDeliveredHeartbeat() {
        MonitorStatusDto status = status();
        when(monitorStatusService.status()).thenReturn(status);
        when(alertMessageFormatter.heartbeat(status, NOW)).thenReturn("heartbeat");
        when(notificationService.send("heartbeat")).thenReturn(true);

        scheduler("token").sendHeartbeat();

        assertThat(monitorState.snapshot().lastHeartbeat()).isEqualTo(NOW);
    }

    @Test
    void sendHeartbeat_skippedWithoutToken() {
        scheduler("").sendHeartbeat();

        verifyNoInteractions(notificationService);
        assertThat(monitorState.snapshot().lastHeartbeat()).isNull();
    }

    @Test
    void stop_isIgnoredWhenNotRunning() {
        scheduler("token").stop();

        verifyNoInteractions(telegramCommandListener);
        verify(notificationService, never()).send(anyString());
    }

    @Test
    void start_rejectsNonPositiveInterval() {
        assertThatThrownBy(() -> scheduler("").start(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void start_runsUntilStopped() throws InterruptedException {
        when(watchlistService.markets()).thenReturn(List.of());
        MonitorScheduler scheduler = scheduler("");
        Thread runner = new Thread(() -> scheduler.start(Duration.ofHours(1)), "monitor-test");

        runner.start();
        long deadline = System.currentTimeMillis() + 5_000;
        while (monitorState.snapshot().scanCount() < 1 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        List<Thread> loopThreads = Thread.getAllStackTraces().keySet().stream()
                .filter(thread -> thread.getName().startsWith("monitor-loop-"))
                .toList();
        scheduler.stop();
        runner.join(5_000);

        assertThat(runner.isAlive()).isFalse();
        assertThat(loopThreads).isNotEmpty().allMatch(Thread::isDaemon);
        assertThat(monitorState.snapshot().scanCount()).isEqualTo(1);
        assertThat(monitorState.snapshot().runState()).isEqualTo(MonitorRunState.STOPPED);
        verify(telegramCommandListener).start();
        verify(telegramCommandListener).stop();
    }

    private MonitorScheduler scheduler(String botToken) {
        MonitorProperties monitorProperties = new MonitorProperties(
                false,
                Duration.ofMinutes(5),
                Duration.ofHours(1),
                Duration.ofHours(1),
                Duration.ZERO,
                Duration.ofSeconds(30),
                Duration.ofSeconds(5),
                5,
                10,
                100,
                List.of("KRW-BTC"),
                Map.of()
        );
        TelegramProperties telegramProperties = new TelegramProperties(
                "https://api.telegram.org", botToken, "42", 10, Duration.ofSeconds(30));
        return new MonitorScheduler(
                monitorProperties,
                telegramProperties,
                monitorState,
                monitorStatusService,
                watchlistService,
                marketAnalysisService,
                new AlertCooldownService(monitorProperties),
                notificationService,
                alertMessageFormatter,
                telegramCommandListener,
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    private MarketAnalysisDto analysis(String market, List<SignalKind> signals) {
        return new MarketAnalysisDto(market, market, NOW, 1000.0, 55.0, 0.5, 0.04, false, false, 1.0, signals);
    }

    private MonitorStatusDto status() {
        return new MonitorStatusDto(
                MonitorRunState.RUNNING,
                NOW,
                Duration.ZERO,
                5,
                0,
                null,
                null,
                0,
                0,
                true,
                Duration.ofMinutes(5)
        );
    }
}
