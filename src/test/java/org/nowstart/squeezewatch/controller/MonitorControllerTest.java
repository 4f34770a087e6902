package org.nowstart.squeezewatch.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.squeezewatch.data.dto.ManualScanResultDto;
import org.nowstart.squeezewatch.data.dto.MarketAnalysisDto;
import org.nowstart.squeezewatch.data.dto.MarketOverviewDto;
import org.nowstart.squeezewatch.data.dto.MonitorStatusDto;
import org.nowstart.squeezewatch.data.dto.NotificationTestDto;
import org.nowstart.squeezewatch.data.dto.WatchedInstrument;
import org.nowstart.squeezewatch.data.dto.WatchlistUpdateRequest;
import org.nowstart.squeezewatch.data.exception.MonitorApiException;
import org.nowstart.squeezewatch.data.type.MonitorRunState;
import org.nowstart.squeezewatch.scheduler.MonitorScheduler;
import org.nowstart.squeezewatch.service.MarketAnalysisService;
import org.nowstart.squeezewatch.service.MonitorStatusService;
import org.nowstart.squeezewatch.service.WatchlistService;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class MonitorControllerTest {

    @Mock
    private MonitorStatusService monitorStatusService;

    @Mock
    private MarketAnalysisService marketAnalysisService;

    @Mock
    private WatchlistService watchlistService;

    @Mock
    private MonitorScheduler monitorScheduler;

    @InjectMocks
    private MonitorController controller;

    @Test
    void getStatus_delegatesToService() {
        MonitorStatusDto status = status(MonitorRunState.RUNNING);
        when(monitorStatusService.status()).thenReturn(status);

        assertThat(controller.getStatus()).isEqualTo(status);
    }

    @Test
    void analyze_normalizesSymbol() {
        MarketAnalysisDto analysis = new MarketAnalysisDto(
                "KRW-ETH", "이더리움", Instant.parse("2024-05-01T00:00:00Z"),
                4_000_000.0, 55.0, 0.5, 0.04, true, false, 1.1, List.of());
        when(marketAnalysisService.analyze("KRW-ETH")).thenReturn(analysis);

        assertThat(controller.analyze("eth")).isEqualTo(analysis);
    }

    @Test
    void getOverview_delegatesToAnalysisService() {
        MarketOverviewDto overview = new MarketOverviewDto(
                Instant.parse("2024-05-01T00:00:00Z"), List.of(), List.of("KRW-BAD"));
        when(marketAnalysisService.overview()).thenReturn(overview);

        assertThat(controller.getOverview()).isEqualTo(overview);
    }

    @Test
    void scanWatchlist_runsManualScanOverWholeWatchlist() {
        ManualScanResultDto result = new ManualScanResultDto(List.of("KRW-BTC", "KRW-ETH"), 1, List.of());
        when(monitorScheduler.manualScan(null)).thenReturn(result);

        assertThat(controller.scanWatchlist()).isEqualTo(result);
    }

    @Test
    void scanMarket_runsManualScanForSymbol() {
        ManualScanResultDto result = new ManualScanResultDto(List.of("KRW-SOL"), 0, List.of());
        when(monitorScheduler.manualScan("sol")).thenReturn(result);

        assertThat(controller.scanMarket("sol")).isEqualTo(result);
    }

    @Test
    void testTelegram_returnsDeliveredResult() {
        NotificationTestDto result = new NotificationTestDto(true, true, Instant.parse("2024-05-01T00:00:00Z"));
        when(monitorScheduler.sendTestNotification()).thenReturn(result);

        assertThat(controller.testTelegram()).isEqualTo(result);
    }

    @Test
    void testTelegram_unavailableWhenNotConfigured() {
        when(monitorScheduler.sendTestNotification())
                .thenReturn(new NotificationTestDto(false, false, Instant.parse("2024-05-01T00:00:00Z")));

        assertThatThrownBy(() -> controller.testTelegram())
                .isInstanceOf(MonitorApiException.class)
                .satisfies(exception -> {
                    MonitorApiException apiException = (MonitorApiException) exception;
                    assertThat(apiException.getStatus()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
                    assertThat(apiException.getCode()).isEqualTo("telegram_not_configured");
                });
    }

    @Test
    void testTelegram_unavailableWhenDeliveryFails() {
        when(monitorScheduler.sendTestNotification())
                .thenReturn(new NotificationTestDto(true, false, Instant.parse("2024-05-01T00:00:00Z")));

        assertThatThrownBy(() -> controller.testTelegram())
                .isInstanceOf(MonitorApiException.class)
                .extracting("code")
                .isEqualTo("telegram_delivery_failed");
    }

    @Test
    void getWatchlist_returnsInstruments() {
        List<WatchedInstrument> instruments = List.of(new WatchedInstrument("KRW-BTC", "비트코인"));
        when(watchlistService.instruments()).thenReturn(instruments);

        assertThat(controller.getWatchlist()).isEqualTo(instruments);
    }

    @Test
    void addToWatchlist_returnsAddedMarkets() {
        when(watchlistService.add(List.of("sol", "btc"))).thenReturn(List.of("KRW-SOL"));

        assertThat(controller.addToWatchlist(new WatchlistUpdateRequest(List.of("sol", "btc"))))
                .containsExactly("KRW-SOL");
    }

    @Test
    void removeFromWatchlist_throwsNotFoundWhenNotWatched() {
        when(watchlistService.remove(List.of("doge"))).thenReturn(List.of());

        assertThatThrownBy(() -> controller.removeFromWatchlist("doge"))
                .isInstanceOf(MonitorApiException.class)
                .satisfies(exception -> {
                    MonitorApiException apiException = (MonitorApiException) exception;
                    assertThat(apiException.getStatus()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(apiException.getCode()).isEqualTo("market_not_watched");
                    assertThat(apiException.getMessage()).contains("KRW-DOGE");
                });
    }

    @Test
    void removeFromWatchlist_returnsRemovedMarket() {
        when(watchlistService.remove(List.of("btc"))).thenReturn(List.of("KRW-BTC"));

        assertThat(controller.removeFromWatchlist("btc")).containsExactly("KRW-BTC");
    }

    @Test
    void stop_stopsRunningMonitor() {
        when(monitorStatusService.status())
                .thenReturn(status(MonitorRunState.RUNNING))
                .thenReturn(status(MonitorRunState.STOPPED));

        MonitorStatusDto result = controller.stop();

        verify(monitorScheduler).stop();
        assertThat(result.running()).isFalse();
    }

    @Test
    void stop_conflictsWhenAlreadyStopped() {
        when(monitorStatusService.status()).thenReturn(status(MonitorRunState.STOPPED));

        assertThatThrownBy(() -> controller.stop())
                .isInstanceOf(MonitorApiException.class)
                .extracting("code")
                .isEqualTo("monitor_not_running");
        verify(monitorScheduler, never()).stop();
    }

    private MonitorStatusDto status(MonitorRunState state) {
        return new MonitorStatusDto(
                state,
                Instant.parse("2024-05-01T00:00:00Z"),
                Duration.ofMinutes(10),
                2,
                1,
                null,
                null,
                18,
                1,
                false,
                Duration.ofMinutes(5)
        );
    }
}
