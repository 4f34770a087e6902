package org.nowstart.squeezewatch.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.squeezewatch.data.dto.ManualScanResultDto;
import org.nowstart.squeezewatch.data.dto.MarketAnalysisDto;
import org.nowstart.squeezewatch.data.dto.MarketOverviewDto;
import org.nowstart.squeezewatch.data.dto.MonitorStatusDto;
import org.nowstart.squeezewatch.data.dto.NotificationTestDto;
import org.nowstart.squeezewatch.data.dto.WatchedInstrument;
import org.nowstart.squeezewatch.data.dto.WatchlistUpdateRequest;
import org.nowstart.squeezewatch.data.exception.MonitorApiException;
import org.nowstart.squeezewatch.scheduler.MonitorScheduler;
import org.nowstart.squeezewatch.service.MarketAnalysisService;
import org.nowstart.squeezewatch.service.MarketDataService;
import org.nowstart.squeezewatch.service.MonitorStatusService;
import org.nowstart.squeezewatch.service.WatchlistService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/monitor")
@RequiredArgsConstructor
@Tag(name = "Monitor", description = "모니터링 상태 조회, 코인 분석, 감시 목록 관리 API")
public class MonitorController {

    private final MonitorStatusService monitorStatusService;
    private final MarketAnalysisService marketAnalysisService;
    private final WatchlistService watchlistService;
    private final MonitorScheduler monitorScheduler;

    @GetMapping("/status")
    @Operation(summary = "모니터링 상태 조회", description = "실행 상태, 가동 시간, 스캔/알림 횟수를 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공")
    })
    public MonitorStatusDto getStatus() {
        return monitorStatusService.status();
    }

    @GetMapping("/ticker/{symbol}")
    @Operation(summary = "코인 분석", description = "심볼(BTC 또는 KRW-BTC)의 최신 지표와 신호를 계산합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "분석 성공"),
            @ApiResponse(responseCode = "422", description = "데이터 부족 또는 검증 실패"),
            @ApiResponse(responseCode = "502", description = "업비트 조회 실패")
    })
    public MarketAnalysisDto analyze(@PathVariable String symbol) {
        return marketAnalysisService.analyze(MarketDataService.normalizeMarket(symbol));
    }

    @GetMapping("/overview")
    @Operation(summary = "시장 개요", description = "감시 목록 전체의 가격, RSI, BB 위치, 변동성 압축, 신호를 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공 (실패한 마켓은 failedMarkets에 표시)")
    })
    public MarketOverviewDto getOverview() {
        return marketAnalysisService.overview();
    }

    @PostMapping("/scan")
    @Operation(summary = "수동 스캔 (전체)", description = "감시 목록 전체를 즉시 스캔하고 쿨다운을 거쳐 알림을 전송합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "스캔 완료")
    })
    public ManualScanResultDto scanWatchlist() {
        return monitorScheduler.manualScan(null);
    }

    @PostMapping("/scan/{symbol}")
    @Operation(summary = "수동 스캔 (단일)", description = "지정한 코인을 즉시 스캔하고 쿨다운을 거쳐 알림을 전송합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "스캔 완료"),
            @ApiResponse(responseCode = "422", description = "데이터 부족 또는 검증 실패"),
            @ApiResponse(responseCode = "502", description = "업비트 조회 실패")
    })
    public ManualScanResultDto scanMarket(@PathVariable String symbol) {
        return monitorScheduler.manualScan(symbol);
    }

    @PostMapping("/telegram/test")
    @Operation(summary = "텔레그램 연결 테스트", description = "설정된 채팅으로 테스트 메시지를 전송합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "전송 성공"),
            @ApiResponse(responseCode = "503", description = "텔레그램 미설정 또는 전송 실패")
    })
    public NotificationTestDto testTelegram() {
        NotificationTestDto result = monitorScheduler.sendTestNotification();
        if (!result.configured()) {
            throw new MonitorApiException(HttpStatus.SERVICE_UNAVAILABLE, "telegram_not_configured",
                    "Telegram bot token or chat id is not configured");
        }
        if (!result.delivered()) {
            throw new MonitorApiException(HttpStatus.SERVICE_UNAVAILABLE, "telegram_delivery_failed",
                    "Telegram test message was not delivered");
        }
        return result;
    }

    @GetMapping("/watchlist")
    @Operation(summary = "감시 목록 조회", description = "현재 감시 중인 마켓과 표시 이름을 조회합니다.")
    public List<WatchedInstrument> getWatchlist() {
        return watchlistService.instruments();
    }

    @PostMapping("/watchlist")
    @Operation(summary = "감시 목록 추가", description = "마켓을 감시 목록에 추가합니다. KRW- 접두사는 생략할 수 있습니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "추가된 마켓 목록"),
            @ApiResponse(responseCode = "400", description = "요청 검증 실패")
    })
    public List<String> addToWatchlist(@RequestBody @Valid WatchlistUpdateRequest request) {
        return watchlistService.add(request.markets());
    }

    @DeleteMapping("/watchlist/{symbol}")
    @Operation(summary = "감시 목록 제거", description = "마켓을 감시 목록에서 제거합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "제거 성공"),
            @ApiResponse(responseCode = "404", description = "감시 목록에 없음")
    })
    public List<String> removeFromWatchlist(@PathVariable String symbol) {
        List<String> removed = watchlistService.remove(List.of(symbol));
        if (removed.isEmpty()) {
            throw new MonitorApiException(HttpStatus.NOT_FOUND, "market_not_watched",
                    "Market is not on the watchlist: " + MarketDataService.normalizeMarket(symbol));
        }
        return removed;
    }

    @PostMapping("/stop")
    @Operation(summary = "모니터링 중지", description = "스캔/Heartbeat 루프와 명령어 수신을 중지합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "중지 완료"),
            @ApiResponse(responseCode = "409", description = "이미 중지됨")
    })
    public MonitorStatusDto stop() {
        if (!monitorStatusService.status().running()) {
            throw new MonitorApiException(HttpStatus.CONFLICT, "monitor_not_running", "Monitor is not running");
        }
        monitorScheduler.stop();
        return monitorStatusService.status();
    }
}
