package org.nowstart.squeezewatch.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.squeezewatch.data.dto.MarketAnalysisDto;
import org.nowstart.squeezewatch.data.dto.MonitorStatusDto;
import org.nowstart.squeezewatch.data.type.MonitorRunState;
import org.nowstart.squeezewatch.data.type.SignalKind;

class AlertMessageFormatterTest {

    private static final Instant NOW = Instant.parse("2024-05-01T03:00:00Z");

    private final AlertMessageFormatter formatter = new AlertMessageFormatter();

    @Test
    void alert_buyMessageContainsMarketPriceAndKstTime() {
        String text = formatter.alert(analysis("비트코인", 65.2, 0.91, List.of(SignalKind.BUY)), SignalKind.BUY);

        assertThat(text).contains("볼린저 스퀴즈 브레이크아웃");
        assertThat(text).contains("비트코인</b> (KRW-BTC)");
        assertThat(text).contains("85,000,000원");
        assertThat(text).contains("RSI: <b>65.2</b>");
        assertThat(text).contains("2024-05-01 12:00:00");
    }

    @Test
    void alert_sellAllExplainsOversoldReason() {
        String text = formatter.alert(analysis("비트코인", 25.0, 0.40, List.of(SignalKind.SELL_ALL)), SignalKind.SELL_ALL);

        assertThat(text).contains("전량 매도 신호");
        assertThat(text).contains("손절");
    }

    @Test
    void alert_escapesDisplayName() {
        String text = formatter.alert(analysis("A&B <coin>", 60.0, 0.80, List.of(SignalKind.SELL_50)), SignalKind.SELL_50);

        assertThat(text).contains("A&amp;B &lt;coin&gt;");
        assertThat(text).contains("50% 익절 신호");
    }

    @Test
    void analysis_rendersUndefinedValuesAsDash() {
        String text = formatter.analysis(analysis("비트코인", Double.NaN, Double.NaN, List.of()));

        assertThat(text).contains("<b>RSI:</b> - (계산 불가)");
        assertThat(text).contains("<b>BB 위치:</b> - (계산 불가)");
        assertThat(text).contains("신호 없음");
    }

    @Test
    void status_reportsCountersAndLastSignal() {
        String text = formatter.status(status(NOW.minusSeconds(7200)), NOW);

        assertThat(text).contains("🟢 실행중");
        assertThat(text).contains("총 스캔: 12회");
        assertThat(text).contains("스캔 간격: 5분");
        assertThat(text).contains("최근 신호: 2시간 전");
        assertThat(text).contains("/ticker");
    }

    @Test
    void heartbeat_includesAlertRecordCount() {
        String text = formatter.heartbeat(status(null), NOW);

        assertThat(text).contains("Heartbeat");
        assertThat(text).contains("알림 기록: 4개");
        assertThat(text).contains("마지막 신호: 없음");
    }

    @Test
    void lastSignal_bucketsElapsedTime() {
        assertThat(formatter.lastSignal(null, NOW)).isEqualTo("없음");
        assertThat(formatter.lastSignal(NOW.minus(Duration.ofDays(2)), NOW)).isEqualTo("2일 전");
        assertThat(formatter.lastSignal(NOW.minusSeconds(7300), NOW)).isEqualTo("2시간 전");
        assertThat(formatter.lastSignal(NOW.minusSeconds(300), NOW)).isEqualTo("5분 전");
        assertThat(formatter.lastSignal(NOW.minusSeconds(30), NOW)).isEqualTo("1분 이내");
    }

    @Test
    void uptime_formatsHoursMinutesSeconds() {
        assertThat(formatter.uptime(Duration.ofSeconds(3725))).isEqualTo("1:02:05");
        assertThat(formatter.uptime(Duration.ofDays(1).plusSeconds(5))).isEqualTo("1일 0:00:05");
    }

    @Test
    void connectionTest_showsKstTimeAndEscapedUsage() {
        String text = formatter.connectionTest(NOW);

        assertThat(text).contains("업비트 봇 연결 테스트");
        assertThat(text).contains("테스트 시간: 2024-05-01 12:00:00");
        assertThat(text).contains("/ticker &lt;심볼&gt;");
    }

    @Test
    void tickerUsage_escapesPlaceholder() {
        assertThat(formatter.tickerUsage()).contains("/ticker &lt;심볼&gt;");
    }

    private MarketAnalysisDto analysis(String displayName, double rsi, double bbPosition, List<SignalKind> signals) {
        return new MarketAnalysisDto(
                "KRW-BTC",
                displayName,
                NOW,
                85_000_000.0,
                rsi,
                bbPosition,
                0.05,
                false,
                true,
                1.8,
                signals
        );
    }

    private MonitorStatusDto status(Instant lastSignal) {
        return new MonitorStatusDto(
                MonitorRunState.RUNNING,
                NOW.minusSeconds(3600),
                Duration.ofSeconds(3600),
                12,
                3,
                lastSignal,
                null,
                18,
                4,
                true,
                Duration.ofMinutes(5)
        );
    }
}
