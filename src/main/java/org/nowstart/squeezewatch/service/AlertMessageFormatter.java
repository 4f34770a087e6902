package org.nowstart.squeezewatch.service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.stream.Collectors;
import org.nowstart.squeezewatch.data.dto.MarketAnalysisDto;
import org.nowstart.squeezewatch.data.dto.MonitorStatusDto;
import org.nowstart.squeezewatch.data.type.SignalKind;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/**
 * Telegram HTML message bodies. Times are rendered in Korea Standard Time.
 */
@Component
public class AlertMessageFormatter {

    static final ZoneId KST = ZoneId.of("Asia/Seoul");
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(KST);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(KST);
    private static final String COMMAND_HELP = "📱 <b>명령어:</b>\n"
            + "• /ticker &lt;심볼&gt; - 코인 분석\n"
            + "• /status - 모니터링 상태\n"
            + "• /start - 도움말";

    public String alert(MarketAnalysisDto analysis, SignalKind kind) {
        return switch (kind) {
            case BUY -> buyAlert(analysis);
            case SELL_50 -> sell50Alert(analysis);
            case SELL_ALL -> sellAllAlert(analysis);
        };
    }

    public String analysis(MarketAnalysisDto analysis) {
        String signals = analysis.signals().isEmpty()
                ? "📊 신호 없음"
                : analysis.signals().stream().map(this::signalLabel).collect(Collectors.joining(" | "));

        return "📈 <b>분석: " + escape(analysis.displayName()) + "</b> (" + analysis.market() + ")\n\n"
                + "💰 <b>현재가:</b> " + price(analysis.price()) + "원\n"
                + "📊 <b>RSI:</b> " + decimal(analysis.rsi(), 1) + " (" + rsiStatus(analysis.rsi()) + ")\n"
                + "📍 <b>BB 위치:</b> " + decimal(analysis.bbPosition(), 2) + " (" + bandStatus(analysis.bbPosition()) + ")\n"
                + "🔥 <b>변동성 압축:</b> " + (analysis.squeeze() ? "✅ 활성" : "❌ 비활성") + "\n"
                + "⚡ <b>브레이크아웃:</b> " + (analysis.squeezeBreakout() ? "✅ 감지" : "❌ 없음") + "\n"
                + "📊 <b>거래량:</b> " + decimal(analysis.volumeRatio(), 1) + "x\n\n"
                + "🎯 <b>신호:</b> " + signals + "\n\n"
                + "⏰ <b>분석 시간:</b> " + DATE_TIME.format(analysis.timestamp()) + "\n\n"
                + "💡 <b>볼린저 스퀴즈 전략:</b>\n"
                + "• 변동성 압축 → 밴드 브레이크아웃 시 매수\n"
                + "• BB 상단 근처에서 50% 익절\n"
                + "• BB 하단 또는 RSI&lt;30에서 전량매도";
    }

    public String help(MonitorStatusDto status) {
        return "🤖 <b>업비트 Volatility Bollinger Bot</b>\n\n"
                + "📊 사용 가능한 명령어:\n"
                + "• /ticker &lt;symbol&gt; - 코인 분석 (예: /ticker BTC, /ticker btc)\n"
                + "• /status - 모니터링 상태 확인\n"
                + "• /start - 이 도움말 보기\n\n"
                + "🔍 모니터링 상태: " + runLabel(status) + "\n"
                + "📈 감시 코인: " + status.watchlistCount() + "개\n"
                + "📱 총 알림 발송: " + status.signalsSent() + "개\n\n"
                + "💡 <b>예시:</b> /ticker BTC 또는 /ticker eth";
    }

    public String status(MonitorStatusDto status, Instant now) {
        return "📊 <b>업비트 모니터링 상태</b>\n\n"
                + "🔄 상태: " + runLabel(status) + "\n"
                + "⏱️ 가동 시간: " + uptime(status.uptime()) + "\n"
                + "🇰🇷 한국 시간: " + DATE_TIME.format(now) + "\n\n"
                + "📈 <b>통계:</b>\n"
                + "   🔍 총 스캔: " + status.scanCount() + "회\n"
                + "   📱 알림 발송: " + status.signalsSent() + "개\n"
                + "   📊 감시 코인: " + status.watchlistCount() + "개\n"
                + "   ⏰ 스캔 간격: " + interval(status.scanInterval()) + "\n"
                + "   🎯 최근 신호: " + lastSignal(status.lastSignalTime(), now) + "\n\n"
                + COMMAND_HELP;
    }

    public String heartbeat(MonitorStatusDto status, Instant now) {
        return timeEmoji(now) + " <b>Heartbeat - 업비트 모니터링 정상 가동</b>\n\n"
                + "🇰🇷 한국 시간: " + DATE_TIME.format(now) + "\n"
                + "⏱️ 가동 시간: " + uptime(status.uptime()) + "\n\n"
                + "📊 <b>통계 정보:</b>\n"
                + "   🔍 총 스캔: " + status.scanCount() + "회\n"
                + "   📱 알림 발송: " + status.signalsSent() + "개\n"
                + "   📈 감시 코인: " + status.watchlistCount() + "개\n"
                + "   ⏰ 스캔 간격: " + interval(status.scanInterval()) + "\n\n"
                + "🎯 <b>최근 활동:</b>\n"
                + "   마지막 신호: " + lastSignal(status.lastSignalTime(), now) + "\n"
                + "   알림 기록: " + status.alertRecordCount() + "개\n\n"
                + "✅ <b>상태:</b> 모든 시스템 정상 작동 중";
    }

    public String summary(MonitorStatusDto status, Instant now) {
        return "📊 <b>모니터링 상태 요약</b>\n\n"
                + "🔢 스캔 횟수: " + status.scanCount() + "회\n"
                + "⏰ 현재 시간: " + TIME.format(now) + "\n"
                + "🕐 실행 시간: " + uptime(status.uptime()) + "\n"
                + "📈 감시 코인: " + status.watchlistCount() + "개\n"
                + "🎯 알림 전송: " + status.signalsSent() + "개\n\n"
                + "✅ 시스템 정상 작동 중";
    }

    public String started(MonitorStatusDto status, Duration heartbeatInterval) {
        return "🤖 <b>업비트 모니터링 시작</b>\n\n"
                + "📊 감시 코인: " + status.watchlistCount() + "개 (업비트 원화 마켓)\n"
                + "⏰ 스캔 간격: " + interval(status.scanInterval()) + "\n"
                + "💓 Heartbeat: " + interval(heartbeatInterval) + "마다\n"
                + "🕐 시작 시간: " + (status.startTime() == null ? "-" : DATE_TIME.format(status.startTime())) + "\n\n"
                + "🎯 변동성 볼린저 밴드 전략 활성화\n"
                + "⚡ 실시간 알림이 즉시 전송됩니다\n\n"
                + COMMAND_HELP + "\n\n"
                + "💡 <b>예시:</b> /ticker BTC";
    }

    public String stopped(MonitorStatusDto status, Instant now) {
        return "⏹️ <b>업비트 모니터링 중지</b>\n\n"
                + "🕐 중지 시간: " + DATE_TIME.format(now) + "\n"
                + "⏱️ 총 가동시간: " + uptime(status.uptime()) + "\n"
                + "🔢 총 스캔: " + status.scanCount() + "회\n"
                + "🎯 총 알림: " + status.signalsSent() + "개\n\n"
                + "✅ 모니터링이 안전하게 중지되었습니다.";
    }

    public String connectionTest(Instant now) {
        return "🧪 <b>업비트 봇 연결 테스트</b>\n\n"
                + "텔레그램 봇이 정상적으로 작동합니다!\n"
                + "테스트 시간: " + DATE_TIME.format(now) + "\n\n"
                + "✅ 알림 수신 준비 완료\n"
                + "💓 Heartbeat 기능 활성화됨\n"
                + "🟢 24시간 거래 모니터링\n"
                + "📬 /ticker &lt;심볼&gt; 으로 코인 분석 (예: /ticker BTC)";
    }

    public String tickerUsage() {
        return "❌ 코인 심볼을 입력해주세요.\n\n"
                + "💡 <b>사용법:</b> /ticker &lt;심볼&gt;\n"
                + "📊 <b>예시:</b>\n"
                + "• /ticker BTC\n"
                + "• /ticker eth\n"
                + "• /ticker XRP";
    }

    public String tickerInProgress(String market) {
        return "🔍 <b>" + escape(market) + " 분석 중...</b>\n⏳ 잠시만 기다려주세요...";
    }

    public String tickerUnavailable(String market) {
        return "❌ <b>" + escape(market) + " 데이터를 가져올 수 없습니다</b>\n\n"
                + "💡 코인 심볼이 올바른지 확인해주세요.\n"
                + "📊 인기 코인: BTC, ETH, XRP, ADA, DOT";
    }

    public String tickerFailed(String error) {
        return "❌ <b>코인 분석 중 오류 발생</b>\n\n"
                + "오류: " + escape(error) + "\n\n"
                + "💡 다시 시도하거나 코인 심볼을 확인해주세요.";
    }

    private String buyAlert(MarketAnalysisDto analysis) {
        String direction = analysis.bbPosition() > 0.5 ? "상승" : "하락";
        return "🚀 <b>볼린저 스퀴즈 브레이크아웃!</b>\n\n"
                + header(analysis)
                + "브레이크아웃 방향: <b>" + direction + "</b>\n"
                + "RSI: <b>" + decimal(analysis.rsi(), 1) + "</b>\n"
                + "BB 위치: <b>" + decimal(analysis.bbPosition(), 2) + "</b>\n"
                + "거래량 비율: <b>" + decimal(analysis.volumeRatio(), 1) + "x</b>\n"
                + "시간: " + DATE_TIME.format(analysis.timestamp()) + "\n\n"
                + "⚡ 변동성 압축 후 폭발적 움직임 시작!";
    }

    private String sell50Alert(MarketAnalysisDto analysis) {
        return "💡 <b>50% 익절 신호!</b>\n\n"
                + header(analysis)
                + "BB 위치: <b>" + decimal(analysis.bbPosition(), 2) + "</b> (상단 근접)\n"
                + "시간: " + DATE_TIME.format(analysis.timestamp()) + "\n\n"
                + "📈 첫 번째 수익 구간 도달!";
    }

    private String sellAllAlert(MarketAnalysisDto analysis) {
        String reason = Double.isFinite(analysis.rsi()) && analysis.rsi() < 30.0 ? "손절" : "하단 이탈";
        return "🔴 <b>전량 매도 신호!</b>\n\n"
                + header(analysis)
                + "신호 사유: <b>" + reason + "</b>\n"
                + "BB 위치: <b>" + decimal(analysis.bbPosition(), 2) + "</b>\n"
                + "RSI: <b>" + decimal(analysis.rsi(), 1) + "</b>\n"
                + "시간: " + DATE_TIME.format(analysis.timestamp()) + "\n\n"
                + "⚠️ 추세 전환 또는 리스크 관리 시점!";
    }

    private String header(MarketAnalysisDto analysis) {
        return "코인: <b>" + escape(analysis.displayName()) + "</b> (" + analysis.market() + ")\n"
                + "현재가: <b>" + price(analysis.price()) + "원</b>\n";
    }

    private String signalLabel(SignalKind kind) {
        return switch (kind) {
            case BUY -> "🚀 매수";
            case SELL_50 -> "💡 50% 매도";
            case SELL_ALL -> "🔴 전량 매도";
        };
    }

    private String rsiStatus(double rsi) {
        if (!Double.isFinite(rsi)) {
            return "계산 불가";
        }
        if (rsi >= 70.0) {
            return "🔥 과매수";
        }
        return rsi <= 30.0 ? "❄️ 과매도" : "⚖️ 중립";
    }

    private String bandStatus(double bbPosition) {
        if (!Double.isFinite(bbPosition)) {
            return "계산 불가";
        }
        if (bbPosition >= 0.8) {
            return "🔴 상단밴드";
        }
        return bbPosition <= 0.2 ? "🟢 하단밴드" : "🟡 중간영역";
    }

    private String runLabel(MonitorStatusDto status) {
        return status.running() ? "🟢 실행중" : "🔴 중지됨";
    }

    String lastSignal(Instant lastSignalTime, Instant now) {
        if (lastSignalTime == null) {
            return "없음";
        }
        Duration elapsed = Duration.between(lastSignalTime, now);
        if (elapsed.toDays() > 0) {
            return elapsed.toDays() + "일 전";
        }
        if (elapsed.toSeconds() > 3600) {
            return elapsed.toHours() + "시간 전";
        }
        if (elapsed.toSeconds() > 60) {
            return elapsed.toMinutes() + "분 전";
        }
        return "1분 이내";
    }

    String uptime(Duration uptime) {
        long seconds = Math.max(0L, uptime.getSeconds());
        long days = seconds / 86_400;
        String clock = String.format(Locale.ROOT, "%d:%02d:%02d",
                (seconds % 86_400) / 3600, (seconds % 3600) / 60, seconds % 60);
        return days > 0 ? days + "일 " + clock : clock;
    }

    private String interval(Duration interval) {
        long seconds = interval.getSeconds();
        if (seconds >= 3600 && seconds % 3600 == 0) {
            return (seconds / 3600) + "시간";
        }
        if (seconds >= 60 && seconds % 60 == 0) {
            return (seconds / 60) + "분";
        }
        return seconds + "초";
    }

    private String timeEmoji(Instant now) {
        int hour = now.atZone(KST).getHour();
        if (hour >= 6 && hour < 12) {
            return "🌅";
        }
        if (hour >= 12 && hour < 18) {
            return "☀️";
        }
        return hour >= 18 && hour < 22 ? "🌆" : "🌙";
    }

    private String price(double value) {
        return String.format(Locale.KOREA, "%,.0f", value);
    }

    private String decimal(double value, int scale) {
        if (!Double.isFinite(value)) {
            return "-";
        }
        return String.format(Locale.ROOT, "%." + scale + "f", value);
    }

    private String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
