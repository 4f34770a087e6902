package org.nowstart.squeezewatch.data.property;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "squeezewatch.monitor")
public record MonitorProperties(
        // 애플리케이션 시작 시 모니터링 자동 시작 여부
        @DefaultValue("true") boolean autoStart,
        // 스캔 주기
        @NotNull @DefaultValue("300s") Duration interval,
        // Heartbeat 알림 주기
        @NotNull @DefaultValue("3600s") Duration heartbeatInterval,
        // 동일 코인/신호 알림 쿨다운
        @NotNull @DefaultValue("3600s") Duration alertCooldown,
        // 코인 간 조회 간격(레이트 리밋 회피)
        @NotNull @DefaultValue("200ms") Duration pacingDelay,
        // 스캔 루프 오류 후 재시도 대기 시간
        @NotNull @DefaultValue("30s") Duration errorBackoff,
        // 중지 시 루프 종료 대기 시간
        @NotNull @DefaultValue("10s") Duration shutdownTimeout,
        // 상태 요약 알림을 보낼 스캔 횟수 간격
        @Positive @DefaultValue("5") int summaryEvery,
        // 진행률 로그를 남길 코인 수 간격
        @Positive @DefaultValue("10") int progressEvery,
        // 신호 계산에 사용할 일봉 수
        @Positive @DefaultValue("100") int candleCount,
        // 감시 대상 마켓 목록
        @NotNull @DefaultValue("KRW-BTC") List<String> watchlist,
        // 마켓별 표시 이름
        @NotNull @DefaultValue Map<String, String> displayNames
) {
}
