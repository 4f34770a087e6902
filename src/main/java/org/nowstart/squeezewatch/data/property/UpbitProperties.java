package org.nowstart.squeezewatch.data.property;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "squeezewatch.upbit")
public record UpbitProperties(
        // 업비트 REST API 기본 URL
        @NotBlank @DefaultValue("https://api.upbit.com") String baseUrl,
        // 업비트 Access Key (없으면 공개 API 모드)
        @DefaultValue("") String accessKey,
        // 업비트 Secret Key (JWT 서명용 비밀키)
        @DefaultValue("") String secretKey,
        // 캔들 조회 최대 시도 횟수
        @Positive @DefaultValue("3") int maxAttempts,
        // 재시도 간 대기 시간
        @NotNull @DefaultValue("1s") Duration retryBackoff,
        // 요청 1회당 최대 캔들 수(업비트 제한)
        @Positive @DefaultValue("200") int pageSize,
        // 평균 종가 하한(상장폐지/저가 코인 제외)
        @DecimalMin("0") @DefaultValue("1.0") BigDecimal minAverageClose
) {

    public boolean hasCredentials() {
        return accessKey != null && !accessKey.isBlank()
                && secretKey != null && !secretKey.isBlank();
    }
}
