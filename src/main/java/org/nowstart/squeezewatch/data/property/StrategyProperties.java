package org.nowstart.squeezewatch.data.property;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import org.nowstart.squeezewatch.data.type.BuyRule;
import org.nowstart.squeezewatch.data.type.SqueezePolicy;
import org.nowstart.squeezewatch.data.type.StrategyProfile;
import org.nowstart.squeezewatch.strategy.core.IndicatorParams;
import org.nowstart.squeezewatch.strategy.core.SignalRules;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "squeezewatch.strategy")
public record StrategyProperties(
        // 전략 프로필(CONSERVATIVE / BALANCED / AGGRESSIVE)
        @NotNull @DefaultValue("BALANCED") StrategyProfile profile,
        // 매수 규칙(BREAKOUT 또는 THRESHOLD)
        @NotNull @DefaultValue("BREAKOUT") BuyRule buyRule,
        // 스퀴즈 판정 방식(ROLLING_MIN 또는 QUANTILE)
        @NotNull @DefaultValue("ROLLING_MIN") SqueezePolicy squeezePolicy,
        // 볼린저 밴드 기간
        @Positive @DefaultValue("20") int bbPeriod,
        // 볼린저 밴드 표준편차 배수
        @DecimalMin("0") @DefaultValue("2.0") BigDecimal bbStdMultiplier,
        // RSI 기간
        @Positive @DefaultValue("14") int rsiPeriod,
        // 변동성(밴드폭) lookback 길이
        @Positive @DefaultValue("50") int volatilityLookback,
        // QUANTILE 정책의 분위수(0~1)
        @DecimalMin(value = "0", inclusive = false) @DecimalMax("1.0") @DefaultValue("0.2") BigDecimal volatilityThreshold,
        // ROLLING_MIN 정책의 최소값 비교 구간
        @Positive @DefaultValue("20") int squeezeWindow,
        // ROLLING_MIN 정책의 최소값 배수
        @DecimalMin("1.0") @DefaultValue("1.1") BigDecimal squeezeMinFactor,
        // 거래량 평균 기간
        @Positive @DefaultValue("20") int volumePeriod
) {

    public IndicatorParams toIndicatorParams() {
        return new IndicatorParams(
                bbPeriod,
                bbStdMultiplier.doubleValue(),
                rsiPeriod,
                volatilityLookback,
                volatilityThreshold.doubleValue(),
                squeezePolicy,
                squeezeWindow,
                squeezeMinFactor.doubleValue(),
                volumePeriod
        );
    }

    public SignalRules toSignalRules() {
        return SignalRules.of(profile, buyRule);
    }
}
