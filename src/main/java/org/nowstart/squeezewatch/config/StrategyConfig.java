package org.nowstart.squeezewatch.config;

import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.squeezewatch.data.property.StrategyProperties;
import org.nowstart.squeezewatch.strategy.core.IndicatorParams;
import org.nowstart.squeezewatch.strategy.core.SignalRules;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Resolves indicator parameters and signal rules once at startup; the live monitor and the backtest
 * share the same instances.
 */
@Slf4j
@Configuration
public class StrategyConfig {

    @Bean
    public IndicatorParams indicatorParams(StrategyProperties strategyProperties) {
        IndicatorParams params = strategyProperties.toIndicatorParams();
        log.info("event=strategy_params_resolved params={} warmup_bars={}", params, params.warmupBars());
        return params;
    }

    @Bean
    public SignalRules signalRules(StrategyProperties strategyProperties) {
        SignalRules rules = strategyProperties.toSignalRules();
        log.info("event=signal_rules_resolved rules={}", rules);
        return rules;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
