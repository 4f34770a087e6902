package org.nowstart.squeezewatch.config;

import static org.assertj.core.api.Assertions.assertThat;

import feign.RequestInterceptor;
import java.math.BigDecimal;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.nowstart.squeezewatch.data.property.UpbitProperties;
import org.nowstart.squeezewatch.service.auth.UpbitJwtSigner;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

class UpbitFeignConfigContextTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(UpbitFeignConfig.class, UpbitPropsTestConfig.class);

    @Test
    void contextLoadsWithUpbitFeignConfig() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(UpbitJwtSigner.class);
            assertThat(context).hasSingleBean(RequestInterceptor.class);
            assertThat(context.getBean(UpbitJwtSigner.class).isEnabled()).isTrue();
        });
    }

    @Configuration(proxyBeanMethods = false)
    static class UpbitPropsTestConfig {

        @Bean
        UpbitProperties upbitProperties() {
            return new UpbitProperties(
                    "https://api.upbit.com",
                    "access",
                    "secret",
                    3,
                    Duration.ofSeconds(1),
                    200,
                    BigDecimal.ONE
            );
        }
    }
}
