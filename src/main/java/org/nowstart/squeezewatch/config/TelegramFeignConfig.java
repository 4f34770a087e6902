package org.nowstart.squeezewatch.config;

import feign.Request;
import feign.Retryer;
import java.util.concurrent.TimeUnit;
import org.nowstart.squeezewatch.data.property.TelegramProperties;
import org.springframework.context.annotation.Bean;

public class TelegramFeignConfig {

    private static final long CONNECT_TIMEOUT_SECONDS = 10L;

    // Read timeout must outlast the long-poll window of getUpdates.
    @Bean
    public Request.Options telegramRequestOptions(TelegramProperties telegramProperties) {
        long readTimeoutSeconds = telegramProperties.pollTimeoutSeconds() + CONNECT_TIMEOUT_SECONDS;
        return new Request.Options(
                CONNECT_TIMEOUT_SECONDS, TimeUnit.SECONDS,
                readTimeoutSeconds, TimeUnit.SECONDS,
                true
        );
    }

    @Bean
    public Retryer telegramRetryer() {
        return Retryer.NEVER_RETRY;
    }
}
