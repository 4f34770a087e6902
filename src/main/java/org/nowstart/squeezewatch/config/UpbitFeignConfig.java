package org.nowstart.squeezewatch.config;

import feign.RequestInterceptor;
import feign.Retryer;
import org.nowstart.squeezewatch.data.property.UpbitProperties;
import org.nowstart.squeezewatch.service.auth.UpbitAuthRequestInterceptor;
import org.nowstart.squeezewatch.service.auth.UpbitJwtSigner;
import org.springframework.context.annotation.Bean;

/**
 * Client-scoped configuration for {@code upbitClient}. Not a {@code @Configuration} so the interceptor
 * stays out of the shared context and never reaches the Telegram client.
 */
public class UpbitFeignConfig {

    @Bean
    public UpbitJwtSigner upbitJwtSigner(UpbitProperties upbitProperties) {
        return new UpbitJwtSigner(upbitProperties.accessKey(), upbitProperties.secretKey());
    }

    @Bean
    public RequestInterceptor upbitAuthRequestInterceptor(UpbitJwtSigner upbitJwtSigner) {
        return new UpbitAuthRequestInterceptor(upbitJwtSigner);
    }

    // MarketDataService owns the retry policy.
    @Bean
    public Retryer upbitRetryer() {
        return Retryer.NEVER_RETRY;
    }
}
