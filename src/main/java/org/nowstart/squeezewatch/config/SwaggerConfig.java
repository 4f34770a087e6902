package org.nowstart.squeezewatch.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@RequiredArgsConstructor
public class SwaggerConfig {

    private static final String UNKNOWN_VERSION = "dev";

    private final ObjectProvider<BuildProperties> buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        BuildProperties build = buildProperties.getIfAvailable();
        return new OpenAPI()
                .info(new Info()
                        .title("squeezewatch API")
                        .description("업비트 볼린저 스퀴즈 모니터링 API 문서입니다.")
                        .version(build == null ? UNKNOWN_VERSION : build.getVersion()));
    }
}
