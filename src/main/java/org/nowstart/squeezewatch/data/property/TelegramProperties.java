package org.nowstart.squeezewatch.data.property;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "squeezewatch.telegram")
public record TelegramProperties(
        // 텔레그램 Bot API 기본 URL
        @NotBlank @DefaultValue("https://api.telegram.org") String baseUrl,
        // 봇 토큰 (없으면 알림은 로그로만 남김)
        @DefaultValue("") String botToken,
        // 알림을 받을 채팅 ID
        @DefaultValue("") String chatId,
        // 명령어 수신(getUpdates) long-polling 타임아웃(초)
        @DefaultValue("10") int pollTimeoutSeconds,
        // 명령어 수신 실패 시 재시작 대기 시간
        @NotNull @DefaultValue("30s") Duration listenerBackoff
) {

    public boolean canSend() {
        return hasToken() && chatId != null && !chatId.isBlank();
    }

    public boolean hasToken() {
        return botToken != null && !botToken.isBlank();
    }
}
