package org.nowstart.squeezewatch.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.squeezewatch.data.dto.TelegramApiResponse;
import org.nowstart.squeezewatch.data.dto.TelegramSendMessageRequest;
import org.nowstart.squeezewatch.data.dto.TelegramUpdate;
import org.nowstart.squeezewatch.data.property.TelegramProperties;
import org.nowstart.squeezewatch.repository.TelegramFeignClient;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    @Mock
    private TelegramFeignClient telegramFeignClient;

    @Test
    void send_postsHtmlMessageToConfiguredChat() {
        when(telegramFeignClient.sendMessage(anyString(), any(TelegramSendMessageRequest.class)))
                .thenReturn(new TelegramApiResponse<>(true, null, null));

        boolean sent = service("token", "42").send("<b>hello</b>");

        ArgumentCaptor<TelegramSendMessageRequest> captor = ArgumentCaptor.forClass(TelegramSendMessageRequest.class);
        verify(telegramFeignClient).sendMessage(eq("token"), captor.capture());
        assertThat(sent).isTrue();
        assertThat(captor.getValue()).isEqualTo(new TelegramSendMessageRequest("42", "<b>hello</b>", "HTML"));
    }

    @Test
    void send_returnsFalseWithoutCredentials() {
        boolean sent = service("", "").send("hello");

        assertThat(sent).isFalse();
        verify(telegramFeignClient, never()).sendMessage(anyString(), any());
    }

    @Test
    void send_returnsFalseWhenApiRejects() {
        when(telegramFeignClient.sendMessage(anyString(), any(TelegramSendMessageRequest.class)))
                .thenReturn(new TelegramApiResponse<TelegramUpdate.Message>(false, null, "Bad Request: chat not found"));

        assertThat(service("token", "42").send("hello")).isFalse();
    }

    @Test
    void send_neverThrowsOnTransportFailure() {
        when(telegramFeignClient.sendMessage(anyString(), any(TelegramSendMessageRequest.class)))
                .thenThrow(new IllegalStateException("connection reset"));

        assertThat(service("token", "42").send("hello")).isFalse();
    }

    @Test
    void reply_targetsGivenChatWithTokenOnly() {
        when(telegramFeignClient.sendMessage(anyString(), any(TelegramSendMessageRequest.class)))
                .thenReturn(new TelegramApiResponse<>(true, null, null));

        boolean sent = service("token", "").reply(7L, "pong");

        ArgumentCaptor<TelegramSendMessageRequest> captor = ArgumentCaptor.forClass(TelegramSendMessageRequest.class);
        verify(telegramFeignClient).sendMessage(eq("token"), captor.capture());
        assertThat(sent).isTrue();
        assertThat(captor.getValue().chat_id()).isEqualTo("7");
    }

    @Test
    void isConfigured_requiresTokenAndChat() {
        assertThat(service("token", "42").isConfigured()).isTrue();
        assertThat(service("token", " ").isConfigured()).isFalse();
    }

    private NotificationService service(String token, String chatId) {
        TelegramProperties properties = new TelegramProperties(
                "https://api.telegram.org",
                token,
                chatId,
                10,
                Duration.ofSeconds(30)
        );
        return new NotificationService(telegramFeignClient, properties);
    }
}
