package org.nowstart.squeezewatch.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.squeezewatch.data.dto.TelegramApiResponse;
import org.nowstart.squeezewatch.data.dto.TelegramSendMessageRequest;
import org.nowstart.squeezewatch.data.dto.TelegramUpdate;
import org.nowstart.squeezewatch.data.property.TelegramProperties;
import org.nowstart.squeezewatch.repository.TelegramFeignClient;
import org.springframework.stereotype.Service;

/**
 * Delivers HTML messages through the Telegram Bot API. Never throws: every failure is logged and
 * reported as {@code false}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final TelegramFeignClient telegramFeignClient;
    private final TelegramProperties telegramProperties;

    public boolean send(String text) {
        if (!telegramProperties.canSend()) {
            log.info("event=notification_skipped reason=telegram_not_configured text={}", text);
            return false;
        }
        return deliver(telegramProperties.chatId(), text);
    }

    public boolean reply(long chatId, String text) {
        if (!telegramProperties.hasToken()) {
            log.info("event=reply_skipped reason=telegram_not_configured chat_id={} text={}", chatId, text);
            return false;
        }
        return deliver(String.valueOf(chatId), text);
    }

    public boolean isConfigured() {
        return telegramProperties.canSend();
    }

    private boolean deliver(String chatId, String text) {
        try {
            TelegramApiResponse<TelegramUpdate.Message> response = telegramFeignClient.sendMessage(
                    telegramProperties.botToken(),
                    TelegramSendMessageRequest.html(chatId, text)
            );
            if (response == null || !response.ok()) {
                log.error("event=notification_failed chat_id={} description={}",
                        chatId, response == null ? "empty response" : response.description());
                return false;
            }
            log.info("event=notification_sent chat_id={}", chatId);
            return true;
        } catch (Exception e) {
            log.error("event=notification_failed chat_id={} error={}", chatId, e.getMessage(), e);
            return false;
        }
    }
}
