package org.nowstart.squeezewatch.data.dto;

public record TelegramSendMessageRequest(
        String chat_id,
        String text,
        String parse_mode
) {

    public static TelegramSendMessageRequest html(String chatId, String text) {
        return new TelegramSendMessageRequest(chatId, text, "HTML");
    }
}
