package org.nowstart.squeezewatch.repository;

import java.util.List;
import org.nowstart.squeezewatch.config.TelegramFeignConfig;
import org.nowstart.squeezewatch.data.dto.TelegramApiResponse;
import org.nowstart.squeezewatch.data.dto.TelegramSendMessageRequest;
import org.nowstart.squeezewatch.data.dto.TelegramUpdate;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

@FeignClient(
        name = "telegramClient",
        url = "${squeezewatch.telegram.base-url}",
        configuration = TelegramFeignConfig.class
)
public interface TelegramFeignClient {

    @PostMapping(value = "/bot{token}/sendMessage", consumes = "application/json")
    TelegramApiResponse<TelegramUpdate.Message> sendMessage(
            @PathVariable("token") String token,
            @RequestBody TelegramSendMessageRequest request
    );

    @GetMapping("/bot{token}/getUpdates")
    TelegramApiResponse<List<TelegramUpdate>> getUpdates(
            @PathVariable("token") String token,
            @RequestParam("offset") long offset,
            @RequestParam("timeout") int timeout
    );
}
