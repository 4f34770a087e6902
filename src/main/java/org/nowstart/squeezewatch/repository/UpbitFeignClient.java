package org.nowstart.squeezewatch.repository;

import java.util.List;
import org.nowstart.squeezewatch.config.UpbitFeignConfig;
import org.nowstart.squeezewatch.data.dto.UpbitDayCandleResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;

@FeignClient(
        name = "upbitClient",
        url = "${squeezewatch.upbit.base-url}",
        configuration = UpbitFeignConfig.class
)
public interface UpbitFeignClient {

    /**
     * Day candles, newest first. {@code to} is an exclusive upper bound in UTC ({@code yyyy-MM-dd'T'HH:mm:ss}),
     * {@code null} means "now".
     */
    @GetMapping("/v1/candles/days")
    List<UpbitDayCandleResponse> getDayCandles(
            @RequestParam("market") String market,
            @RequestParam("count") int count,
            @RequestParam(value = "to", required = false) String to
    );
}
