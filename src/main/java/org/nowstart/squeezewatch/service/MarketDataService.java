package org.nowstart.squeezewatch.service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.squeezewatch.data.dto.UpbitDayCandleResponse;
import org.nowstart.squeezewatch.data.exception.MarketDataException;
import org.nowstart.squeezewatch.data.property.UpbitProperties;
import org.nowstart.squeezewatch.repository.UpbitFeignClient;
import org.nowstart.squeezewatch.strategy.core.PriceBar;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class MarketDataService {

    public static final String KRW_PREFIX = "KRW-";
    private static final DateTimeFormatter CURSOR_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'")
            .withZone(ZoneOffset.UTC);

    private final UpbitFeignClient upbitFeignClient;
    private final UpbitProperties upbitProperties;

    /**
     * Fetches the most recent {@code count} day candles, oldest first, paging backwards when
     * {@code count} exceeds the page size. A failed request and a response that fails parsing or
     * validation are both retried up to {@code maxAttempts} times.
     *
     * @throws MarketDataException carrying the last failure once every attempt is used up
     */
    public List<PriceBar> fetchDayCandles(String market, int count, int minimumBars) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be > 0");
        }

        int maxAttempts = upbitProperties.maxAttempts();
        MarketDataException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                List<PriceBar> bars = collect(market, count);
                validate(market, bars, minimumBars);
                log.debug("event=candles_fetched market={} requested={} received={} attempt={}",
                        market, count, bars.size(), attempt);
                return bars;
            } catch (MarketDataException e) {
                log.warn("event=candles_attempt_failed market={} attempt={}/{} code={} error={}",
                        market, attempt, maxAttempts, e.getCode(), e.getMessage());
                lastError = e;
            }
            if (attempt < maxAttempts) {
                backoff(market, upbitProperties.retryBackoff());
            }
        }
        throw lastError;
    }

    public void validate(String market, List<PriceBar> bars, int minimumBars) {
        if (bars == null || bars.size() < minimumBars) {
            throw new MarketDataException(
                    market,
                    "insufficient_data",
                    "Not enough candles. market=" + market + ", required=" + minimumBars
                            + ", actual=" + (bars == null ? 0 : bars.size())
            );
        }

        double closeSum = 0.0;
        for (PriceBar bar : bars) {
            if (!isFinite(bar)) {
                throw new MarketDataException(market, "invalid_candle", "Non-finite OHLCV value. market=" + market
                        + ", ts=" + bar.timestamp());
            }
            closeSum += bar.close();
        }

        double averageClose = bars.isEmpty() ? 0.0 : closeSum / bars.size();
        if (averageClose < upbitProperties.minAverageClose().doubleValue()) {
            throw new MarketDataException(market, "price_too_low", "Average close below floor. market=" + market
                    + ", averageClose=" + averageClose);
        }
    }

    public static String normalizeMarket(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("market must not be blank");
        }
        String market = value.trim().toUpperCase(Locale.ROOT);
        return market.startsWith(KRW_PREFIX) ? market : KRW_PREFIX + market;
    }

    private List<PriceBar> collect(String market, int count) {
        Map<Instant, PriceBar> byTimestamp = new TreeMap<>();
        String cursor = null;
        while (byTimestamp.size() < count) {
            int pageCount = Math.min(upbitProperties.pageSize(), count - byTimestamp.size());
            List<UpbitDayCandleResponse> page = fetchPage(market, pageCount, cursor);
            if (page.isEmpty()) {
                if (byTimestamp.isEmpty()) {
                    throw new MarketDataException(market, "no_data", "No candles returned. market=" + market);
                }
                break;
            }

            int before = byTimestamp.size();
            Instant oldest = null;
            for (UpbitDayCandleResponse row : page) {
                PriceBar bar = toPriceBar(market, row);
                byTimestamp.put(bar.timestamp(), bar);
                if (oldest == null || bar.timestamp().isBefore(oldest)) {
                    oldest = bar.timestamp();
                }
            }
            if (page.size() < pageCount || byTimestamp.size() == before) {
                break;
            }
            cursor = CURSOR_FORMAT.format(oldest);
        }

        List<PriceBar> bars = new ArrayList<>(byTimestamp.values());
        bars.sort(Comparator.comparing(PriceBar::timestamp));
        if (bars.size() > count) {
            bars = bars.subList(bars.size() - count, bars.size());
        }
        return List.copyOf(bars);
    }

    private List<UpbitDayCandleResponse> fetchPage(String market, int count, String cursor) {
        try {
            List<UpbitDayCandleResponse> rows = upbitFeignClient.getDayCandles(market, count, cursor);
            return rows == null ? List.of() : rows;
        } catch (MarketDataException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MarketDataException(market, "fetch_failed", "Failed to fetch candles. market=" + market
                    + ", error=" + e.getMessage(), e);
        }
    }

    private PriceBar toPriceBar(String market, UpbitDayCandleResponse row) {
        if (row == null
                || row.candle_date_time_utc() == null
                || row.opening_price() == null
                || row.high_price() == null
                || row.low_price() == null
                || row.trade_price() == null
                || row.candle_acc_trade_volume() == null) {
            throw new MarketDataException(market, "invalid_candle", "Candle row has missing fields. market=" + market
                    + ", row=" + row);
        }

        try {
            return new PriceBar(
                    LocalDateTime.parse(row.candle_date_time_utc()).toInstant(ZoneOffset.UTC),
                    row.opening_price().doubleValue(),
                    row.high_price().doubleValue(),
                    row.low_price().doubleValue(),
                    row.trade_price().doubleValue(),
                    row.candle_acc_trade_volume().doubleValue()
            );
        } catch (DateTimeParseException e) {
            throw new MarketDataException(market, "invalid_candle", "Unparseable candle timestamp. market=" + market
                    + ", ts=" + row.candle_date_time_utc(), e);
        }
    }

    private boolean isFinite(PriceBar bar) {
        return bar.timestamp() != null
                && Double.isFinite(bar.open())
                && Double.isFinite(bar.high())
                && Double.isFinite(bar.low())
                && Double.isFinite(bar.close())
                && Double.isFinite(bar.volume());
    }

    private void backoff(String market, Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MarketDataException(market, "interrupted", "Interrupted while waiting to retry. market=" + market, e);
        }
    }
}
