package org.nowstart.squeezewatch.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.squeezewatch.data.dto.MarketAnalysisDto;
import org.nowstart.squeezewatch.data.dto.MarketOverviewDto;
import org.nowstart.squeezewatch.data.exception.MarketDataException;
import org.nowstart.squeezewatch.data.property.MonitorProperties;
import org.nowstart.squeezewatch.strategy.BollingerIndicatorEngine;
import org.nowstart.squeezewatch.strategy.SqueezeSignalEvaluator;
import org.nowstart.squeezewatch.strategy.core.IndicatorParams;
import org.nowstart.squeezewatch.strategy.core.IndicatorRow;
import org.nowstart.squeezewatch.strategy.core.IndicatorSeries;
import org.nowstart.squeezewatch.strategy.core.PriceBar;
import org.nowstart.squeezewatch.strategy.core.SignalRules;
import org.nowstart.squeezewatch.strategy.core.SignalSet;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class MarketAnalysisService {

    private final MarketDataService marketDataService;
    private final BollingerIndicatorEngine indicatorEngine;
    private final SqueezeSignalEvaluator signalEvaluator;
    private final WatchlistService watchlistService;
    private final MonitorProperties monitorProperties;
    private final IndicatorParams indicatorParams;
    private final SignalRules signalRules;
    private final Clock clock;

    /**
     * Fetches recent day candles and evaluates the latest bar.
     *
     * @throws MarketDataException when candles cannot be fetched or no indicator row is defined yet
     */
    public MarketAnalysisDto analyze(String market) {
        int warmup = indicatorParams.warmupBars();
        int count = Math.max(monitorProperties.candleCount(), warmup + 1);
        List<PriceBar> bars = marketDataService.fetchDayCandles(market, count, warmup);

        IndicatorSeries series = indicatorEngine.compute(bars, indicatorParams);
        IndicatorRow current = series.latest();
        if (current == null) {
            throw new MarketDataException(market, "insufficient_data",
                    "Indicators are not defined yet. market=" + market + ", bars=" + bars.size());
        }
        IndicatorRow previous = series.previous();

        SignalSet signals = signalEvaluator.evaluate(current, previous, signalRules);
        boolean breakout = signalEvaluator.isSqueezeBreakout(current, previous, signalRules);

        log.info(
                "event=market_analysis market={} ts={} close={} rsi={} bb_position={} band_width={} squeeze={} breakout={} volume_ratio={} buy={} sell_50={} sell_all={}",
                market,
                current.timestamp(),
                current.close(),
                current.rsi(),
                current.bbPosition(),
                current.bandWidth(),
                current.squeeze(),
                breakout,
                current.volumeRatio(),
                signals.buy(),
                signals.sell50(),
                signals.sellAll()
        );

        return new MarketAnalysisDto(
                market,
                watchlistService.displayName(market),
                current.timestamp(),
                current.close(),
                current.rsi(),
                current.bbPosition(),
                current.bandWidth(),
                current.squeeze(),
                breakout,
                current.volumeRatio(),
                signals.active()
        );
    }

    /**
     * Analyzes every watched market in watchlist order. Markets that fail are listed separately.
     */
    public MarketOverviewDto overview() {
        List<MarketAnalysisDto> rows = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (String market : watchlistService.markets()) {
            try {
                rows.add(analyze(market));
            } catch (Exception e) {
                log.error("event=overview_market_failed market={} error={}", market, e.getMessage());
                failed.add(market);
            }
        }
        log.info("event=overview_generated markets={} failed={}", rows.size(), failed.size());
        return new MarketOverviewDto(clock.instant(), List.copyOf(rows), List.copyOf(failed));
    }
}
