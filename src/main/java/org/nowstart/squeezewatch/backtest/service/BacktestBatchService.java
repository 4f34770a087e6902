package org.nowstart.squeezewatch.backtest.service;

import org.nowstart.squeezewatch.backtest.config.BacktestConfig;
import org.nowstart.squeezewatch.backtest.model.BacktestBatchReport;
import org.nowstart.squeezewatch.backtest.model.BacktestFailure;
import org.nowstart.squeezewatch.backtest.model.BacktestResult;
import org.nowstart.squeezewatch.backtest.model.BacktestSummary;
import org.nowstart.squeezewatch.data.exception.MarketDataException;
import org.nowstart.squeezewatch.service.MarketDataService;
import org.nowstart.squeezewatch.strategy.core.IndicatorParams;
import org.nowstart.squeezewatch.strategy.core.PriceBar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

@Service
public class BacktestBatchService {

    private static final Logger log = LoggerFactory.getLogger(BacktestBatchService.class);
    private static final int PROGRESS_EVERY = 10;

    private final MarketDataService marketDataService;
    private final BacktestService backtestService;
    private final IndicatorParams indicatorParams;

    public BacktestBatchService(
            MarketDataService marketDataService,
            BacktestService backtestService,
            IndicatorParams indicatorParams
    ) {
        this.marketDataService = marketDataService;
        this.backtestService = backtestService;
        this.indicatorParams = indicatorParams;
    }

    public BacktestBatchReport run(BacktestConfig config) {
        List<String> markets = config.selectedUniverse();
        log.info("[Backtest][BATCH] markets={} days={} parallelism={}", markets.size(), config.days(), config.parallelism());

        AtomicInteger processed = new AtomicInteger();
        Outcome[] outcomes = runAll(markets, config, processed);

        List<BacktestResult> results = new ArrayList<>();
        List<BacktestFailure> failures = new ArrayList<>();
        for (Outcome outcome : outcomes) {
            if (outcome.result() != null) {
                results.add(outcome.result());
            } else {
                failures.add(outcome.failure());
            }
        }
        results.sort(Comparator.comparingDouble((BacktestResult result) -> result.metrics().totalReturnPct()).reversed());

        log.info("[Backtest][BATCH] done success={} failed={} successRate={}",
                results.size(),
                failures.size(),
                formatPercent(markets.isEmpty() ? 0.0 : results.size() * 100.0 / markets.size()));
        for (BacktestFailure failure : failures) {
            log.warn("[Backtest][BATCH] failed market={} code={} reason={}", failure.market(), failure.code(), failure.reason());
        }

        return new BacktestBatchReport(List.copyOf(results), List.copyOf(failures), summarize(results));
    }

    BacktestSummary summarize(List<BacktestResult> sortedResults) {
        if (sortedResults.isEmpty()) {
            return null;
        }

        double[] returns = sortedResults.stream().mapToDouble(result -> result.metrics().totalReturnPct()).toArray();
        int n = returns.length;
        double mean = Arrays.stream(returns).average().orElse(0.0);
        double variance = Arrays.stream(returns).map(value -> (value - mean) * (value - mean)).sum() / n;
        double std = Math.sqrt(variance);
        int profitable = (int) Arrays.stream(returns).filter(value -> value > 0.0).count();

        BacktestResult best = sortedResults.get(0);
        BacktestResult worst = sortedResults.get(n - 1);
        return new BacktestSummary(
                n,
                profitable,
                mean,
                percentile(returns, 50.0),
                best.market(),
                best.metrics().totalReturnPct(),
                worst.market(),
                worst.metrics().totalReturnPct(),
                std,
                std > 0.0 ? mean / std : 0.0,
                percentile(returns, 5.0),
                sortedResults.stream().mapToDouble(result -> result.metrics().winRatePct()).average().orElse(0.0),
                sortedResults.stream().mapToDouble(result -> result.metrics().maxDrawdownPct()).average().orElse(0.0),
                sortedResults.stream().mapToDouble(BacktestResult::profit).average().orElse(0.0)
        );
    }

    // Linear interpolation between closest ranks.
    double percentile(double[] values, double percentile) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double position = (percentile / 100.0) * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
    }

    private Outcome[] runAll(List<String> markets, BacktestConfig config, AtomicInteger processed) {
        if (config.parallelism() <= 1) {
            Outcome[] outcomes = new Outcome[markets.size()];
            for (int i = 0; i < markets.size(); i++) {
                outcomes[i] = runOne(markets.get(i), config, processed, markets.size());
                if (i < markets.size() - 1) {
                    pace(config.pacingDelay());
                }
            }
            return outcomes;
        }

        ForkJoinPool pool = new ForkJoinPool(config.parallelism());
        try {
            return pool.submit(() -> IntStream.range(0, markets.size())
                    .parallel()
                    .mapToObj(i -> runOne(markets.get(i), config, processed, markets.size()))
                    .toArray(Outcome[]::new)).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Backtest batch interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Backtest batch failed", e.getCause());
        } finally {
            pool.shutdown();
        }
    }

    private Outcome runOne(String market, BacktestConfig config, AtomicInteger processed, int total) {
        Outcome outcome;
        try {
            List<PriceBar> bars = marketDataService.fetchDayCandles(market, config.days(), indicatorParams.warmupBars());
            BacktestResult result = backtestService.run(market, bars, config.initialCapital());
            log.info("[Backtest][RUN] market={} bars={} return={} trades={} mdd={}",
                    market,
                    bars.size(),
                    formatPercent(result.metrics().totalReturnPct()),
                    result.metrics().totalTrades(),
                    formatPercent(result.metrics().maxDrawdownPct()));
            outcome = new Outcome(result, null);
        } catch (MarketDataException e) {
            outcome = new Outcome(null, new BacktestFailure(market, e.getCode(), e.getMessage()));
        } catch (RuntimeException e) {
            log.error("[Backtest][RUN] market={} unexpected failure", market, e);
            outcome = new Outcome(null, new BacktestFailure(market, "backtest_error", String.valueOf(e.getMessage())));
        }

        int done = processed.incrementAndGet();
        if (done % PROGRESS_EVERY == 0) {
            log.info("[Backtest][PROGRESS] processed={}/{}", done, total);
        }
        return outcome;
    }

    private void pace(Duration delay) {
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Backtest batch interrupted", e);
        }
    }

    private String formatPercent(double value) {
        if (!Double.isFinite(value)) {
            return "NaN";
        }
        return String.format(Locale.US, "%.2f%%", value);
    }

    private record Outcome(BacktestResult result, BacktestFailure failure) {}
}
