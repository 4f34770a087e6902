package org.nowstart.squeezewatch.backtest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

@ConfigurationProperties(prefix = "squeezewatch.backtest")
public record BacktestConfig(
        Boolean enabled,
        Double initialCapital,
        Integer days,
        Integer maxInstruments,
        List<String> universe,
        Integer parallelism,
        Duration pacingDelay,
        String outputDir
) {
    private static final double DEFAULT_INITIAL_CAPITAL = 1_000_000.0;
    private static final int DEFAULT_DAYS = 1095;
    private static final int DEFAULT_MAX_INSTRUMENTS = 20;
    private static final Duration DEFAULT_PACING_DELAY = Duration.ofMillis(100);
    private static final String DEFAULT_OUTPUT_DIR = "outputs/backtest";
    private static final List<String> DEFAULT_UNIVERSE = List.of(
            "KRW-BTC", "KRW-ETH", "KRW-XRP", "KRW-ADA", "KRW-DOT",
            "KRW-LINK", "KRW-BCH", "KRW-TRX", "KRW-SOL", "KRW-DOGE",
            "KRW-AVAX", "KRW-ATOM", "KRW-ALGO", "KRW-VET", "KRW-THETA",
            "KRW-AAVE", "KRW-SHIB", "KRW-ARB", "KRW-SUI", "KRW-XLM"
    );

    public BacktestConfig {
        enabled = enabled != null ? enabled : false;
        initialCapital = initialCapital != null ? initialCapital : DEFAULT_INITIAL_CAPITAL;
        days = days != null ? days : DEFAULT_DAYS;
        maxInstruments = maxInstruments != null ? maxInstruments : DEFAULT_MAX_INSTRUMENTS;
        universe = normalizeUniverse(universe);
        parallelism = parallelism != null ? parallelism : 1;
        pacingDelay = pacingDelay != null ? pacingDelay : DEFAULT_PACING_DELAY;
        outputDir = outputDir == null || outputDir.isBlank() ? DEFAULT_OUTPUT_DIR : outputDir.trim();

        if (initialCapital <= 0.0) {
            throw new IllegalArgumentException("initial-capital must be > 0");
        }
        if (days <= 0) {
            throw new IllegalArgumentException("days must be > 0");
        }
        if (maxInstruments <= 0) {
            throw new IllegalArgumentException("max-instruments must be > 0");
        }
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be > 0");
        }
        if (pacingDelay.isNegative()) {
            throw new IllegalArgumentException("pacing-delay must be >= 0");
        }
    }

    public List<String> selectedUniverse() {
        return universe.subList(0, Math.min(maxInstruments, universe.size()));
    }

    // Upper-cased, KRW- prefixed, duplicates dropped in first-seen order.
    private static List<String> normalizeUniverse(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return DEFAULT_UNIVERSE;
        }
        LinkedHashSet<String> markets = new LinkedHashSet<>();
        for (String value : raw) {
            if (value == null || value.isBlank()) {
                continue;
            }
            String market = value.trim().toUpperCase(Locale.ROOT);
            markets.add(market.startsWith("KRW-") ? market : "KRW-" + market);
        }
        if (markets.isEmpty()) {
            throw new IllegalArgumentException("universe must contain at least one market");
        }
        return List.copyOf(markets);
    }
}
