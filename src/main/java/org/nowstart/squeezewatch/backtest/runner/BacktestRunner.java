package org.nowstart.squeezewatch.backtest.runner;

import org.nowstart.squeezewatch.backtest.config.BacktestConfig;
import org.nowstart.squeezewatch.backtest.model.BacktestBatchReport;
import org.nowstart.squeezewatch.backtest.model.BacktestMetrics;
import org.nowstart.squeezewatch.backtest.model.BacktestResult;
import org.nowstart.squeezewatch.backtest.model.BacktestSummary;
import org.nowstart.squeezewatch.backtest.service.BacktestBatchService;
import org.nowstart.squeezewatch.backtest.service.BacktestReportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Locale;

@Component
public class BacktestRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BacktestRunner.class);

    private final BacktestConfig config;
    private final BacktestBatchService backtestBatchService;
    private final BacktestReportService backtestReportService;

    public BacktestRunner(
            BacktestConfig config,
            BacktestBatchService backtestBatchService,
            BacktestReportService backtestReportService
    ) {
        this.config = config;
        this.backtestBatchService = backtestBatchService;
        this.backtestReportService = backtestReportService;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!config.enabled()) {
            log.debug("squeezewatch.backtest.enabled=false; pass --squeezewatch.backtest.enabled=true to run");
            return;
        }

        logSection("BACKTEST START");
        log.info("[Overview] markets={} days={} initialCapital={} parallelism={} outputDir={}",
                config.selectedUniverse().size(),
                config.days(),
                config.initialCapital(),
                config.parallelism(),
                config.outputDir());

        BacktestBatchReport report = backtestBatchService.run(config);
        if (report.isEmpty()) {
            logSection("NO RESULTS");
            log.warn("[Overview] no instrument completed; failures={}", report.failures().size());
            return;
        }

        logSection("RESULTS");
        for (int i = 0; i < report.results().size(); i++) {
            logResult(i + 1, report.results().size(), report.results().get(i));
        }

        logSection("SUMMARY");
        logSummary(report.summary());

        logSection("REPORT");
        Path outputDir = Path.of(config.outputDir());
        backtestReportService.writeResultsCsv(report, outputDir);
        backtestReportService.writeInvestmentReport(report, config.days(), config.initialCapital(), outputDir);
        logSection("BACKTEST END");
    }

    private void logResult(int rank, int total, BacktestResult result) {
        BacktestMetrics metrics = result.metrics();
        log.info("[Rank {}/{}] market={} final={} return={} winRate={} trades={} profitFactor={} mdd={} annualized={}",
                rank,
                total,
                result.market(),
                String.format(Locale.US, "%.0f", result.finalCash()),
                formatPercent(metrics.totalReturnPct()),
                formatPercent(metrics.winRatePct()),
                metrics.totalTrades(),
                metrics.profitFactor(),
                formatPercent(metrics.maxDrawdownPct()),
                formatPercent(metrics.annualizedReturnPct(result.initialCapital())));
    }

    private void logSummary(BacktestSummary summary) {
        log.info("[Summary] instruments={} profitable={} successRate={} avg={} median={} std={} sharpeLike={} var95={}",
                summary.totalInstruments(),
                summary.profitableInstruments(),
                formatPercent(summary.successRatePct()),
                formatPercent(summary.averageReturnPct()),
                formatPercent(summary.medianReturnPct()),
                formatPercent(summary.returnStdPct()),
                String.format(Locale.US, "%.2f", summary.sharpeLike()),
                formatPercent(summary.valueAtRisk95Pct()));
        log.info("[Summary] best={} ({}) worst={} ({})",
                summary.bestMarket(),
                formatPercent(summary.bestReturnPct()),
                summary.worstMarket(),
                formatPercent(summary.worstReturnPct()));
    }

    private void logSection(String title) {
        log.info("========== {} ==========", title);
    }

    private String formatPercent(double value) {
        if (!Double.isFinite(value)) {
            return "NaN";
        }
        return String.format(Locale.US, "%.2f%%", value);
    }
}
