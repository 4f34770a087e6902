package org.nowstart.squeezewatch.backtest.runner;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.squeezewatch.backtest.config.BacktestConfig;
import org.nowstart.squeezewatch.backtest.model.BacktestBatchReport;
import org.nowstart.squeezewatch.backtest.model.BacktestFailure;
import org.nowstart.squeezewatch.backtest.model.BacktestMetrics;
import org.nowstart.squeezewatch.backtest.model.BacktestResult;
import org.nowstart.squeezewatch.backtest.model.BacktestSummary;
import org.nowstart.squeezewatch.backtest.service.BacktestBatchService;
import org.nowstart.squeezewatch.backtest.service.BacktestReportService;
import org.springframework.boot.DefaultApplicationArguments;

@ExtendWith(MockitoExtension.class)
class BacktestRunnerTest {

    @Mock
    private BacktestBatchService backtestBatchService;

    @Mock
    private BacktestReportService backtestReportService;

    @Test
    void run_skipsWhenDisabled() {
        BacktestRunner runner = new BacktestRunner(config(false), backtestBatchService, backtestReportService);

        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(backtestBatchService, backtestReportService);
    }

    @Test
    void run_writesReportsForCompletedBatch() {
        BacktestConfig config = config(true);
        BacktestResult result = new BacktestResult(
                "KRW-BTC",
                1_000_000.0,
                1_200_000.0,
                List.of(),
                List.of(),
                List.of(),
                new BacktestMetrics(20.0, 3, 2, 66.7, 15.0, -5.0, 3.0, 8.0, 1_200_000.0, 365)
        );
        BacktestSummary summary = new BacktestSummary(
                1, 1, 20.0, 20.0, "KRW-BTC", 20.0, "KRW-BTC", 20.0, 0.0, 0.0, 20.0, 66.7, 8.0, 200_000.0);
        BacktestBatchReport report = new BacktestBatchReport(List.of(result), List.of(), summary);
        when(backtestBatchService.run(config)).thenReturn(report);
        BacktestRunner runner = new BacktestRunner(config, backtestBatchService, backtestReportService);

        runner.run(new DefaultApplicationArguments());

        verify(backtestReportService).writeResultsCsv(report, Path.of("out"));
        verify(backtestReportService).writeInvestmentReport(report, 365, 1_000_000.0, Path.of("out"));
    }

    @Test
    void run_skipsReportsWhenEveryInstrumentFailed() {
        BacktestConfig config = config(true);
        BacktestBatchReport report = new BacktestBatchReport(
                List.of(), List.of(new BacktestFailure("KRW-BTC", "fetch_failed", "down")), null);
        when(backtestBatchService.run(config)).thenReturn(report);
        BacktestRunner runner = new BacktestRunner(config, backtestBatchService, backtestReportService);

        runner.run(new DefaultApplicationArguments());

        verify(backtestReportService, never()).writeResultsCsv(any(), any());
    }

    private BacktestConfig config(boolean enabled) {
        return new BacktestConfig(enabled, 1_000_000.0, 365, 5, List.of("KRW-BTC"), 1, Duration.ZERO, "out");
    }
}
