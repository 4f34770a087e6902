package org.nowstart.squeezewatch.backtest.service;

import org.nowstart.squeezewatch.backtest.model.BacktestBatchReport;
import org.nowstart.squeezewatch.backtest.model.BacktestMetrics;
import org.nowstart.squeezewatch.backtest.model.BacktestResult;
import org.nowstart.squeezewatch.backtest.model.BacktestSummary;
import org.nowstart.squeezewatch.data.property.StrategyProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Writes the per-instrument results table (CSV) and the plain-text investment report.
 */
@Service
public class BacktestReportService {

    private static final Logger log = LoggerFactory.getLogger(BacktestReportService.class);
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final DateTimeFormatter DISPLAY_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String CSV_HEADER = "market,initial_capital,final_value,profit,total_return_pct,win_rate_pct,"
            + "total_trades,winning_trades,avg_profit_pct,avg_loss_pct,profit_factor,max_drawdown_pct,test_days";
    private static final String RULE = "=".repeat(60);
    private static final int TOP_PICKS = 3;

    private final StrategyProperties strategyProperties;
    private final Clock clock;

    public BacktestReportService(StrategyProperties strategyProperties, Clock clock) {
        this.strategyProperties = strategyProperties;
        this.clock = clock;
    }

    public Path writeResultsCsv(BacktestBatchReport report, Path outputDir) {
        Path path = outputDir.resolve("results").resolve("backtest_results_" + stamp() + ".csv");
        List<String> lines = new ArrayList<>(report.results().size() + 1);
        lines.add(CSV_HEADER);
        for (BacktestResult result : report.results()) {
            lines.add(toCsvRow(result));
        }
        write(path, lines);
        log.info("[Backtest][REPORT] results csv saved path={} rows={}", path.toAbsolutePath(), report.results().size());
        return path;
    }

    public Path writeInvestmentReport(BacktestBatchReport report, int days, double initialCapital, Path outputDir) {
        Path path = outputDir.resolve("reports").resolve("investment_report_" + stamp() + ".txt");
        write(path, List.of(renderInvestmentReport(report, days, initialCapital)));
        log.info("[Backtest][REPORT] investment report saved path={}", path.toAbsolutePath());
        return path;
    }

    String toCsvRow(BacktestResult result) {
        BacktestMetrics metrics = result.metrics();
        return String.join(",",
                result.market(),
                number(result.initialCapital(), 0),
                number(result.finalCash(), 0),
                number(result.profit(), 0),
                number(metrics.totalReturnPct(), 2),
                number(metrics.winRatePct(), 2),
                String.valueOf(metrics.totalTrades()),
                String.valueOf(metrics.winningTrades()),
                number(metrics.avgProfitPct(), 2),
                number(metrics.avgLossPct(), 2),
                number(metrics.profitFactor(), 2),
                number(metrics.maxDrawdownPct(), 2),
                String.valueOf(metrics.testPeriodDays())
        );
    }

    String renderInvestmentReport(BacktestBatchReport report, int days, double initialCapital) {
        BacktestSummary summary = report.summary();
        StringBuilder sb = new StringBuilder();
        sb.append("📊 업비트 코인 투자 분석 리포트\n").append(RULE).append('\n');
        sb.append("📅 분석 기간: 최근 ").append(days).append("일 (약 ").append(days / 365).append("년)\n");
        sb.append("💰 초기 자금: ").append(won(initialCapital)).append("원\n");
        sb.append("⚙️ 전략 모드: ").append(strategyProperties.profile()).append(" / ")
                .append(strategyProperties.buyRule()).append(" / ").append(strategyProperties.squeezePolicy()).append("\n\n");

        if (summary == null) {
            sb.append("❌ 분석 가능한 코인이 없습니다.\n");
        } else {
            appendSummary(sb, report, summary, initialCapital);
        }

        sb.append("\n⚠️ 투자 주의사항:\n");
        sb.append("   • 과거 성과는 미래 수익을 보장하지 않습니다\n");
        sb.append("   • 분산 투자를 통해 리스크를 관리하세요\n");
        sb.append("   • 손실 허용 범위 내에서 투자하세요\n");
        sb.append("   • 코인은 주식보다 변동성이 매우 높습니다\n\n");

        sb.append("📊 사용된 전략 파라미터:\n");
        sb.append("   • 볼린저 밴드: ").append(strategyProperties.bbPeriod()).append("일, ")
                .append(strategyProperties.bbStdMultiplier().toPlainString()).append("σ\n");
        sb.append("   • RSI 임계값: ").append(number(strategyProperties.profile().rsiOverbought(), 0)).append('\n');
        sb.append("   • 50% 익절 / 전량 매도 BB 위치: ")
                .append(number(strategyProperties.profile().sell50Threshold(), 2)).append(" / ")
                .append(number(strategyProperties.profile().sellAllThreshold(), 2)).append('\n');
        sb.append("   • 변동성 압축 lookback: ").append(strategyProperties.volatilityLookback()).append("일\n\n");

        if (!report.failures().isEmpty()) {
            sb.append("❌ 실패한 코인: ").append(report.failures().size()).append("개\n");
            report.failures().forEach(failure -> sb.append("   • ").append(failure.market())
                    .append(" (").append(failure.code()).append(")\n"));
            sb.append('\n');
        }

        sb.append(RULE).append('\n');
        sb.append("리포트 생성 시간: ").append(DISPLAY_TIME.format(clock.instant().atZone(clock.getZone()))).append('\n');
        return sb.toString();
    }

    private void appendSummary(StringBuilder sb, BacktestBatchReport report, BacktestSummary summary, double initialCapital) {
        List<BacktestResult> results = report.results();
        long excellent = results.stream().filter(result -> result.metrics().totalReturnPct() >= 20.0).count();
        long good = results.stream()
                .filter(result -> result.metrics().totalReturnPct() >= 10.0 && result.metrics().totalReturnPct() < 20.0)
                .count();

        sb.append("📈 성과 요약:\n");
        sb.append("   • 분석 코인: ").append(summary.totalInstruments()).append("개\n");
        sb.append("   • 수익 코인: ").append(summary.profitableInstruments()).append("개 (")
                .append(number(summary.successRatePct(), 1)).append("%)\n");
        sb.append("   • 평균 수익률: ").append(number(summary.averageReturnPct(), 2)).append("%\n");
        sb.append("   • 중앙 수익률: ").append(number(summary.medianReturnPct(), 2)).append("%\n");
        sb.append("   • 평균 승률: ").append(number(summary.averageWinRatePct(), 2)).append("%\n");
        sb.append("   • 평균 최대낙폭: ").append(number(summary.averageMaxDrawdownPct(), 2)).append("%\n");
        sb.append("   • 최고 수익: ").append(summary.bestMarket()).append(" (")
                .append(number(summary.bestReturnPct(), 2)).append("%)\n");
        sb.append("   • 최저 수익: ").append(summary.worstMarket()).append(" (")
                .append(number(summary.worstReturnPct(), 2)).append("%)\n\n");

        sb.append("🏆 성과 등급별 분포:\n");
        sb.append("   • 우수 (20%+): ").append(excellent).append("개\n");
        sb.append("   • 양호 (10-20%): ").append(good).append("개\n");
        sb.append("   • 수익 (0-10%): ").append(summary.profitableInstruments() - excellent - good).append("개\n\n");

        sb.append("📊 리스크 분석:\n");
        sb.append("   • 변동성: ").append(number(summary.returnStdPct(), 2)).append("%\n");
        sb.append("   • 샤프 비율: ").append(number(summary.sharpeLike(), 2)).append('\n');
        sb.append("   • 95% VaR: ").append(number(summary.valueAtRisk95Pct(), 2)).append("%\n");
        sb.append("   • 리스크 등급: ").append(riskGrade(summary.returnStdPct())).append("\n\n");

        sb.append("🎯 투자 추천:\n\n   📈 공격적 포트폴리오 (수익률 우선):\n");
        for (int i = 0; i < Math.min(TOP_PICKS, results.size()); i++) {
            BacktestResult result = results.get(i);
            double profitAmount = result.metrics().totalReturnPct() / 100.0 * initialCapital;
            sb.append("      ").append(i + 1).append(". ").append(result.market()).append(": ")
                    .append(number(result.metrics().totalReturnPct(), 2)).append("% (")
                    .append(won(profitAmount)).append("원)\n");
        }

        double portfolioProfit = summary.averageReturnPct() / 100.0 * initialCapital;
        sb.append("\n💼 포트폴리오 시뮬레이션 (동일 비중 투자):\n");
        sb.append("   예상 수익률: ").append(number(summary.averageReturnPct(), 2)).append("%\n");
        sb.append("   예상 수익금: ").append(won(portfolioProfit)).append("원\n");
        sb.append("   예상 최종자산: ").append(won(initialCapital + portfolioProfit)).append("원\n");

        sb.append("\n💡 추천 투자 전략: ").append(strategyAdvice(summary.averageReturnPct())).append('\n');
    }

    String strategyAdvice(double averageReturnPct) {
        if (averageReturnPct > 15.0) {
            return "💪 강세장 전략: 적극적 투자 추천";
        }
        if (averageReturnPct > 5.0) {
            return "⚖️ 균형 전략: 분산 투자 추천";
        }
        return "🛡️ 보수적 전략: 신중한 투자 필요";
    }

    private String riskGrade(double std) {
        if (std <= 10.0) {
            return "🟢 낮음";
        }
        return std <= 20.0 ? "🟡 보통" : "🔴 높음";
    }

    private void write(Path path, List<String> lines) {
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Files.write(path, lines, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write report: " + path, e);
        }
    }

    private String stamp() {
        return FILE_STAMP.format(clock.instant().atZone(clock.getZone()));
    }

    private String number(double value, int scale) {
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (Double.isNaN(value)) {
            return "NaN";
        }
        return String.format(Locale.ROOT, "%." + scale + "f", value);
    }

    private String won(double value) {
        return String.format(Locale.KOREA, "%,.0f", value);
    }
}
