package org.nowstart.squeezewatch.backtest.service;

import org.nowstart.squeezewatch.backtest.model.BacktestMetrics;
import org.nowstart.squeezewatch.backtest.model.BacktestResult;
import org.nowstart.squeezewatch.backtest.model.CompletedTrade;
import org.nowstart.squeezewatch.backtest.model.EquityPoint;
import org.nowstart.squeezewatch.backtest.model.TradeRecord;
import org.nowstart.squeezewatch.data.type.PositionState;
import org.nowstart.squeezewatch.data.type.TradeAction;
import org.nowstart.squeezewatch.strategy.BollingerIndicatorEngine;
import org.nowstart.squeezewatch.strategy.SqueezeSignalEvaluator;
import org.nowstart.squeezewatch.strategy.core.IndicatorParams;
import org.nowstart.squeezewatch.strategy.core.IndicatorSeries;
import org.nowstart.squeezewatch.strategy.core.PriceBar;
import org.nowstart.squeezewatch.strategy.core.SignalRules;
import org.nowstart.squeezewatch.strategy.core.SignalSet;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Bar-by-bar position simulation over one instrument. Each bar applies at most one transition,
 * chosen by the first matching rule in {@link #RULE_PRIORITY}.
 */
@Service
public class BacktestService {

    static final List<TradeAction> RULE_PRIORITY = List.of(TradeAction.SELL_ALL, TradeAction.SELL_50, TradeAction.BUY);

    private final BollingerIndicatorEngine indicatorEngine;
    private final SqueezeSignalEvaluator signalEvaluator;
    private final IndicatorParams indicatorParams;
    private final SignalRules signalRules;

    public BacktestService(
            BollingerIndicatorEngine indicatorEngine,
            SqueezeSignalEvaluator signalEvaluator,
            IndicatorParams indicatorParams,
            SignalRules signalRules
    ) {
        this.indicatorEngine = indicatorEngine;
        this.signalEvaluator = signalEvaluator;
        this.indicatorParams = indicatorParams;
        this.signalRules = signalRules;
    }

    public BacktestResult run(String market, List<PriceBar> bars, double initialCapital) {
        return simulate(market, bars, evaluateSignals(bars), initialCapital);
    }

    public List<SignalSet> evaluateSignals(List<PriceBar> bars) {
        IndicatorSeries series = indicatorEngine.compute(bars, indicatorParams);
        List<SignalSet> signals = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            signals.add(signalEvaluator.evaluate(series.row(i), series.row(i - 1), signalRules));
        }
        return signals;
    }

    public BacktestResult simulate(String market, List<PriceBar> bars, List<SignalSet> signals, double initialCapital) {
        if (bars == null || bars.isEmpty()) {
            throw new IllegalArgumentException("At least 1 bar is required");
        }
        if (signals == null || signals.size() != bars.size()) {
            throw new IllegalArgumentException("signals must align with bars");
        }
        if (initialCapital <= 0.0) {
            throw new IllegalArgumentException("initialCapital must be > 0");
        }

        PositionState position = PositionState.FLAT;
        double cash = initialCapital;
        double quantity = 0.0;
        List<TradeRecord> trades = new ArrayList<>();
        List<EquityPoint> equityCurve = new ArrayList<>(bars.size());

        for (int i = 0; i < bars.size(); i++) {
            PriceBar bar = bars.get(i);
            double price = bar.close();
            TradeAction action = resolveAction(signals.get(i), position);

            if (action == TradeAction.BUY) {
                quantity = cash / price;
                trades.add(new TradeRecord(market, action, bar.timestamp(), price, quantity, cash));
                cash = 0.0;
                position = PositionState.FULL;
            } else if (action == TradeAction.SELL_50) {
                double sold = quantity * 0.5;
                double value = sold * price;
                cash += value;
                quantity -= sold;
                trades.add(new TradeRecord(market, action, bar.timestamp(), price, sold, value));
                position = PositionState.HALF;
            } else if (action == TradeAction.SELL_ALL) {
                double value = quantity * price;
                cash += value;
                trades.add(new TradeRecord(market, action, bar.timestamp(), price, quantity, value));
                quantity = 0.0;
                position = PositionState.FLAT;
            }

            equityCurve.add(new EquityPoint(bar.timestamp(), price, cash, quantity * price));
        }

        // Mark-to-close: remaining holdings become cash without a trade record.
        if (quantity > 0.0) {
            cash += quantity * bars.get(bars.size() - 1).close();
        }

        List<CompletedTrade> completedTrades = pairRoundTrips(trades);
        BacktestMetrics metrics = calculateMetrics(completedTrades, equityCurve, cash, initialCapital, bars.size());
        return new BacktestResult(
                market,
                initialCapital,
                cash,
                List.copyOf(trades),
                completedTrades,
                List.copyOf(equityCurve),
                metrics
        );
    }

    TradeAction resolveAction(SignalSet signals, PositionState position) {
        for (TradeAction action : RULE_PRIORITY) {
            if (applies(action, signals, position)) {
                return action;
            }
        }
        return null;
    }

    private boolean applies(TradeAction action, SignalSet signals, PositionState position) {
        return switch (action) {
            case SELL_ALL -> signals.sellAll() && position != PositionState.FLAT;
            case SELL_50 -> signals.sell50() && position == PositionState.FULL;
            case BUY -> signals.buy() && position == PositionState.FLAT;
        };
    }

    // Every sell after a BUY closes a round-trip against that BUY; SELL_ALL ends the pairing.
    List<CompletedTrade> pairRoundTrips(List<TradeRecord> trades) {
        List<CompletedTrade> completed = new ArrayList<>();
        TradeRecord entry = null;
        for (TradeRecord trade : trades) {
            if (trade.action() == TradeAction.BUY) {
                entry = trade;
                continue;
            }
            if (entry == null || !trade.action().isSell()) {
                continue;
            }
            double profitPct = (trade.price() - entry.price()) / entry.price() * 100.0;
            completed.add(new CompletedTrade(entry.timestamp(), trade.timestamp(), entry.price(), trade.price(), profitPct));
            if (trade.action() == TradeAction.SELL_ALL) {
                entry = null;
            }
        }
        return List.copyOf(completed);
    }

    double maxDrawdownPct(List<EquityPoint> equityCurve) {
        if (equityCurve.isEmpty()) {
            return 0.0;
        }
        double peak = equityCurve.get(0).portfolioValue();
        double maxDrawdown = 0.0;
        for (EquityPoint point : equityCurve) {
            double value = point.portfolioValue();
            if (value > peak) {
                peak = value;
            }
            if (peak > 0.0) {
                maxDrawdown = Math.max(maxDrawdown, (peak - value) / peak * 100.0);
            }
        }
        return maxDrawdown;
    }

    private BacktestMetrics calculateMetrics(
            List<CompletedTrade> completedTrades,
            List<EquityPoint> equityCurve,
            double finalCash,
            double initialCapital,
            int testDays
    ) {
        int totalTrades = completedTrades.size();
        int winningTrades = 0;
        double profitSum = 0.0;
        double lossSum = 0.0;
        for (CompletedTrade trade : completedTrades) {
            if (trade.isWinning()) {
                winningTrades++;
                profitSum += trade.profitPct();
            } else {
                lossSum += trade.profitPct();
            }
        }
        int losingTrades = totalTrades - winningTrades;

        double avgProfit = winningTrades == 0 ? 0.0 : profitSum / winningTrades;
        double avgLoss = losingTrades == 0 ? 0.0 : lossSum / losingTrades;
        double profitFactor = avgLoss == 0.0 ? Double.POSITIVE_INFINITY : Math.abs(avgProfit / avgLoss);

        return new BacktestMetrics(
                (finalCash - initialCapital) / initialCapital * 100.0,
                totalTrades,
                winningTrades,
                totalTrades == 0 ? 0.0 : winningTrades * 100.0 / totalTrades,
                avgProfit,
                avgLoss,
                profitFactor,
                maxDrawdownPct(equityCurve),
                finalCash,
                testDays
        );
    }
}
