package com.tradingagent.backtest;

import com.tradingagent.domain.enums.ExitType;
import com.tradingagent.domain.enums.OrderSide;
import com.tradingagent.domain.enums.SignalAction;
import com.tradingagent.domain.model.BacktestResult;
import com.tradingagent.domain.model.BacktestTrade;
import com.tradingagent.domain.model.Bar;
import com.tradingagent.domain.model.StrategyOutput;
import com.tradingagent.exception.BusinessException;
import com.tradingagent.exception.ErrorCode;
import com.tradingagent.exception.ResourceNotFoundException;
import com.tradingagent.marketdata.MarketDataSource;
import com.tradingagent.strategy.Strategy;
import com.tradingagent.strategy.StrategyAgent;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Walk-forward replay of a single strategy over one symbol's history.
 *
 * <p>Step {@code i} hands the strategy {@code bars[0..i]} only, so no decision sees a later bar. At most
 * one simulated position is open at a time; it fills at the close of the signalling bar and exits at the
 * close of the bar where the strategy emits CLOSE, flips to the opposite side, or the close breaches the
 * strategy's stop. A position still open after the last bar is reported but not counted as a trade.
 */
@Service
public class Backtester {

    private static final Logger log = LoggerFactory.getLogger(Backtester.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final StrategyAgent strategyAgent;
    private final MarketDataSource marketDataSource;
    private final BacktestProperties backtestProperties;

    public Backtester(
            StrategyAgent strategyAgent, MarketDataSource marketDataSource, BacktestProperties backtestProperties) {
        this.strategyAgent = strategyAgent;
        this.marketDataSource = marketDataSource;
        this.backtestProperties = backtestProperties;
    }

    /**
     * Fetches {@code lookbackDays} of history for {@code symbol} and replays the named strategy over it.
     *
     * @throws ResourceNotFoundException if no enabled strategy has this name
     * @throws BusinessException if the data source returns no bars for the symbol
     */
    public BacktestResult backtest(String strategyName, String symbol, int lookbackDays) {
        Strategy strategy = strategyAgent
                .findStrategy(strategyName)
                .orElseThrow(() -> new ResourceNotFoundException("Strategy", strategyName));
        Map<String, List<Bar>> bars = marketDataSource.getBars(List.of(symbol), lookbackDays);
        List<Bar> history = bars.getOrDefault(symbol, List.of());
        if (history.isEmpty()) {
            throw new BusinessException(ErrorCode.BAD_REQUEST, "No price history for " + symbol);
        }
        return run(strategy, symbol, history);
    }

    public BacktestResult run(Strategy strategy, String symbol, List<Bar> bars) {
        return run(strategy, symbol, bars, backtestProperties.getInitialCapital());
    }

    public BacktestResult run(Strategy strategy, String symbol, List<Bar> bars, BigDecimal initialCapital) {
        BigDecimal capital = initialCapital;
        BigDecimal peak = initialCapital;
        double maxDrawdown = 0.0;
        List<BacktestTrade> trades = new ArrayList<>();
        OpenPosition open = null;

        int start = Math.max(strategy.requiredBars() - 1, 0);
        for (int i = start; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            BigDecimal close = bar.getClose();
            StrategyOutput output = strategy.generateSignal(symbol, bars.subList(0, i + 1));

            if (open != null) {
                ExitType exitType = exitType(open, close, output);
                if (exitType != null) {
                    BacktestTrade trade = open.close(bar, exitType, exitReason(exitType, open, output));
                    trades.add(trade);
                    capital = capital.add(trade.getPnl());
                    if (capital.compareTo(peak) > 0) {
                        peak = capital;
                    } else if (peak.signum() > 0) {
                        double drawdown = peak.subtract(capital)
                                .divide(peak, 6, RoundingMode.HALF_UP)
                                .doubleValue();
                        maxDrawdown = Math.max(maxDrawdown, drawdown);
                    }
                    open = null;
                }
            } else if (output.isEntry()) {
                open = OpenPosition.open(output, bar, quantity(capital, close));
            }
        }

        BacktestResult result = summarize(
                strategy.getName(), symbol, bars.size(), initialCapital, capital, trades, maxDrawdown, open != null);
        log.info(
                "Backtest {} on {}: {} trades, win rate {}, return {} ({}%)",
                strategy.getName(),
                symbol,
                result.getTotalTrades(),
                String.format("%.2f", result.getWinRate()),
                result.getTotalReturn(),
                result.getTotalReturnPercent());
        return result;
    }

    // ==============================
    // EXIT RULES
    // ==============================

    private static ExitType exitType(OpenPosition open, BigDecimal close, StrategyOutput output) {
        if (open.stopLoss != null) {
            boolean breached = open.side == OrderSide.BUY
                    ? close.compareTo(open.stopLoss) <= 0
                    : close.compareTo(open.stopLoss) >= 0;
            if (breached) {
                return ExitType.STOP_LOSS;
            }
        }
        if (output.getAction() == SignalAction.CLOSE) {
            return ExitType.SIGNAL;
        }
        SignalAction opposite = open.side == OrderSide.BUY ? SignalAction.SHORT : SignalAction.LONG;
        return output.getAction() == opposite ? ExitType.SIGNAL : null;
    }

    private static String exitReason(ExitType exitType, OpenPosition open, StrategyOutput output) {
        if (exitType == ExitType.STOP_LOSS) {
            return "Stop loss hit at " + open.stopLoss;
        }
        return output.getAction() == SignalAction.CLOSE
                ? "Close signal: " + output.getReason()
                : "Opposite signal: " + output.getReason();
    }

    private int quantity(BigDecimal capital, BigDecimal price) {
        BigDecimal budget = capital.multiply(backtestProperties.getPositionFraction());
        int quantity = budget.divide(price, 0, RoundingMode.DOWN).intValue();
        return Math.max(quantity, 1);
    }

    // ==============================
    // AGGREGATES
    // ==============================

    private static BacktestResult summarize(
            String strategy,
            String symbol,
            int barsReplayed,
            BigDecimal initialCapital,
            BigDecimal finalCapital,
            List<BacktestTrade> trades,
            double maxDrawdown,
            boolean positionOpenAtEnd) {
        List<BigDecimal> wins = trades.stream()
                .map(BacktestTrade::getPnl)
                .filter(pnl -> pnl.signum() > 0)
                .toList();
        List<BigDecimal> losses = trades.stream()
                .map(BacktestTrade::getPnl)
                .filter(pnl -> pnl.signum() <= 0)
                .toList();

        BigDecimal averageWin = average(wins);
        BigDecimal averageLoss = average(losses);
        BigDecimal profitFactor = averageLoss.signum() == 0
                ? BigDecimal.ZERO
                : averageWin.divide(averageLoss, 4, RoundingMode.HALF_UP).abs();
        BigDecimal totalReturn = finalCapital.subtract(initialCapital).setScale(2, RoundingMode.HALF_UP);
        BigDecimal totalReturnPercent = initialCapital.signum() == 0
                ? BigDecimal.ZERO
                : totalReturn.multiply(HUNDRED).divide(initialCapital, 4, RoundingMode.HALF_UP);

        return BacktestResult.builder()
                .strategy(strategy)
                .symbol(symbol)
                .barsReplayed(barsReplayed)
                .initialCapital(initialCapital)
                .finalCapital(finalCapital.setScale(2, RoundingMode.HALF_UP))
                .totalTrades(trades.size())
                .winningTrades(wins.size())
                .losingTrades(losses.size())
                .winRate(trades.isEmpty() ? 0.0 : (double) wins.size() / trades.size())
                .totalReturn(totalReturn)
                .totalReturnPercent(totalReturnPercent)
                .averageWin(averageWin)
                .averageLoss(averageLoss)
                .profitFactor(profitFactor)
                .maxDrawdown(maxDrawdown)
                .positionOpenAtEnd(positionOpenAtEnd)
                .trades(List.copyOf(trades))
                .build();
    }

    private static BigDecimal average(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return BigDecimal.ZERO;
        }
        BigDecimal sum = values.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return sum.divide(BigDecimal.valueOf(values.size()), 2, RoundingMode.HALF_UP);
    }

    private static final class OpenPosition {

        private final OrderSide side;
        private final int quantity;
        private final BigDecimal entryPrice;
        private final BigDecimal stopLoss;
        private final double strength;
        private final Bar entryBar;

        private OpenPosition(
                OrderSide side,
                int quantity,
                BigDecimal entryPrice,
                BigDecimal stopLoss,
                double strength,
                Bar entryBar) {
            this.side = side;
            this.quantity = quantity;
            this.entryPrice = entryPrice;
            this.stopLoss = stopLoss;
            this.strength = strength;
            this.entryBar = entryBar;
        }

        static OpenPosition open(StrategyOutput output, Bar bar, int quantity) {
            OrderSide side = output.getAction() == SignalAction.LONG ? OrderSide.BUY : OrderSide.SELL;
            return new OpenPosition(side, quantity, bar.getClose(), output.getStopLoss(), output.getStrength(), bar);
        }

        BacktestTrade close(Bar bar, ExitType exitType, String reason) {
            BigDecimal exitPrice = bar.getClose();
            BigDecimal perShare =
                    side == OrderSide.BUY ? exitPrice.subtract(entryPrice) : entryPrice.subtract(exitPrice);
            BigDecimal qty = BigDecimal.valueOf(quantity);
            BigDecimal pnl = perShare.multiply(qty).setScale(2, RoundingMode.HALF_UP);
            BigDecimal notional = entryPrice.multiply(qty);
            BigDecimal pnlPercent = notional.signum() == 0
                    ? BigDecimal.ZERO
                    : perShare.multiply(qty).multiply(HUNDRED).divide(notional, 4, RoundingMode.HALF_UP);
            return BacktestTrade.builder()
                    .side(side)
                    .quantity(quantity)
                    .entryPrice(entryPrice)
                    .exitPrice(exitPrice)
                    .stopLoss(stopLoss)
                    .entryTimestamp(entryBar.getTimestamp())
                    .exitTimestamp(bar.getTimestamp())
                    .entryStrength(strength)
                    .pnl(pnl)
                    .pnlPercent(pnlPercent)
                    .exitType(exitType)
                    .exitReason(reason)
                    .build();
        }
    }
}
