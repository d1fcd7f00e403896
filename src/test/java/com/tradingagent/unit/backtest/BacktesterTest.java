package com.tradingagent.unit.backtest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.when;

import com.tradingagent.backtest.BacktestProperties;
import com.tradingagent.backtest.Backtester;
import com.tradingagent.domain.enums.ExitType;
import com.tradingagent.domain.enums.OrderSide;
import com.tradingagent.domain.enums.SignalAction;
import com.tradingagent.domain.model.BacktestResult;
import com.tradingagent.domain.model.BacktestTrade;
import com.tradingagent.domain.model.Bar;
import com.tradingagent.domain.model.StrategyOutput;
import com.tradingagent.exception.BusinessException;
import com.tradingagent.exception.ResourceNotFoundException;
import com.tradingagent.indicator.IndicatorLibrary;
import com.tradingagent.marketdata.MarketDataSource;
import com.tradingagent.risk.RiskProperties;
import com.tradingagent.strategy.MeanReversionStrategy;
import com.tradingagent.strategy.Strategy;
import com.tradingagent.strategy.StrategyAgent;
import com.tradingagent.strategy.StrategyProperties;
import com.tradingagent.support.TestBars;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for Backtester: walk-forward replay without lookahead, stop and signal exits, and the
 * aggregate statistics.
 */
@ExtendWith(MockitoExtension.class)
class BacktesterTest {

    private static final double[] CLOSES = {100, 100, 100, 100, 102, 104, 103, 106, 105, 109};

    @Mock
    private StrategyAgent strategyAgent;

    @Mock
    private MarketDataSource marketDataSource;

    private Backtester backtester;

    @BeforeEach
    void setUp() {
        backtester = new Backtester(strategyAgent, marketDataSource, new BacktestProperties());
    }

    private static StrategyOutput entry(SignalAction action, String stop) {
        return StrategyOutput.builder()
                .strategyName("scripted")
                .action(action)
                .strength(0.8)
                .stopLoss(new BigDecimal(stop))
                .reason(action.name().toLowerCase())
                .build();
    }

    private static StrategyOutput close() {
        return StrategyOutput.builder()
                .strategyName("scripted")
                .action(SignalAction.CLOSE)
                .strength(0.8)
                .reason("back to mean")
                .build();
    }

    // ==============================
    // REPLAY
    // ==============================

    @Nested
    @DisplayName("Replay")
    class Replay {

        @Test
        @DisplayName("A winning signal exit and a losing stop exit produce the expected statistics")
        void statistics() {
            ScriptedStrategy strategy = new ScriptedStrategy(Map.of(
                    4, entry(SignalAction.LONG, "95"),
                    6, close(),
                    7, entry(SignalAction.SHORT, "108")));

            BacktestResult result = backtester.run(strategy, "AAPL", TestBars.closes(CLOSES));

            assertThat(result.getTotalTrades()).isEqualTo(2);
            assertThat(result.getWinningTrades()).isEqualTo(1);
            assertThat(result.getLosingTrades()).isEqualTo(1);
            assertThat(result.getWinRate()).isEqualTo(0.5);
            assertThat(result.getTotalReturn()).isEqualByComparingTo("-34.00");
            assertThat(result.getTotalReturnPercent()).isEqualByComparingTo("-0.3400");
            assertThat(result.getAverageWin()).isEqualByComparingTo("80.00");
            assertThat(result.getAverageLoss()).isEqualByComparingTo("-114.00");
            assertThat(result.getProfitFactor()).isEqualByComparingTo("0.7018");
            assertThat(result.getMaxDrawdown()).isCloseTo(0.011310, within(1e-9));
            assertThat(result.getFinalCapital()).isEqualByComparingTo("9966.00");
            assertThat(result.isPositionOpenAtEnd()).isFalse();
        }

        @Test
        @DisplayName("Trades fill at the signalling close and size from running capital")
        void tradeDetails() {
            ScriptedStrategy strategy = new ScriptedStrategy(Map.of(
                    4, entry(SignalAction.LONG, "95"),
                    6, close(),
                    7, entry(SignalAction.SHORT, "108")));

            List<BacktestTrade> trades = backtester.run(strategy, "AAPL", TestBars.closes(CLOSES)).getTrades();

            BacktestTrade first = trades.get(0);
            assertThat(first.getSide()).isEqualTo(OrderSide.BUY);
            assertThat(first.getQuantity()).isEqualTo(20);
            assertThat(first.getEntryPrice()).isEqualByComparingTo("100");
            assertThat(first.getExitPrice()).isEqualByComparingTo("104");
            assertThat(first.getPnlPercent()).isEqualByComparingTo("4.0000");
            assertThat(first.getExitReason()).isEqualTo("Close signal: back to mean");

            BacktestTrade second = trades.get(1);
            assertThat(second.getSide()).isEqualTo(OrderSide.SELL);
            assertThat(second.getQuantity()).isEqualTo(19);
            assertThat(second.getExitType()).isEqualTo(ExitType.STOP_LOSS);
            assertThat(second.getExitReason()).isEqualTo("Stop loss hit at 108");
            assertThat(second.getPnl()).isEqualByComparingTo("-114.00");
        }

        @Test
        @DisplayName("An opposite signal closes the position without reversing it")
        void oppositeSignalExit() {
            ScriptedStrategy strategy = new ScriptedStrategy(Map.of(
                    4, entry(SignalAction.LONG, "95"),
                    6, entry(SignalAction.SHORT, "110")));

            BacktestResult result = backtester.run(strategy, "AAPL", TestBars.closes(CLOSES));

            assertThat(result.getTrades()).singleElement().satisfies(trade -> {
                assertThat(trade.getExitType()).isEqualTo(ExitType.SIGNAL);
                assertThat(trade.getExitReason()).startsWith("Opposite signal");
            });
            assertThat(result.isPositionOpenAtEnd()).isFalse();
        }

        @Test
        @DisplayName("A position still open after the last bar is reported but not counted")
        void openAtEnd() {
            ScriptedStrategy strategy = new ScriptedStrategy(Map.of(9, entry(SignalAction.LONG, "90")));

            BacktestResult result = backtester.run(strategy, "AAPL", TestBars.closes(CLOSES));

            assertThat(result.getTotalTrades()).isZero();
            assertThat(result.isPositionOpenAtEnd()).isTrue();
            assertThat(result.getFinalCapital()).isEqualByComparingTo("10000.00");
            assertThat(result.getProfitFactor()).isEqualByComparingTo(BigDecimal.ZERO);
        }

        @Test
        @DisplayName("Each step sees only the bars up to and including the current one")
        void noLookahead() {
            ScriptedStrategy strategy = new ScriptedStrategy(Map.of());

            backtester.run(strategy, "AAPL", TestBars.closes(CLOSES));

            assertThat(strategy.seenSizes).containsExactly(3, 4, 5, 6, 7, 8, 9, 10);
            assertThat(strategy.lastSeenCloses)
                    .usingElementComparator(BigDecimal::compareTo)
                    .containsExactly(
                            BigDecimal.valueOf(100.0), BigDecimal.valueOf(100.0), BigDecimal.valueOf(102.0),
                            BigDecimal.valueOf(104.0), BigDecimal.valueOf(103.0), BigDecimal.valueOf(106.0),
                            BigDecimal.valueOf(105.0), BigDecimal.valueOf(109.0));
        }

        @Test
        @DisplayName("Replaying the same history twice gives identical results")
        void deterministic() {
            MeanReversionStrategy strategy = new MeanReversionStrategy(
                    new IndicatorLibrary(), new StrategyProperties(), new RiskProperties());
            List<Bar> bars = TestBars.series(150, i -> 100 + 8 * Math.sin(i / 4.0) + (i % 7 == 0 ? -6 : 0));

            BacktestResult first = backtester.run(strategy, "AAPL", bars);
            BacktestResult second = backtester.run(strategy, "AAPL", bars);

            assertThat(second).isEqualTo(first);
            assertThat(first.getBarsReplayed()).isEqualTo(150);
        }
    }

    // ==============================
    // ENTRY POINT
    // ==============================

    @Nested
    @DisplayName("Backtest request")
    class Request {

        @Test
        @DisplayName("Unknown strategy names are not found")
        void unknownStrategy() {
            when(strategyAgent.findStrategy("nope")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> backtester.backtest("nope", "AAPL", 365))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .hasMessageContaining("nope");
        }

        @Test
        @DisplayName("A symbol without history is a bad request")
        void noHistory() {
            when(strategyAgent.findStrategy("scripted")).thenReturn(Optional.of(new ScriptedStrategy(Map.of())));
            when(marketDataSource.getBars(List.of("ZZZZ"), 365)).thenReturn(Map.of());

            assertThatThrownBy(() -> backtester.backtest("scripted", "ZZZZ", 365))
                    .isInstanceOf(BusinessException.class)
                    .hasMessage("No price history for ZZZZ");
        }

        @Test
        @DisplayName("Fetches the requested lookback and replays the named strategy")
        void replaysNamedStrategy() {
            when(strategyAgent.findStrategy("scripted"))
                    .thenReturn(Optional.of(new ScriptedStrategy(Map.of(4, entry(SignalAction.LONG, "95")))));
            when(marketDataSource.getBars(List.of("AAPL"), 365))
                    .thenReturn(Map.of("AAPL", TestBars.closes(CLOSES)));

            BacktestResult result = backtester.backtest("scripted", "AAPL", 365);

            assertThat(result.getStrategy()).isEqualTo("scripted");
            assertThat(result.getSymbol()).isEqualTo("AAPL");
            assertThat(result.isPositionOpenAtEnd()).isTrue();
        }
    }

    /** Emits a scripted output keyed by the length of the history it is shown; HOLD otherwise. */
    private static final class ScriptedStrategy implements Strategy {

        private final Map<Integer, StrategyOutput> script;
        private final List<Integer> seenSizes = new ArrayList<>();
        private final List<BigDecimal> lastSeenCloses = new ArrayList<>();

        ScriptedStrategy(Map<Integer, StrategyOutput> script) {
            this.script = new HashMap<>(script);
        }

        @Override
        public String getName() {
            return "scripted";
        }

        @Override
        public int requiredBars() {
            return 3;
        }

        @Override
        public StrategyOutput generateSignal(String symbol, List<Bar> bars) {
            seenSizes.add(bars.size());
            lastSeenCloses.add(bars.get(bars.size() - 1).getClose());
            return script.getOrDefault(bars.size(), StrategyOutput.hold("scripted", "scripted hold"));
        }
    }
}
