package com.tradingagent.unit.orchestrator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.tradingagent.analysis.MarketAnalyzer;
import com.tradingagent.config.TradingProperties;
import com.tradingagent.domain.enums.CycleStatus;
import com.tradingagent.domain.enums.ExitType;
import com.tradingagent.domain.enums.MarketSentiment;
import com.tradingagent.domain.enums.TradeAction;
import com.tradingagent.domain.enums.TradingMode;
import com.tradingagent.domain.model.AccountSnapshot;
import com.tradingagent.domain.model.Bar;
import com.tradingagent.domain.model.CloseResult;
import com.tradingagent.domain.model.CombinedSignal;
import com.tradingagent.domain.model.CycleReport;
import com.tradingagent.domain.model.ExecutionResult;
import com.tradingagent.domain.model.ExitDecision;
import com.tradingagent.domain.model.MarketOverview;
import com.tradingagent.domain.model.MarketRegime;
import com.tradingagent.domain.model.Position;
import com.tradingagent.domain.model.PositionManagementReport;
import com.tradingagent.domain.model.PositionSizing;
import com.tradingagent.domain.model.ReconciliationResult;
import com.tradingagent.domain.model.Trade;
import com.tradingagent.domain.model.TradeValidation;
import com.tradingagent.exception.MarketDataException;
import com.tradingagent.execution.ExecutionAgent;
import com.tradingagent.marketdata.MarketDataSource;
import com.tradingagent.orchestrator.TradingOrchestrator;
import com.tradingagent.risk.RiskManager;
import com.tradingagent.strategy.StrategyAgent;
import com.tradingagent.support.TestBars;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for TradingOrchestrator: step ordering of both cycles, abort on market data failure,
 * feeding realised P&L back into risk, and the shared cycle lock.
 */
@ExtendWith(MockitoExtension.class)
class TradingOrchestratorTest {

    private static final Instant NOW = Instant.parse("2024-06-03T15:00:00Z");
    private static final List<String> UNIVERSE = List.of("AAPL", "MSFT");

    @Mock
    private MarketDataSource marketDataSource;

    @Mock
    private MarketAnalyzer marketAnalyzer;

    @Mock
    private StrategyAgent strategyAgent;

    @Mock
    private RiskManager riskManager;

    @Mock
    private ExecutionAgent executionAgent;

    private TradingOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        TradingProperties tradingProperties = new TradingProperties();
        tradingProperties.setUniverse(UNIVERSE);
        orchestrator = new TradingOrchestrator(
                tradingProperties,
                marketDataSource,
                marketAnalyzer,
                strategyAgent,
                riskManager,
                executionAgent,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static ReconciliationResult nothingToReconcile() {
        return ReconciliationResult.builder().exitsConfirmed(List.of()).build();
    }

    private static CombinedSignal entry(String symbol, TradeAction action, double confidence) {
        return CombinedSignal.builder()
                .symbol(symbol)
                .action(action)
                .confidence(confidence)
                .reasoning("test")
                .entryPrice(new BigDecimal("100"))
                .stopLoss(new BigDecimal(action == TradeAction.BUY ? "98" : "102"))
                .strategyOutputs(List.of())
                .build();
    }

    private static MarketOverview overview(Map<String, MarketRegime> regimes) {
        return MarketOverview.builder()
                .analyzedAt(NOW)
                .regimes(regimes)
                .sentiment(MarketSentiment.NEUTRAL)
                .recommendation("Neutral market. Focus on mean reversion strategies.")
                .build();
    }

    // ==============================
    // TRADING CYCLE
    // ==============================

    @Nested
    @DisplayName("Trading cycle")
    class TradingCycle {

        @Test
        @DisplayName("Validates each opportunity and executes only the approved ones")
        void executesApprovedOpportunities() {
            Map<String, List<Bar>> bars = Map.of("AAPL", TestBars.flat(60, 100), "MSFT", TestBars.flat(60, 100));
            MarketRegime aaplRegime = MarketRegime.builder().symbol("AAPL").build();
            MarketOverview overview = overview(Map.of("AAPL", aaplRegime));
            CombinedSignal buy = entry("AAPL", TradeAction.BUY, 0.8);
            CombinedSignal sell = entry("MSFT", TradeAction.SELL, 0.5);
            PositionSizing sizing = PositionSizing.builder().quantity(20).approved(true).build();

            when(executionAgent.getMode()).thenReturn(TradingMode.SIMULATED);
            when(executionAgent.reconcile()).thenReturn(nothingToReconcile());
            when(marketDataSource.getBars(UNIVERSE, 100)).thenReturn(bars);
            when(marketAnalyzer.analyzeMarket(bars)).thenReturn(overview);
            when(strategyAgent.scanUniverse(bars, overview)).thenReturn(List.of(buy, sell));
            when(riskManager.validateTrade(buy, aaplRegime)).thenReturn(TradeValidation.approved(List.of(), sizing));
            when(riskManager.validateTrade(eq(sell), any()))
                    .thenReturn(TradeValidation.rejected("Position already open in MSFT", List.of(), null));
            when(executionAgent.executeTrade(buy, sizing))
                    .thenReturn(ExecutionResult.builder()
                            .success(true)
                            .symbol("AAPL")
                            .trade(Trade.builder().id("t-1").build())
                            .message("Filled")
                            .build());

            CycleReport report = orchestrator.runTradingCycle();

            assertThat(report.getStatus()).isEqualTo(CycleStatus.COMPLETED);
            assertThat(report.getOpportunities()).isEqualTo(2);
            assertThat(report.getExecuted()).isEqualTo(1);
            assertThat(report.getDecisions()).hasSize(2);
            assertThat(report.getDecisions().get(0).getTradeId()).isEqualTo("t-1");
            assertThat(report.getDecisions().get(1).isApproved()).isFalse();
            assertThat(report.getDecisions().get(1).getReason()).isEqualTo("Position already open in MSFT");
            assertThat(report.getMessage()).isEqualTo(overview.getRecommendation());
            verify(executionAgent, never()).executeTrade(eq(sell), any());
        }

        @Test
        @DisplayName("A market data failure aborts before analysis or trading")
        void marketDataFailureAborts() {
            when(executionAgent.getMode()).thenReturn(TradingMode.SIMULATED);
            when(executionAgent.reconcile()).thenReturn(nothingToReconcile());
            when(marketDataSource.getBars(anyList(), anyInt())).thenThrow(new MarketDataException("timeout"));

            CycleReport report = orchestrator.runTradingCycle();

            assertThat(report.getStatus()).isEqualTo(CycleStatus.FAILED);
            assertThat(report.getMessage()).isEqualTo("Market data unavailable: timeout");
            verifyNoInteractions(marketAnalyzer, strategyAgent);
            verify(riskManager, never()).validateTrade(any(), any());
        }

        @Test
        @DisplayName("Live mode refreshes the portfolio value from account equity")
        void liveModeRefreshesEquity() {
            BigDecimal equity = new BigDecimal("12000.00");
            MarketOverview overview = overview(Map.of());
            when(executionAgent.getMode()).thenReturn(TradingMode.LIVE);
            when(executionAgent.reconcile()).thenReturn(nothingToReconcile());
            when(executionAgent.getAccount())
                    .thenReturn(AccountSnapshot.builder().mode(TradingMode.LIVE).equity(equity).build());
            when(marketDataSource.getBars(UNIVERSE, 100)).thenReturn(Map.of());
            when(marketAnalyzer.analyzeMarket(Map.of())).thenReturn(overview);
            when(strategyAgent.scanUniverse(Map.of(), overview)).thenReturn(List.of());

            CycleReport report = orchestrator.runTradingCycle();

            assertThat(report.getExecuted()).isZero();
            verify(riskManager).updatePortfolioValue(equity);
        }

        @Test
        @DisplayName("Exits confirmed during reconciliation count toward the daily P&L")
        void reconciledExitsRecorded() {
            BigDecimal pnl = new BigDecimal("-50.00");
            when(executionAgent.getMode()).thenReturn(TradingMode.SIMULATED);
            when(executionAgent.reconcile())
                    .thenReturn(ReconciliationResult.builder()
                            .exitsConfirmed(List.of(CloseResult.builder()
                                    .success(true)
                                    .symbol("AAPL")
                                    .pnl(pnl)
                                    .build()))
                            .build());
            when(marketDataSource.getBars(anyList(), anyInt())).thenThrow(new MarketDataException("down"));

            CycleReport report = orchestrator.runTradingCycle();

            assertThat(report.getStatus()).isEqualTo(CycleStatus.FAILED);
            verify(riskManager).recordRealisedPnl(pnl);
        }

        @Test
        @DisplayName("A cycle triggered while another runs is skipped")
        void overlappingCycleSkipped() throws Exception {
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            when(executionAgent.getMode()).thenReturn(TradingMode.SIMULATED);
            when(executionAgent.reconcile()).thenAnswer(invocation -> {
                entered.countDown();
                release.await(5, TimeUnit.SECONDS);
                return nothingToReconcile();
            });
            when(marketDataSource.getBars(anyList(), anyInt())).thenThrow(new MarketDataException("down"));

            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                Future<CycleReport> running = executor.submit(orchestrator::runTradingCycle);
                assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

                PositionManagementReport skipped = orchestrator.runPositionManagementCycle();
                release.countDown();

                assertThat(skipped.getStatus()).isEqualTo(CycleStatus.SKIPPED);
                assertThat(running.get(5, TimeUnit.SECONDS).getStatus()).isEqualTo(CycleStatus.FAILED);
            } finally {
                executor.shutdownNow();
            }
        }
    }

    // ==============================
    // POSITION MANAGEMENT CYCLE
    // ==============================

    @Nested
    @DisplayName("Position management cycle")
    class PositionManagement {

        private Position aapl;

        @BeforeEach
        void setUp() {
            aapl = Position.builder()
                    .symbol("AAPL")
                    .quantity(10)
                    .entryPrice(new BigDecimal("100"))
                    .stopLoss(new BigDecimal("95"))
                    .tradeId("t-1")
                    .build();
        }

        @Test
        @DisplayName("Re-prices, re-evaluates and closes a position whose stop is hit")
        void closesStoppedPosition() {
            Position pendingExit = Position.builder()
                    .symbol("MSFT")
                    .quantity(5)
                    .entryPrice(new BigDecimal("400"))
                    .pendingExitOrderId("EXIT-9")
                    .build();
            BigDecimal price = new BigDecimal("94");
            BigDecimal pnl = new BigDecimal("-60.00");
            List<Bar> bars = TestBars.flat(60, 94);
            MarketRegime regime = MarketRegime.builder().symbol("AAPL").build();
            CombinedSignal hold = CombinedSignal.hold("AAPL", "No clear consensus from strategies", List.of());
            ExitDecision stop = ExitDecision.close("AAPL", price, ExitType.STOP_LOSS, "Stop loss hit");

            when(executionAgent.reconcile()).thenReturn(nothingToReconcile());
            when(executionAgent.getOpenPositions()).thenReturn(List.of(aapl, pendingExit));
            when(marketDataSource.getLatestPrice("AAPL")).thenReturn(Optional.of(price));
            when(marketDataSource.getBars(List.of("AAPL"), 100)).thenReturn(Map.of("AAPL", bars));
            when(marketAnalyzer.analyzeSymbol("AAPL", bars)).thenReturn(regime);
            when(strategyAgent.generateSignal("AAPL", bars, regime)).thenReturn(hold);
            when(riskManager.evaluateExit(aapl, price, hold)).thenReturn(stop);
            when(executionAgent.closePosition("AAPL", price, ExitType.STOP_LOSS, "Stop loss hit"))
                    .thenReturn(CloseResult.builder()
                            .success(true)
                            .symbol("AAPL")
                            .pnl(pnl)
                            .build());

            PositionManagementReport report = orchestrator.runPositionManagementCycle();

            assertThat(report.getStatus()).isEqualTo(CycleStatus.COMPLETED);
            assertThat(report.getPositionsChecked()).isEqualTo(1);
            assertThat(report.getClosed()).hasSize(1);
            assertThat(report.getRealizedPnl()).isEqualByComparingTo("-60.00");
            assertThat(report.getMessage()).isEqualTo("1 positions closed");
            verify(executionAgent).markToMarket(aapl, price);
            verify(riskManager).recordRealisedPnl(pnl);
            verify(marketDataSource, never()).getLatestPrice("MSFT");
        }

        @Test
        @DisplayName("Positions without a latest price are left unchanged")
        void noLatestPrice() {
            when(executionAgent.reconcile()).thenReturn(nothingToReconcile());
            when(executionAgent.getOpenPositions()).thenReturn(List.of(aapl));
            when(marketDataSource.getLatestPrice("AAPL")).thenReturn(Optional.empty());

            PositionManagementReport report = orchestrator.runPositionManagementCycle();

            assertThat(report.getClosed()).isEmpty();
            assertThat(report.getMessage()).isEqualTo("No positions closed");
            verify(riskManager, never()).evaluateExit(any(), any(), any());
        }

        @Test
        @DisplayName("Without bars the exit is decided on the stop alone")
        void noBarsStillChecksStop() {
            BigDecimal price = new BigDecimal("101");
            when(executionAgent.reconcile()).thenReturn(nothingToReconcile());
            when(executionAgent.getOpenPositions()).thenReturn(List.of(aapl));
            when(marketDataSource.getLatestPrice("AAPL")).thenReturn(Optional.of(price));
            when(marketDataSource.getBars(List.of("AAPL"), 100)).thenReturn(Map.of());
            when(riskManager.evaluateExit(aapl, price, null))
                    .thenReturn(ExitDecision.hold("AAPL", price, "No exit condition met"));

            PositionManagementReport report = orchestrator.runPositionManagementCycle();

            assertThat(report.getPositionsChecked()).isEqualTo(1);
            assertThat(report.getClosed()).isEmpty();
            verifyNoInteractions(strategyAgent);
        }

        @Test
        @DisplayName("A market data failure aborts the cycle as FAILED")
        void marketDataFailure() {
            when(executionAgent.reconcile()).thenReturn(nothingToReconcile());
            when(executionAgent.getOpenPositions()).thenReturn(List.of(aapl));
            when(marketDataSource.getLatestPrice("AAPL")).thenThrow(new MarketDataException("down"));

            PositionManagementReport report = orchestrator.runPositionManagementCycle();

            assertThat(report.getStatus()).isEqualTo(CycleStatus.FAILED);
            verify(executionAgent, never()).closePosition(any(), any(), any(), any());
        }
    }

    // ==============================
    // MARKET OVERVIEW
    // ==============================

    @Test
    @DisplayName("Market overview analyzes the configured universe")
    void marketOverview() {
        Map<String, List<Bar>> bars = Map.of("AAPL", TestBars.flat(30, 100));
        MarketOverview overview = overview(Map.of());
        when(marketDataSource.getBars(UNIVERSE, 100)).thenReturn(bars);
        when(marketAnalyzer.analyzeMarket(bars)).thenReturn(overview);

        assertThat(orchestrator.getMarketOverview()).isSameAs(overview);
    }
}
