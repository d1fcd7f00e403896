package com.tradingagent.orchestrator;

import com.tradingagent.analysis.MarketAnalyzer;
import com.tradingagent.config.TradingProperties;
import com.tradingagent.domain.enums.CycleStatus;
import com.tradingagent.domain.enums.TradingMode;
import com.tradingagent.domain.model.AccountSnapshot;
import com.tradingagent.domain.model.Bar;
import com.tradingagent.domain.model.CloseResult;
import com.tradingagent.domain.model.CombinedSignal;
import com.tradingagent.domain.model.CycleDecision;
import com.tradingagent.domain.model.CycleReport;
import com.tradingagent.domain.model.ExecutionResult;
import com.tradingagent.domain.model.ExitDecision;
import com.tradingagent.domain.model.MarketOverview;
import com.tradingagent.domain.model.MarketRegime;
import com.tradingagent.domain.model.Position;
import com.tradingagent.domain.model.PositionManagementReport;
import com.tradingagent.domain.model.ReconciliationResult;
import com.tradingagent.domain.model.TradeValidation;
import com.tradingagent.exception.BrokerException;
import com.tradingagent.exception.MarketDataException;
import com.tradingagent.execution.ExecutionAgent;
import com.tradingagent.marketdata.MarketDataSource;
import com.tradingagent.risk.RiskManager;
import com.tradingagent.strategy.StrategyAgent;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Sequences the pipeline into two independently triggered cycles.
 *
 * <p><b>Trading cycle:</b> reconcile pending orders, fetch bars, analyze the market, rank opportunities,
 * then validate and execute them one at a time. <b>Position management cycle:</b> reconcile, then
 * re-price each open position, ask the strategies again and close where the exit rules say so.
 *
 * <p>Both cycles share one lock: a cycle triggered while another runs is reported as SKIPPED rather than
 * queued. A market data failure aborts the cycle before any state is touched.
 */
@Service
public class TradingOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TradingOrchestrator.class);

    private final TradingProperties tradingProperties;
    private final MarketDataSource marketDataSource;
    private final MarketAnalyzer marketAnalyzer;
    private final StrategyAgent strategyAgent;
    private final RiskManager riskManager;
    private final ExecutionAgent executionAgent;
    private final Clock clock;

    private final ReentrantLock cycleLock = new ReentrantLock();

    public TradingOrchestrator(
            TradingProperties tradingProperties,
            MarketDataSource marketDataSource,
            MarketAnalyzer marketAnalyzer,
            StrategyAgent strategyAgent,
            RiskManager riskManager,
            ExecutionAgent executionAgent,
            Clock clock) {
        this.tradingProperties = tradingProperties;
        this.marketDataSource = marketDataSource;
        this.marketAnalyzer = marketAnalyzer;
        this.strategyAgent = strategyAgent;
        this.riskManager = riskManager;
        this.executionAgent = executionAgent;
        this.clock = clock;
    }

    // ==============================
    // TRADING CYCLE
    // ==============================

    public CycleReport runTradingCycle() {
        Instant startedAt = Instant.now(clock);
        if (!cycleLock.tryLock()) {
            log.warn("Trading cycle skipped: another cycle is running");
            return CycleReport.aborted(CycleStatus.SKIPPED, startedAt, startedAt, "Another cycle is running");
        }
        try {
            log.info("Trading cycle started ({} mode, {} symbols)", executionAgent.getMode(), universe().size());
            int reconciled = reconcile();
            refreshPortfolioValue();

            Map<String, List<Bar>> bars;
            try {
                bars = marketDataSource.getBars(universe(), tradingProperties.getLookbackDays());
            } catch (MarketDataException | CallNotPermittedException e) {
                log.error("Trading cycle aborted: market data unavailable: {}", e.getMessage());
                return CycleReport.aborted(
                        CycleStatus.FAILED,
                        startedAt,
                        Instant.now(clock),
                        "Market data unavailable: " + e.getMessage());
            }

            MarketOverview overview = marketAnalyzer.analyzeMarket(bars);
            List<CombinedSignal> opportunities = strategyAgent.scanUniverse(bars, overview);
            log.info("Market {}: {} opportunities", overview.getSentiment(), opportunities.size());

            List<CycleDecision> decisions = new ArrayList<>();
            int executed = 0;
            for (CombinedSignal signal : opportunities) {
                CycleDecision decision = act(signal, overview.regimeFor(signal.getSymbol()));
                decisions.add(decision);
                if (decision.isExecuted()) {
                    executed++;
                }
            }

            Instant finishedAt = Instant.now(clock);
            log.info(
                    "Trading cycle completed: {} opportunities, {} executed, {} reconciled",
                    opportunities.size(),
                    executed,
                    reconciled);
            return CycleReport.builder()
                    .status(CycleStatus.COMPLETED)
                    .startedAt(startedAt)
                    .finishedAt(finishedAt)
                    .sentiment(overview.getSentiment())
                    .reconciled(reconciled)
                    .opportunities(opportunities.size())
                    .executed(executed)
                    .decisions(List.copyOf(decisions))
                    .message(overview.getRecommendation())
                    .build();
        } finally {
            cycleLock.unlock();
        }
    }

    private CycleDecision act(CombinedSignal signal, MarketRegime regime) {
        CycleDecision.CycleDecisionBuilder decision = CycleDecision.builder()
                .symbol(signal.getSymbol())
                .action(signal.getAction())
                .confidence(signal.getConfidence());

        TradeValidation validation = riskManager.validateTrade(signal, regime);
        if (validation.isRejected()) {
            log.info("Skipping {} {}: {}", signal.getAction(), signal.getSymbol(), validation.getReason());
            return decision.approved(false).executed(false).reason(validation.getReason()).build();
        }

        ExecutionResult result = executionAgent.executeTrade(signal, validation.getSizing());
        return decision.approved(true)
                .executed(result.isSuccess())
                .reason(result.getMessage())
                .tradeId(result.getTrade() != null ? result.getTrade().getId() : null)
                .build();
    }

    // ==============================
    // POSITION MANAGEMENT CYCLE
    // ==============================

    public PositionManagementReport runPositionManagementCycle() {
        Instant startedAt = Instant.now(clock);
        if (!cycleLock.tryLock()) {
            log.warn("Position management skipped: another cycle is running");
            return PositionManagementReport.aborted(
                    CycleStatus.SKIPPED, startedAt, startedAt, "Another cycle is running");
        }
        try {
            ReconciliationResult reconciliation = executionAgent.reconcile();
            BigDecimal realized = recordExits(reconciliation.getExitsConfirmed());
            List<CloseResult> closed = new ArrayList<>(reconciliation.getExitsConfirmed());

            List<Position> positions = executionAgent.getOpenPositions();
            int checked = 0;
            for (Position position : positions) {
                if (position.getPendingExitOrderId() != null) {
                    log.debug(
                            "{} has exit {} pending; skipping", position.getSymbol(), position.getPendingExitOrderId());
                    continue;
                }
                checked++;
                Optional<CloseResult> result;
                try {
                    result = manage(position);
                } catch (MarketDataException | CallNotPermittedException e) {
                    log.error("Position management aborted at {}: {}", position.getSymbol(), e.getMessage());
                    return PositionManagementReport.builder()
                            .status(CycleStatus.FAILED)
                            .startedAt(startedAt)
                            .finishedAt(Instant.now(clock))
                            .reconciled(reconciliation.resolved())
                            .positionsChecked(checked)
                            .closed(List.copyOf(closed))
                            .realizedPnl(realized)
                            .message("Market data unavailable: " + e.getMessage())
                            .build();
                }
                if (result.isPresent()) {
                    closed.add(result.get());
                    if (result.get().getPnl() != null) {
                        riskManager.recordRealisedPnl(result.get().getPnl());
                        realized = realized.add(result.get().getPnl());
                    }
                }
            }

            log.info(
                    "Position management completed: {} checked, {} closed, realized P&L {}",
                    checked,
                    closed.size(),
                    realized);
            return PositionManagementReport.builder()
                    .status(CycleStatus.COMPLETED)
                    .startedAt(startedAt)
                    .finishedAt(Instant.now(clock))
                    .reconciled(reconciliation.resolved())
                    .positionsChecked(checked)
                    .closed(List.copyOf(closed))
                    .realizedPnl(realized)
                    .message(closed.isEmpty() ? "No positions closed" : closed.size() + " positions closed")
                    .build();
        } finally {
            cycleLock.unlock();
        }
    }

    /** Returns the close result when an exit order was placed, empty when the position is held. */
    private Optional<CloseResult> manage(Position position) {
        String symbol = position.getSymbol();
        Optional<BigDecimal> latest = marketDataSource.getLatestPrice(symbol);
        if (latest.isEmpty()) {
            log.warn("No latest price for {}; position left unchanged", symbol);
            return Optional.empty();
        }
        BigDecimal price = latest.get();
        executionAgent.markToMarket(position, price);

        CombinedSignal signal = null;
        List<Bar> bars = marketDataSource
                .getBars(List.of(symbol), tradingProperties.getLookbackDays())
                .getOrDefault(symbol, List.of());
        if (!bars.isEmpty()) {
            MarketRegime regime = marketAnalyzer.analyzeSymbol(symbol, bars);
            signal = strategyAgent.generateSignal(symbol, bars, regime);
        }

        ExitDecision exit = riskManager.evaluateExit(position, price, signal);
        if (!exit.isShouldClose()) {
            log.debug("Holding {} @ {} (unrealized {})", symbol, price, position.getUnrealizedPnl());
            return Optional.empty();
        }
        log.info("Closing {} @ {}: {}", symbol, price, exit.getReason());
        CloseResult result = executionAgent.closePosition(symbol, price, exit.getExitType(), exit.getReason());
        if (!result.isSuccess()) {
            log.warn("Close of {} failed: {}", symbol, result.getMessage());
        }
        return Optional.of(result);
    }

    // ==============================
    // SHARED STEPS
    // ==============================

    public MarketOverview getMarketOverview() {
        return marketAnalyzer.analyzeMarket(
                marketDataSource.getBars(universe(), tradingProperties.getLookbackDays()));
    }

    /** Settles orders left pending by earlier cycles and feeds any confirmed exits into the daily P&L. */
    private int reconcile() {
        ReconciliationResult result = executionAgent.reconcile();
        recordExits(result.getExitsConfirmed());
        return result.resolved();
    }

    private BigDecimal recordExits(List<CloseResult> exits) {
        BigDecimal total = BigDecimal.ZERO;
        for (CloseResult exit : exits) {
            if (exit.getPnl() != null) {
                riskManager.recordRealisedPnl(exit.getPnl());
                total = total.add(exit.getPnl());
            }
        }
        return total;
    }

    private void refreshPortfolioValue() {
        if (executionAgent.getMode() != TradingMode.LIVE) {
            return;
        }
        try {
            AccountSnapshot account = executionAgent.getAccount();
            if (account.getEquity() != null && account.getEquity().signum() > 0) {
                riskManager.updatePortfolioValue(account.getEquity());
            }
        } catch (BrokerException | CallNotPermittedException e) {
            log.warn("Could not refresh portfolio value from account: {}", e.getMessage());
        }
    }

    private List<String> universe() {
        return tradingProperties.getUniverse();
    }
}
