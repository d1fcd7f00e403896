package com.tradingagent.risk;

import com.tradingagent.domain.enums.ExitType;
import com.tradingagent.domain.enums.TradeAction;
import com.tradingagent.domain.model.CombinedSignal;
import com.tradingagent.domain.model.ExitDecision;
import com.tradingagent.domain.model.MarketRegime;
import com.tradingagent.domain.model.Position;
import com.tradingagent.domain.model.PositionSizing;
import com.tradingagent.domain.model.RiskState;
import com.tradingagent.domain.model.RiskSummary;
import com.tradingagent.domain.model.Trade;
import com.tradingagent.domain.model.TradeValidation;
import com.tradingagent.event.RiskEvent;
import com.tradingagent.event.RiskEventType;
import com.tradingagent.event.RiskLevel;
import com.tradingagent.store.PositionStore;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Portfolio risk gate: pre-trade validation, exit decisions and the daily loss circuit breaker.
 *
 * <p>Pre-trade validation is an ordered, fail-fast checklist. The first failing check rejects the
 * trade and names itself in the reason; the checks passed so far are returned alongside:
 * <ol>
 *   <li>daily P&L at or above {@code -(portfolioValue * dailyLossLimit)}</li>
 *   <li>fewer open positions than {@code maxPositions}</li>
 *   <li>no position already open in the symbol</li>
 *   <li>signal confidence at least {@code minConfidence}</li>
 *   <li>risk-based sizing approves</li>
 *   <li>position value within {@code capitalUsageLimit} of the portfolio</li>
 * </ol>
 *
 * <p>Entries whose fill is still unconfirmed count as open for checks 2 and 3.
 *
 * <p>Validation mutates nothing. Realised P&L is fed back through {@link #recordRealisedPnl} after
 * each close.
 */
@Service
public class RiskManager {

    private static final Logger log = LoggerFactory.getLogger(RiskManager.class);

    public static final String CHECK_DAILY_LOSS = "daily_loss_limit_ok";
    public static final String CHECK_POSITION_LIMIT = "position_limit_ok";
    public static final String CHECK_NO_DUPLICATE = "no_duplicate_position";
    public static final String CHECK_CONFIDENCE = "confidence_ok";
    public static final String CHECK_POSITION_SIZE = "position_size_ok";
    public static final String CHECK_CAPITAL = "capital_sufficient";

    private final RiskProperties riskProperties;
    private final RiskBasedPositionSizer positionSizer;
    private final DailyRiskTracker dailyRiskTracker;
    private final PositionStore positionStore;
    private final ApplicationEventPublisher applicationEventPublisher;

    public RiskManager(
            RiskProperties riskProperties,
            RiskBasedPositionSizer positionSizer,
            DailyRiskTracker dailyRiskTracker,
            PositionStore positionStore,
            ApplicationEventPublisher applicationEventPublisher) {
        this.riskProperties = riskProperties;
        this.positionSizer = positionSizer;
        this.dailyRiskTracker = dailyRiskTracker;
        this.positionStore = positionStore;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ==============================
    // POSITION SIZING
    // ==============================

    public PositionSizing calculatePositionSize(BigDecimal entryPrice, BigDecimal stopLoss, boolean highVolatility) {
        return positionSizer.size(entryPrice, stopLoss, dailyRiskTracker.getPortfolioValue(), highVolatility);
    }

    // ==============================
    // PRE-TRADE VALIDATION
    // ==============================

    public TradeValidation validateTrade(CombinedSignal signal, MarketRegime regime) {
        RiskState state = dailyRiskTracker.snapshot();
        BigDecimal portfolioValue = state.getPortfolioValue();
        List<String> passed = new ArrayList<>();

        // 1. Daily loss circuit breaker
        BigDecimal lossLimit = dailyLossLimit(portfolioValue);
        if (state.getDailyPnl().compareTo(lossLimit.negate()) < 0) {
            return reject(
                    signal,
                    String.format("Daily loss limit reached: P&L %s below -%s", state.getDailyPnl(), lossLimit),
                    passed,
                    null);
        }
        passed.add(CHECK_DAILY_LOSS);

        // 2. Max open positions
        Set<String> openSymbols = openSymbols();
        if (openSymbols.size() >= riskProperties.getMaxPositions()) {
            return reject(
                    signal,
                    String.format(
                            "Max positions reached (%d/%d)", openSymbols.size(), riskProperties.getMaxPositions()),
                    passed,
                    null);
        }
        passed.add(CHECK_POSITION_LIMIT);

        // 3. No pyramiding
        if (openSymbols.contains(signal.getSymbol())) {
            return reject(signal, "Position already open in " + signal.getSymbol(), passed, null);
        }
        passed.add(CHECK_NO_DUPLICATE);

        // 4. Confidence floor
        if (signal.getConfidence() < riskProperties.getMinConfidence()) {
            return reject(
                    signal,
                    String.format(
                            "Confidence %.2f below minimum %.2f",
                            signal.getConfidence(), riskProperties.getMinConfidence()),
                    passed,
                    null);
        }
        passed.add(CHECK_CONFIDENCE);

        // 5. Sizing
        boolean highVolatility = regime != null && regime.isHighVolatility();
        PositionSizing sizing =
                positionSizer.size(signal.getEntryPrice(), signal.getStopLoss(), portfolioValue, highVolatility);
        if (!sizing.isApproved()) {
            return reject(signal, sizing.getReason(), passed, sizing);
        }
        passed.add(CHECK_POSITION_SIZE);

        // 6. Capital sufficiency
        BigDecimal capitalLimit = portfolioValue.multiply(riskProperties.getCapitalUsageLimit());
        if (sizing.getPositionValue().compareTo(capitalLimit) > 0) {
            return reject(
                    signal,
                    String.format(
                            "Insufficient capital: position %s exceeds %s", sizing.getPositionValue(), capitalLimit),
                    passed,
                    sizing);
        }
        passed.add(CHECK_CAPITAL);

        log.info(
                "Trade approved: {} {} x{} (value {}, risk {})",
                signal.getAction(),
                signal.getSymbol(),
                sizing.getQuantity(),
                sizing.getPositionValue(),
                sizing.getRiskAmount());
        return TradeValidation.approved(passed, sizing);
    }

    // ==============================
    // EXIT DECISIONS
    // ==============================

    /**
     * Decides whether to close {@code position} at {@code currentPrice}. The stop is checked first and
     * wins regardless of the signal; then an explicit CLOSE; then a signal opposite to the held side.
     * Pure: depends only on its arguments.
     *
     * @param signal fresh combined signal for the symbol, may be null
     */
    public ExitDecision evaluateExit(Position position, BigDecimal currentPrice, CombinedSignal signal) {
        String symbol = position.getSymbol();
        BigDecimal stop = position.getStopLoss();
        if (stop != null) {
            boolean breached =
                    position.isLong() ? currentPrice.compareTo(stop) <= 0 : currentPrice.compareTo(stop) >= 0;
            if (breached) {
                return ExitDecision.close(
                        symbol,
                        currentPrice,
                        ExitType.STOP_LOSS,
                        String.format("Stop loss hit: price %s vs stop %s", currentPrice, stop));
            }
        }

        if (signal != null) {
            if (signal.getAction() == TradeAction.CLOSE) {
                return ExitDecision.close(
                        symbol, currentPrice, ExitType.SIGNAL, "Close signal: " + signal.getReasoning());
            }
            boolean opposite = position.isLong()
                    ? signal.getAction() == TradeAction.SELL
                    : signal.getAction() == TradeAction.BUY;
            if (opposite) {
                return ExitDecision.close(
                        symbol, currentPrice, ExitType.SIGNAL, "Opposite signal: " + signal.getReasoning());
            }
        }
        return ExitDecision.hold(symbol, currentPrice, "No exit condition met");
    }

    // ==============================
    // DAILY P&L
    // ==============================

    public void recordRealisedPnl(BigDecimal pnl) {
        BigDecimal total = dailyRiskTracker.recordRealisedPnl(pnl);
        BigDecimal limit = dailyLossLimit(dailyRiskTracker.getPortfolioValue());
        if (total.compareTo(limit.negate()) < 0) {
            log.warn("Daily loss limit breached: P&L {} below -{}. New entries blocked until reset.", total, limit);
            applicationEventPublisher.publishEvent(new RiskEvent(
                    this,
                    RiskEventType.DAILY_LOSS_LIMIT_BREACH,
                    RiskLevel.CRITICAL,
                    "Daily loss limit breached: " + total,
                    Map.of("dailyPnl", total, "limit", limit.negate())));
        }
    }

    public boolean isDailyLossLimitBreached() {
        RiskState state = dailyRiskTracker.snapshot();
        return state.getDailyPnl().compareTo(dailyLossLimit(state.getPortfolioValue()).negate()) < 0;
    }

    public void resetDaily() {
        dailyRiskTracker.resetDaily();
        applicationEventPublisher.publishEvent(
                new RiskEvent(this, RiskEventType.DAILY_RESET, RiskLevel.INFO, "Daily risk counters reset"));
    }

    public void updatePortfolioValue(BigDecimal value) {
        dailyRiskTracker.updatePortfolioValue(value);
    }

    // ==============================
    // SUMMARY
    // ==============================

    public RiskSummary getRiskSummary() {
        RiskState state = dailyRiskTracker.snapshot();
        BigDecimal portfolioValue = state.getPortfolioValue();
        List<Position> positions = positionStore.getOpenPositions();

        BigDecimal exposure = BigDecimal.ZERO;
        BigDecimal riskAtStop = BigDecimal.ZERO;
        for (Position position : positions) {
            exposure = exposure.add(position.getMarketValue());
            if (position.getStopLoss() != null) {
                BigDecimal mark =
                        position.getCurrentPrice() != null ? position.getCurrentPrice() : position.getEntryPrice();
                riskAtStop = riskAtStop.add(mark.subtract(position.getStopLoss())
                        .abs()
                        .multiply(BigDecimal.valueOf(position.getAbsoluteQuantity())));
            }
        }

        BigDecimal lossLimit = dailyLossLimit(portfolioValue);
        BigDecimal remaining = lossLimit.add(state.getDailyPnl()).max(BigDecimal.ZERO);

        return RiskSummary.builder()
                .tradingDay(state.getTradingDay())
                .portfolioValue(portfolioValue)
                .dailyPnl(state.getDailyPnl())
                .dailyPnlFraction(state.getDailyPnl()
                        .divide(portfolioValue, 6, RoundingMode.HALF_UP)
                        .doubleValue())
                .openPositions(openSymbols().size())
                .maxPositions(riskProperties.getMaxPositions())
                .totalExposure(exposure.setScale(2, RoundingMode.HALF_UP))
                .totalRisk(riskAtStop.setScale(2, RoundingMode.HALF_UP))
                .dailyLossLimit(lossLimit.setScale(2, RoundingMode.HALF_UP))
                .remainingDailyRisk(remaining.setScale(2, RoundingMode.HALF_UP))
                .dailyLossLimitBreached(state.getDailyPnl().compareTo(lossLimit.negate()) < 0)
                .build();
    }

    // ==============================
    // INTERNALS
    // ==============================

    private Set<String> openSymbols() {
        Set<String> symbols = new HashSet<>();
        positionStore.getOpenPositions().forEach(p -> symbols.add(p.getSymbol()));
        positionStore.getOpenTrades().stream().map(Trade::getSymbol).forEach(symbols::add);
        return symbols;
    }

    private BigDecimal dailyLossLimit(BigDecimal portfolioValue) {
        return portfolioValue.multiply(riskProperties.getDailyLossLimit());
    }

    private TradeValidation reject(CombinedSignal signal, String reason, List<String> passed, PositionSizing sizing) {
        log.warn("Trade rejected: {} {} - {}", signal.getAction(), signal.getSymbol(), reason);
        applicationEventPublisher.publishEvent(new RiskEvent(
                this,
                RiskEventType.TRADE_REJECTED,
                RiskLevel.WARNING,
                reason,
                Map.of("symbol", signal.getSymbol(), "reason", reason)));
        return TradeValidation.rejected(reason, passed, sizing);
    }
}
