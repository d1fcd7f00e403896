package com.tradingagent.execution;

import com.tradingagent.domain.enums.ExitType;
import com.tradingagent.domain.enums.OrderSide;
import com.tradingagent.domain.enums.OrderType;
import com.tradingagent.domain.enums.SignalAction;
import com.tradingagent.domain.enums.TradeAction;
import com.tradingagent.domain.enums.TradeStatus;
import com.tradingagent.domain.enums.TradingMode;
import com.tradingagent.domain.model.AccountSnapshot;
import com.tradingagent.domain.model.CloseResult;
import com.tradingagent.domain.model.CombinedSignal;
import com.tradingagent.domain.model.ExecutionResult;
import com.tradingagent.domain.model.OrderAck;
import com.tradingagent.domain.model.OrderRequest;
import com.tradingagent.domain.model.OrderState;
import com.tradingagent.domain.model.Position;
import com.tradingagent.domain.model.PositionSizing;
import com.tradingagent.domain.model.ReconciliationResult;
import com.tradingagent.domain.model.StrategyOutput;
import com.tradingagent.domain.model.Trade;
import com.tradingagent.event.PositionEvent;
import com.tradingagent.event.PositionEventType;
import com.tradingagent.exception.BrokerException;
import com.tradingagent.exception.ResourceNotFoundException;
import com.tradingagent.store.PositionStore;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Turns approved signals into orders and keeps the position/trade book in step with the venue.
 *
 * <p>Bookkeeping only follows a confirmed fill. A venue failure leaves the book untouched and is
 * reported in the result. An order still working after fill polling is recorded as pending:
 * <ul>
 *   <li>entry: a {@link TradeStatus#UNCONFIRMED} trade without a position</li>
 *   <li>exit: the position keeps its trade open and remembers the exit order id</li>
 * </ul>
 * {@link #reconcile()} settles both on a later cycle.
 *
 * <p>An order that ends cancelled, expired or rejected after a partial fill is booked for the filled
 * shares only: a partial entry opens a smaller position, a partial exit closes part of the position
 * and leaves the rest open.
 */
@Service
public class ExecutionAgent {

    private static final Logger log = LoggerFactory.getLogger(ExecutionAgent.class);

    private final ExecutionVenue venue;
    private final OrderFillPoller fillPoller;
    private final PositionStore positionStore;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public ExecutionAgent(
            ExecutionVenue venue,
            OrderFillPoller fillPoller,
            PositionStore positionStore,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.venue = venue;
        this.fillPoller = fillPoller;
        this.positionStore = positionStore;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    public TradingMode getMode() {
        return venue.getMode();
    }

    // ==============================
    // ENTRIES
    // ==============================

    /** Places a market order for an approved BUY/SELL signal and books the fill. */
    public ExecutionResult executeTrade(CombinedSignal signal, PositionSizing sizing) {
        String symbol = signal.getSymbol();
        if (!signal.isEntry()) {
            return ExecutionResult.failure(symbol, "Not an entry signal: " + signal.getAction());
        }
        if (sizing == null || !sizing.isApproved() || sizing.getQuantity() <= 0) {
            return ExecutionResult.failure(symbol, "No approved position size");
        }
        OrderSide side = signal.getAction() == TradeAction.BUY ? OrderSide.BUY : OrderSide.SELL;

        OrderAck ack;
        OrderState state;
        try {
            ack = venue.placeOrder(OrderRequest.builder()
                    .symbol(symbol)
                    .side(side)
                    .quantity(sizing.getQuantity())
                    .type(OrderType.MARKET)
                    .referencePrice(signal.getEntryPrice())
                    .build());
        } catch (BrokerException | CallNotPermittedException e) {
            log.error("Entry order failed for {} {} x{}: {}", side, symbol, sizing.getQuantity(), e.getMessage());
            return ExecutionResult.failure(symbol, "Order failed: " + e.getMessage());
        }

        Trade trade = Trade.builder()
                .symbol(symbol)
                .side(side)
                .quantity(sizing.getQuantity())
                .entryPrice(signal.getEntryPrice())
                .stopLoss(signal.getStopLoss())
                .targetPrice(signal.getTargetPrice())
                .strategy(strategyLabel(signal))
                .confidence(signal.getConfidence())
                .entryOrderId(ack.getOrderId())
                .entryTimestamp(Instant.now(clock))
                .build();

        try {
            state = fillPoller.awaitFill(venue, ack.getOrderId());
        } catch (BrokerException | CallNotPermittedException e) {
            log.warn("Could not confirm fill of {} for {}: {}", ack.getOrderId(), symbol, e.getMessage());
            return bookUnconfirmed(trade);
        }

        if (state.isFilled()) {
            Position position = bookEntryFill(trade, state);
            return ExecutionResult.builder()
                    .success(true)
                    .symbol(symbol)
                    .orderId(ack.getOrderId())
                    .trade(trade)
                    .position(position)
                    .message("Filled")
                    .build();
        }
        if (state.getStatus().isTerminal()) {
            if (state.getFilledQuantity() > 0) {
                log.warn(
                        "Entry order {} for {} ended {} after filling {} of {}",
                        ack.getOrderId(),
                        symbol,
                        state.getStatus(),
                        state.getFilledQuantity(),
                        sizing.getQuantity());
                Position position = bookEntryFill(trade, state);
                return ExecutionResult.builder()
                        .success(true)
                        .symbol(symbol)
                        .orderId(ack.getOrderId())
                        .trade(trade)
                        .position(position)
                        .message(String.format(
                                "Partially filled %d of %d before %s",
                                state.getFilledQuantity(),
                                sizing.getQuantity(),
                                state.getStatus()))
                        .build();
            }
            log.warn("Entry order {} for {} ended {} without a fill", ack.getOrderId(), symbol, state.getStatus());
            return ExecutionResult.failure(symbol, "Order " + state.getStatus() + " without fill");
        }
        return bookUnconfirmed(trade);
    }

    // ==============================
    // EXITS
    // ==============================

    /**
     * Flattens the position in {@code symbol} with an opposite-side market order and realises P&L.
     *
     * @param referencePrice price the exit decision was made at; the simulated venue fills at it
     */
    public CloseResult closePosition(String symbol, BigDecimal referencePrice, ExitType exitType, String reason) {
        Optional<Position> found = positionStore.getPosition(symbol);
        if (found.isEmpty()) {
            return CloseResult.failure(symbol, "No open position for " + symbol);
        }
        Position position = found.get();
        if (position.getPendingExitOrderId() != null) {
            return CloseResult.failure(symbol, "Exit order " + position.getPendingExitOrderId() + " already pending");
        }

        OrderSide exitSide = position.getSide().opposite();
        OrderAck ack;
        try {
            ack = venue.placeOrder(OrderRequest.builder()
                    .symbol(symbol)
                    .side(exitSide)
                    .quantity(position.getAbsoluteQuantity())
                    .type(OrderType.MARKET)
                    .referencePrice(referencePrice)
                    .build());
        } catch (BrokerException | CallNotPermittedException e) {
            log.error("Exit order failed for {}: {}", symbol, e.getMessage());
            return CloseResult.failure(symbol, "Exit order failed: " + e.getMessage());
        }

        OrderState state;
        try {
            state = fillPoller.awaitFill(venue, ack.getOrderId());
        } catch (BrokerException | CallNotPermittedException e) {
            log.warn("Could not confirm exit fill {} for {}: {}", ack.getOrderId(), symbol, e.getMessage());
            return markExitPending(position, ack.getOrderId(), exitType, reason);
        }

        if (state.isFilled()) {
            return bookExitFill(position, state, ack.getOrderId(), exitType, reason);
        }
        if (state.getStatus().isTerminal()) {
            if (state.getFilledQuantity() > 0) {
                return bookPartialExit(position, state, ack.getOrderId(), exitType, reason);
            }
            log.warn("Exit order {} for {} ended {} without a fill", ack.getOrderId(), symbol, state.getStatus());
            return CloseResult.failure(symbol, "Exit order " + state.getStatus() + " without fill");
        }
        return markExitPending(position, ack.getOrderId(), exitType, reason);
    }

    // ==============================
    // RECONCILIATION
    // ==============================

    /**
     * Resolves orders left pending by earlier cycles: confirms or cancels unconfirmed entries and
     * completes or abandons pending exits. A venue error on one order leaves it pending and moves on.
     */
    public ReconciliationResult reconcile() {
        int confirmed = 0;
        int cancelled = 0;
        int abandoned = 0;
        int pending = 0;
        List<CloseResult> exits = new ArrayList<>();

        for (Trade trade : positionStore.getOpenTrades()) {
            if (trade.getStatus() != TradeStatus.UNCONFIRMED) {
                continue;
            }
            try {
                OrderState state = venue.getOrder(trade.getEntryOrderId());
                if (state.isFilled()) {
                    bookEntryFill(trade, state);
                    confirmed++;
                } else if (state.getStatus().isTerminal() && state.getFilledQuantity() > 0) {
                    log.warn(
                            "Unconfirmed entry {} for {} ended {} after filling {} of {}",
                            trade.getEntryOrderId(),
                            trade.getSymbol(),
                            state.getStatus(),
                            state.getFilledQuantity(),
                            trade.getQuantity());
                    bookEntryFill(trade, state);
                    confirmed++;
                } else if (state.getStatus().isTerminal()) {
                    trade.setStatus(TradeStatus.CANCELLED);
                    positionStore.updateTrade(trade);
                    log.warn(
                            "Unconfirmed entry {} for {} ended {}",
                            trade.getEntryOrderId(),
                            trade.getSymbol(),
                            state.getStatus());
                    cancelled++;
                } else {
                    pending++;
                }
            } catch (BrokerException | CallNotPermittedException e) {
                log.warn("Reconciliation of entry {} failed: {}", trade.getEntryOrderId(), e.getMessage());
                pending++;
            }
        }

        for (Position position : positionStore.getOpenPositions()) {
            String exitOrderId = position.getPendingExitOrderId();
            if (exitOrderId == null) {
                continue;
            }
            try {
                OrderState state = venue.getOrder(exitOrderId);
                ExitType exitType = position.getPendingExitType();
                String reason = position.getPendingExitReason();
                if (state.isFilled()) {
                    exits.add(bookExitFill(position, state, exitOrderId, exitType, reason));
                } else if (state.getStatus().isTerminal() && state.getFilledQuantity() > 0) {
                    exits.add(bookPartialExit(position, state, exitOrderId, exitType, reason));
                } else if (state.getStatus().isTerminal()) {
                    clearPendingExit(position);
                    positionStore.upsertPosition(position);
                    log.warn(
                            "Pending exit {} for {} ended {}; position stays open",
                            exitOrderId,
                            position.getSymbol(),
                            state.getStatus());
                    abandoned++;
                } else {
                    pending++;
                }
            } catch (BrokerException | CallNotPermittedException e) {
                log.warn("Reconciliation of exit {} failed: {}", exitOrderId, e.getMessage());
                pending++;
            }
        }

        ReconciliationResult result = ReconciliationResult.builder()
                .entriesConfirmed(confirmed)
                .entriesCancelled(cancelled)
                .exitsConfirmed(exits)
                .exitsAbandoned(abandoned)
                .stillPending(pending)
                .build();
        if (result.resolved() > 0 || pending > 0) {
            log.info(
                    "Reconciliation: {} entries confirmed, {} cancelled, {} exits confirmed, {} abandoned, {} pending",
                    confirmed,
                    cancelled,
                    exits.size(),
                    abandoned,
                    pending);
        }
        return result;
    }

    // ==============================
    // ACCOUNT
    // ==============================

    public AccountSnapshot getAccount() {
        return venue.getAccount();
    }

    public int cancelAllOrders() {
        int count = venue.cancelAllOrders();
        log.info("Cancel all orders ({}): {} cancelled", venue.getMode(), count);
        return count;
    }

    /** Re-prices an open position and persists its unrealized P&L. */
    public void markToMarket(Position position, BigDecimal price) {
        position.markToMarket(price, Instant.now(clock));
        positionStore.upsertPosition(position);
    }

    public List<Position> getOpenPositions() {
        return positionStore.getOpenPositions();
    }

    public List<Trade> getTrades() {
        return positionStore.getAllTrades();
    }

    // ==============================
    // BOOKKEEPING
    // ==============================

    private Position bookEntryFill(Trade trade, OrderState fill) {
        if (fill.getFilledPrice() != null) {
            trade.setEntryPrice(fill.getFilledPrice());
        }
        if (fill.getFilledQuantity() > 0) {
            trade.setQuantity(fill.getFilledQuantity());
        }
        trade.setStatus(TradeStatus.OPEN);
        Instant filledAt = fill.getFilledAt() != null ? fill.getFilledAt() : Instant.now(clock);
        trade.setEntryTimestamp(filledAt);
        if (trade.getId() == null) {
            positionStore.logTrade(trade);
        } else {
            positionStore.updateTrade(trade);
        }

        int signed = trade.getSide() == OrderSide.BUY ? trade.getQuantity() : -trade.getQuantity();
        Position position = Position.builder()
                .symbol(trade.getSymbol())
                .quantity(signed)
                .entryPrice(trade.getEntryPrice())
                .stopLoss(trade.getStopLoss())
                .targetPrice(trade.getTargetPrice())
                .strategy(trade.getStrategy())
                .tradeId(trade.getId())
                .entryTimestamp(filledAt)
                .build();
        position.markToMarket(trade.getEntryPrice(), filledAt);
        positionStore.upsertPosition(position);

        log.info(
                "Opened {} {} x{} @ {} (trade {}, stop {})",
                trade.getSide(),
                trade.getSymbol(),
                trade.getQuantity(),
                trade.getEntryPrice(),
                trade.getId(),
                trade.getStopLoss());
        applicationEventPublisher.publishEvent(new PositionEvent(this, position, trade, PositionEventType.OPENED));
        return position;
    }

    private ExecutionResult bookUnconfirmed(Trade trade) {
        trade.setStatus(TradeStatus.UNCONFIRMED);
        positionStore.logTrade(trade);
        log.warn("Entry {} for {} unconfirmed; will reconcile next cycle", trade.getEntryOrderId(), trade.getSymbol());
        return ExecutionResult.builder()
                .success(true)
                .symbol(trade.getSymbol())
                .orderId(trade.getEntryOrderId())
                .trade(trade)
                .message("Order accepted, fill unconfirmed")
                .build();
    }

    private CloseResult bookExitFill(
            Position position, OrderState fill, String orderId, ExitType exitType, String reason) {
        BigDecimal exitPrice = exitPrice(position, fill);
        Instant exitAt = fill.getFilledAt() != null ? fill.getFilledAt() : Instant.now(clock);

        Trade trade = positionStore.closeTrade(position.getTradeId(), exitPrice, exitAt);
        trade.setExitOrderId(orderId);
        trade.setExitType(exitType);
        trade.setExitReason(reason);
        clearPendingExit(position);
        positionStore.removePosition(position.getSymbol());

        log.info(
                "Closed {} x{} @ {} -> P&L {} ({}%) [{}]",
                position.getSymbol(),
                position.getQuantity(),
                exitPrice,
                trade.getPnl(),
                trade.getPnlPercent(),
                trade.getExitReason());
        applicationEventPublisher.publishEvent(new PositionEvent(this, position, trade, PositionEventType.CLOSED));

        return CloseResult.builder()
                .success(true)
                .symbol(position.getSymbol())
                .orderId(orderId)
                .exitPrice(exitPrice)
                .pnl(trade.getPnl())
                .pnlPercent(trade.getPnlPercent())
                .trade(trade)
                .message("Closed")
                .build();
    }

    /**
     * Books an exit order that ended after filling only part of the position. The filled shares are split
     * off into their own closed trade; the original trade and the position keep the remainder.
     */
    private CloseResult bookPartialExit(
            Position position, OrderState fill, String orderId, ExitType exitType, String reason) {
        int held = position.getAbsoluteQuantity();
        int filled = fill.getFilledQuantity();
        if (filled >= held) {
            return bookExitFill(position, fill, orderId, exitType, reason);
        }
        BigDecimal exitPrice = exitPrice(position, fill);
        Instant exitAt = fill.getFilledAt() != null ? fill.getFilledAt() : Instant.now(clock);

        Trade remaining = positionStore
                .getTrade(position.getTradeId())
                .orElseThrow(() -> new ResourceNotFoundException("Trade", position.getTradeId()));
        remaining.setQuantity(held - filled);
        positionStore.updateTrade(remaining);

        Trade closedPart = Trade.builder()
                .symbol(remaining.getSymbol())
                .side(remaining.getSide())
                .quantity(filled)
                .entryPrice(remaining.getEntryPrice())
                .stopLoss(remaining.getStopLoss())
                .targetPrice(remaining.getTargetPrice())
                .strategy(remaining.getStrategy())
                .confidence(remaining.getConfidence())
                .status(TradeStatus.OPEN)
                .entryOrderId(remaining.getEntryOrderId())
                .entryTimestamp(remaining.getEntryTimestamp())
                .exitOrderId(orderId)
                .exitType(exitType)
                .exitReason(reason)
                .build();
        positionStore.logTrade(closedPart);
        Trade closed = positionStore.closeTrade(closedPart.getId(), exitPrice, exitAt);

        position.setQuantity(position.isLong() ? held - filled : -(held - filled));
        clearPendingExit(position);
        position.markToMarket(exitPrice, exitAt);
        positionStore.upsertPosition(position);

        log.warn(
                "Exit order {} for {} ended {} after filling {} of {}; {} remain open, P&L {}",
                orderId,
                position.getSymbol(),
                fill.getStatus(),
                filled,
                held,
                held - filled,
                closed.getPnl());
        applicationEventPublisher.publishEvent(new PositionEvent(this, position, closed, PositionEventType.REDUCED));

        return CloseResult.builder()
                .success(true)
                .symbol(position.getSymbol())
                .orderId(orderId)
                .exitPrice(exitPrice)
                .pnl(closed.getPnl())
                .pnlPercent(closed.getPnlPercent())
                .trade(closed)
                .message(String.format(
                        "Partially closed %d of %d before %s; %d remain open",
                        filled, held, fill.getStatus(), held - filled))
                .build();
    }

    private static BigDecimal exitPrice(Position position, OrderState fill) {
        return fill.getFilledPrice() != null ? fill.getFilledPrice() : position.getCurrentPrice();
    }

    private static void clearPendingExit(Position position) {
        position.setPendingExitOrderId(null);
        position.setPendingExitType(null);
        position.setPendingExitReason(null);
    }

    private CloseResult markExitPending(Position position, String orderId, ExitType exitType, String reason) {
        position.setPendingExitOrderId(orderId);
        position.setPendingExitType(exitType);
        position.setPendingExitReason(reason);
        positionStore.upsertPosition(position);
        log.warn("Exit {} for {} unconfirmed; will reconcile next cycle", orderId, position.getSymbol());
        return CloseResult.builder()
                .success(true)
                .pending(true)
                .symbol(position.getSymbol())
                .orderId(orderId)
                .message("Exit order accepted, fill unconfirmed")
                .build();
    }

    private static String strategyLabel(CombinedSignal signal) {
        if (signal.getStrategyOutputs() == null) {
            return "combined";
        }
        SignalAction agreeing = signal.getAction() == TradeAction.BUY ? SignalAction.LONG : SignalAction.SHORT;
        List<String> names = signal.getStrategyOutputs().stream()
                .filter(o -> o.getAction() == agreeing)
                .map(StrategyOutput::getStrategyName)
                .toList();
        return names.isEmpty() ? "combined" : String.join("+", names);
    }
}
