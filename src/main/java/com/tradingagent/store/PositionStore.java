package com.tradingagent.store;

import com.tradingagent.domain.model.Position;
import com.tradingagent.domain.model.Trade;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Book of open positions and the trade log.
 *
 * <p>Invariant: at most one open position per symbol, and every OPEN trade has a position in the same
 * symbol. UNCONFIRMED trades have no position until their entry fill is confirmed.
 */
public interface PositionStore {

    void upsertPosition(Position position);

    Optional<Position> getPosition(String symbol);

    List<Position> getOpenPositions();

    void removePosition(String symbol);

    /** Stores a new trade and returns its id (assigned if the trade has none). */
    String logTrade(Trade trade);

    void updateTrade(Trade trade);

    Optional<Trade> getTrade(String tradeId);

    /**
     * Closes the trade and computes its realised P&L.
     *
     * @throws com.tradingagent.exception.ResourceNotFoundException if no trade has this id
     * @throws com.tradingagent.exception.BusinessException if the trade is already closed
     */
    Trade closeTrade(String tradeId, BigDecimal exitPrice, Instant exitTimestamp);

    /** Trades that are OPEN or UNCONFIRMED. */
    List<Trade> getOpenTrades();

    List<Trade> getClosedTradesSince(Instant since);

    List<Trade> getAllTrades();
}
