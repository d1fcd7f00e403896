package com.tradingagent.store;

import com.tradingagent.domain.enums.TradeStatus;
import com.tradingagent.domain.model.Position;
import com.tradingagent.domain.model.Trade;
import com.tradingagent.exception.ResourceNotFoundException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * Process-local {@link PositionStore}. Positions are keyed by symbol, which enforces one position per
 * symbol. Trades are kept in insertion order for reporting.
 */
@Repository
public class InMemoryPositionStore implements PositionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPositionStore.class);

    private final Map<String, Position> positions = new ConcurrentHashMap<>();
    private final Map<String, Trade> trades = new ConcurrentHashMap<>();
    private final List<String> tradeOrder = new ArrayList<>();

    @Override
    public void upsertPosition(Position position) {
        positions.put(position.getSymbol(), position);
    }

    @Override
    public Optional<Position> getPosition(String symbol) {
        return Optional.ofNullable(positions.get(symbol));
    }

    @Override
    public List<Position> getOpenPositions() {
        List<Position> open = new ArrayList<>(positions.values());
        open.sort(Comparator.comparing(Position::getSymbol));
        return open;
    }

    @Override
    public void removePosition(String symbol) {
        positions.remove(symbol);
    }

    @Override
    public synchronized String logTrade(Trade trade) {
        if (trade.getId() == null) {
            trade.setId(UUID.randomUUID().toString());
        }
        trades.put(trade.getId(), trade);
        tradeOrder.add(trade.getId());
        log.debug("Logged trade {} {} {} x{}", trade.getId(), trade.getSide(), trade.getSymbol(), trade.getQuantity());
        return trade.getId();
    }

    @Override
    public void updateTrade(Trade trade) {
        if (!trades.containsKey(trade.getId())) {
            throw new ResourceNotFoundException("Trade", trade.getId());
        }
        trades.put(trade.getId(), trade);
    }

    @Override
    public Optional<Trade> getTrade(String tradeId) {
        return Optional.ofNullable(trades.get(tradeId));
    }

    @Override
    public Trade closeTrade(String tradeId, BigDecimal exitPrice, Instant exitTimestamp) {
        Trade trade = getTrade(tradeId).orElseThrow(() -> new ResourceNotFoundException("Trade", tradeId));
        trade.close(exitPrice, exitTimestamp);
        return trade;
    }

    @Override
    public List<Trade> getOpenTrades() {
        return ordered().stream().filter(Trade::isOpen).toList();
    }

    @Override
    public List<Trade> getClosedTradesSince(Instant since) {
        return ordered().stream()
                .filter(t -> t.getStatus() == TradeStatus.CLOSED)
                .filter(t -> t.getExitTimestamp() != null && !t.getExitTimestamp().isBefore(since))
                .toList();
    }

    @Override
    public List<Trade> getAllTrades() {
        return ordered();
    }

    private synchronized List<Trade> ordered() {
        List<Trade> result = new ArrayList<>(tradeOrder.size());
        for (String id : tradeOrder) {
            result.add(trades.get(id));
        }
        return result;
    }
}
