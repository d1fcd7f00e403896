package com.tradingagent.execution;

import com.tradingagent.domain.enums.OrderSide;
import com.tradingagent.domain.enums.OrderStatus;
import com.tradingagent.domain.enums.TradingMode;
import com.tradingagent.domain.model.AccountSnapshot;
import com.tradingagent.domain.model.OrderAck;
import com.tradingagent.domain.model.OrderRequest;
import com.tradingagent.domain.model.OrderState;
import com.tradingagent.exception.BrokerException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Paper venue: every order fills immediately and completely at its reference price.
 *
 * <p>Cash starts at the configured portfolio value and moves with each fill. Equity is cash plus the
 * signed holdings marked at their last fill price. Order ids have the form {@code SIM-xxxxxxxx}.
 */
public class SimulatedExecutionVenue implements ExecutionVenue {

    private static final Logger log = LoggerFactory.getLogger(SimulatedExecutionVenue.class);

    private final Clock clock;
    private final Map<String, OrderState> orders = new ConcurrentHashMap<>();
    private final Map<String, Integer> holdings = new ConcurrentHashMap<>();
    private final Map<String, BigDecimal> lastPrices = new ConcurrentHashMap<>();
    private BigDecimal cash;

    public SimulatedExecutionVenue(BigDecimal startingCash, Clock clock) {
        this.cash = startingCash;
        this.clock = clock;
    }

    @Override
    public TradingMode getMode() {
        return TradingMode.SIMULATED;
    }

    @Override
    public synchronized OrderAck placeOrder(OrderRequest request) {
        BigDecimal price = request.getLimitPrice() != null ? request.getLimitPrice() : request.getReferencePrice();
        if (price == null || price.signum() <= 0) {
            throw new BrokerException("Simulated fill needs a positive reference price for " + request.getSymbol());
        }
        if (request.getQuantity() <= 0) {
            throw new BrokerException("Order quantity must be positive: " + request.getQuantity());
        }

        String orderId = "SIM-" + UUID.randomUUID().toString().substring(0, 8);
        int signed = request.getSide() == OrderSide.BUY ? request.getQuantity() : -request.getQuantity();
        BigDecimal notional = price.multiply(BigDecimal.valueOf(request.getQuantity()));
        cash = request.getSide() == OrderSide.BUY ? cash.subtract(notional) : cash.add(notional);
        holdings.merge(request.getSymbol(), signed, Integer::sum);
        holdings.remove(request.getSymbol(), 0);
        lastPrices.put(request.getSymbol(), price);

        orders.put(
                orderId,
                OrderState.builder()
                        .orderId(orderId)
                        .status(OrderStatus.FILLED)
                        .filledPrice(price)
                        .filledQuantity(request.getQuantity())
                        .filledAt(Instant.now(clock))
                        .build());

        log.info(
                "[SIMULATED] {} {} x{} @ {} (order {})",
                request.getSide(),
                request.getSymbol(),
                request.getQuantity(),
                price,
                orderId);
        return OrderAck.builder()
                .orderId(orderId)
                .symbol(request.getSymbol())
                .side(request.getSide())
                .quantity(request.getQuantity())
                .status(OrderStatus.FILLED)
                .build();
    }

    @Override
    public OrderState getOrder(String orderId) {
        OrderState state = orders.get(orderId);
        if (state == null) {
            throw new BrokerException("Unknown simulated order: " + orderId);
        }
        return state;
    }

    @Override
    public synchronized AccountSnapshot getAccount() {
        BigDecimal holdingsValue = BigDecimal.ZERO;
        for (Map.Entry<String, Integer> holding : holdings.entrySet()) {
            holdingsValue = holdingsValue.add(
                    lastPrices.get(holding.getKey()).multiply(BigDecimal.valueOf(holding.getValue())));
        }
        BigDecimal equity = cash.add(holdingsValue).setScale(2, RoundingMode.HALF_UP);
        return AccountSnapshot.builder()
                .mode(TradingMode.SIMULATED)
                .cash(cash.setScale(2, RoundingMode.HALF_UP))
                .equity(equity)
                .buyingPower(cash.max(BigDecimal.ZERO).setScale(2, RoundingMode.HALF_UP))
                .status("ACTIVE")
                .build();
    }

    /** Simulated orders never rest, so there is never anything to cancel. */
    @Override
    public int cancelAllOrders() {
        log.info("[SIMULATED] cancel all orders: nothing working");
        return 0;
    }
}
