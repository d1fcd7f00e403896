package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.ExitType;
import com.tradingagent.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An open position. At most one exists per symbol.
 *
 * <p>Quantity is signed: positive = long, negative = short. {@code pendingExitOrderId} is set while an
 * exit order is working at the venue but not yet confirmed filled; such a position is left alone by
 * position management until reconciliation resolves the order. The exit type and reason travel with
 * the pending order and reach the trade only when the exit fills.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String symbol;

    /** Signed quantity: positive = long, negative = short. */
    private int quantity;

    private BigDecimal entryPrice;
    private BigDecimal currentPrice;
    private BigDecimal stopLoss;
    private BigDecimal targetPrice;
    private BigDecimal unrealizedPnl;
    private String strategy;
    private String tradeId;
    private String pendingExitOrderId;
    private ExitType pendingExitType;
    private String pendingExitReason;
    private Instant entryTimestamp;
    private Instant lastUpdated;

    public boolean isLong() {
        return quantity > 0;
    }

    /** Side of the order that opened this position. */
    public OrderSide getSide() {
        return quantity >= 0 ? OrderSide.BUY : OrderSide.SELL;
    }

    public int getAbsoluteQuantity() {
        return Math.abs(quantity);
    }

    /** Marks the position at {@code price}. Signed quantity makes one formula cover both sides. */
    public void markToMarket(BigDecimal price, Instant at) {
        this.currentPrice = price;
        this.unrealizedPnl = price.subtract(entryPrice)
                .multiply(BigDecimal.valueOf(quantity))
                .setScale(2, RoundingMode.HALF_UP);
        this.lastUpdated = at;
    }

    public BigDecimal getMarketValue() {
        BigDecimal mark = currentPrice != null ? currentPrice : entryPrice;
        return mark.multiply(BigDecimal.valueOf(getAbsoluteQuantity()));
    }
}
