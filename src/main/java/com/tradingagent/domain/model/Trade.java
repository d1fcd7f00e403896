package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.ExitType;
import com.tradingagent.domain.enums.OrderSide;
import com.tradingagent.domain.enums.TradeStatus;
import com.tradingagent.exception.BusinessException;
import com.tradingagent.exception.ErrorCode;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Bookkeeping record of one round trip. {@code quantity} is unsigned; {@code side} is the entry side.
 *
 * <p>A trade is closed exactly once. {@code pnlPercent} is quoted as a percentage of the entry
 * notional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Trade {

    private String id;
    private String symbol;
    private OrderSide side;
    private int quantity;
    private BigDecimal entryPrice;
    private BigDecimal exitPrice;
    private BigDecimal stopLoss;
    private BigDecimal targetPrice;
    private String strategy;
    private TradeStatus status;
    private String entryOrderId;
    private String exitOrderId;
    private double confidence;
    private BigDecimal pnl;
    private BigDecimal pnlPercent;
    private ExitType exitType;
    private String exitReason;
    private Instant entryTimestamp;
    private Instant exitTimestamp;

    /**
     * Closes the trade at {@code exitPrice} and computes realised P&L.
     *
     * @throws BusinessException with {@link ErrorCode#CONFLICT} if the trade is already closed
     */
    public void close(BigDecimal exitPrice, Instant exitTimestamp) {
        if (status == TradeStatus.CLOSED) {
            throw new BusinessException(
                    ErrorCode.CONFLICT, "Trade " + id + " is already closed", Map.of("tradeId", String.valueOf(id)));
        }
        BigDecimal qty = BigDecimal.valueOf(quantity);
        BigDecimal perShare = side == OrderSide.BUY ? exitPrice.subtract(entryPrice) : entryPrice.subtract(exitPrice);
        this.pnl = perShare.multiply(qty).setScale(2, RoundingMode.HALF_UP);
        BigDecimal notional = entryPrice.multiply(qty);
        this.pnlPercent = notional.signum() == 0
                ? BigDecimal.ZERO
                : perShare.multiply(qty)
                        .multiply(BigDecimal.valueOf(100))
                        .divide(notional, 4, RoundingMode.HALF_UP);
        this.exitPrice = exitPrice;
        this.exitTimestamp = exitTimestamp;
        this.status = TradeStatus.CLOSED;
    }

    public boolean isOpen() {
        return status == TradeStatus.OPEN || status == TradeStatus.UNCONFIRMED;
    }
}
