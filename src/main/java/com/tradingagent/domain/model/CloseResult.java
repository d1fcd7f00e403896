package com.tradingagent.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of closing a position. {@code pending} means the exit order was accepted but its fill is not
 * yet confirmed, so no P&L was realised.
 */
@Value
@Builder
public class CloseResult {

    boolean success;
    boolean pending;
    String symbol;
    String orderId;
    BigDecimal exitPrice;
    BigDecimal pnl;
    BigDecimal pnlPercent;
    Trade trade;
    String message;

    public static CloseResult failure(String symbol, String message) {
        return CloseResult.builder().success(false).symbol(symbol).message(message).build();
    }
}
