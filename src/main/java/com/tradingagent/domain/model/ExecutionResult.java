package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.TradeStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of an entry order. On failure nothing was booked: {@code trade} and {@code position} are null.
 * An entry whose fill could not be confirmed carries an {@link TradeStatus#UNCONFIRMED} trade and no
 * position.
 */
@Value
@Builder
public class ExecutionResult {

    boolean success;
    String symbol;
    String orderId;
    Trade trade;
    Position position;
    String message;

    public static ExecutionResult failure(String symbol, String message) {
        return ExecutionResult.builder().success(false).symbol(symbol).message(message).build();
    }

    public boolean isUnconfirmed() {
        return trade != null && trade.getStatus() == TradeStatus.UNCONFIRMED;
    }
}
