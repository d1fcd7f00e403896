package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.OrderStatus;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Venue view of an order: status plus fill details once filled. */
@Value
@Builder
public class OrderState {

    String orderId;
    OrderStatus status;
    BigDecimal filledPrice;
    int filledQuantity;
    Instant filledAt;

    public boolean isFilled() {
        return status == OrderStatus.FILLED;
    }
}
