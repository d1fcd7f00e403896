package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.OrderSide;
import com.tradingagent.domain.enums.OrderStatus;
import lombok.Builder;
import lombok.Value;

/** Venue acknowledgement of a submitted order. */
@Value
@Builder
public class OrderAck {

    String orderId;
    String symbol;
    OrderSide side;
    int quantity;
    OrderStatus status;
}
