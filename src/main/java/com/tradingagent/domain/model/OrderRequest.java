package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.OrderSide;
import com.tradingagent.domain.enums.OrderType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * An order to submit to the venue. {@code referencePrice} is the price the decision was made at; the
 * simulated venue fills at it, a live venue ignores it.
 */
@Value
@Builder
public class OrderRequest {

    String symbol;
    OrderSide side;
    int quantity;
    OrderType type;
    BigDecimal limitPrice;
    BigDecimal referencePrice;
}
