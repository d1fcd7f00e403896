package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.ExitType;
import com.tradingagent.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** One simulated round trip. {@code pnlPercent} is a percentage of the entry notional. */
@Value
@Builder
public class BacktestTrade {

    OrderSide side;
    int quantity;
    BigDecimal entryPrice;
    BigDecimal exitPrice;
    BigDecimal stopLoss;
    Instant entryTimestamp;
    Instant exitTimestamp;
    double entryStrength;
    BigDecimal pnl;
    BigDecimal pnlPercent;
    ExitType exitType;
    String exitReason;
}
