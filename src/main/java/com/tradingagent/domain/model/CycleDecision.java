package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.TradeAction;
import lombok.Builder;
import lombok.Value;

/** What the trading cycle did with one ranked opportunity. */
@Value
@Builder
public class CycleDecision {

    String symbol;
    TradeAction action;
    double confidence;
    boolean approved;
    boolean executed;
    String reason;
    String tradeId;
}
