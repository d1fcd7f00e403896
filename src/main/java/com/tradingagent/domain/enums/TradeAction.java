package com.tradingagent.domain.enums;

/** Fused action after {@code StrategyAgent} combines the per-strategy votes. */
public enum TradeAction {
    BUY,
    SELL,
    CLOSE,
    HOLD;
}
