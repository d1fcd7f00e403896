package com.tradingagent.event;

public enum RiskEventType {
    TRADE_REJECTED,
    DAILY_LOSS_LIMIT_BREACH,
    DAILY_RESET;
}
