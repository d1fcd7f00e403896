package com.tradingagent.domain.enums;

public enum OrderType {
    MARKET,
    LIMIT;
}
