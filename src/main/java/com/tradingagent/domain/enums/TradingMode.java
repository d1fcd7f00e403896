package com.tradingagent.domain.enums;

public enum TradingMode {
    LIVE,
    SIMULATED;
}
