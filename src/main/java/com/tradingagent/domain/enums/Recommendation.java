package com.tradingagent.domain.enums;

/** Per-symbol trading recommendation derived from volatility and volume. */
public enum Recommendation {
    HIGH_RISK,
    ACTIVE_TRADING,
    NORMAL_TRADING,
    INSUFFICIENT_DATA;
}
