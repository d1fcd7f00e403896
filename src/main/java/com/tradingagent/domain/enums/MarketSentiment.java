package com.tradingagent.domain.enums;

public enum MarketSentiment {
    BULLISH,
    BEARISH,
    NEUTRAL;
}
