package com.tradingagent.domain.enums;

public enum MajorTrend {
    STRONG_UPTREND,
    STRONG_DOWNTREND,
    NEUTRAL;
}
