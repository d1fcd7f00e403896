package com.tradingagent.domain.enums;

public enum VolatilityRegime {
    LOW,
    MEDIUM,
    HIGH;
}
