package com.tradingagent.domain.enums;

public enum Trend {
    UP,
    DOWN,
    SIDEWAYS;
}
