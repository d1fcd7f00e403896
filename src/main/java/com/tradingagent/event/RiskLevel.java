package com.tradingagent.event;

public enum RiskLevel {
    INFO,
    WARNING,
    CRITICAL;
}
