package com.tradingagent.domain.enums;

public enum CycleStatus {
    COMPLETED,
    FAILED,
    SKIPPED;
}
