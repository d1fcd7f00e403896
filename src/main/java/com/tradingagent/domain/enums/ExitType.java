package com.tradingagent.domain.enums;

public enum ExitType {
    STOP_LOSS,
    SIGNAL;
}
