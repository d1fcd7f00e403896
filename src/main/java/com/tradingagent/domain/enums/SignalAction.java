package com.tradingagent.domain.enums;

/** Directional vocabulary a single strategy emits. */
public enum SignalAction {
    LONG,
    SHORT,
    CLOSE,
    HOLD;
}
