package com.tradingagent.domain.enums;

/** Venue-reported order state. {@code NEW} and {@code PARTIALLY_FILLED} are still working. */
public enum OrderStatus {
    NEW,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    REJECTED,
    EXPIRED;

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || this == REJECTED || this == EXPIRED;
    }
}
