package com.tradingagent.domain.enums;

/**
 * Trade lifecycle. {@code UNCONFIRMED} marks an entry order whose fill could not be confirmed within
 * the poll window; it is reconciled against the venue at the start of the next cycle.
 */
public enum TradeStatus {
    OPEN,
    CLOSED,
    UNCONFIRMED,
    CANCELLED;
}
