package com.tradingagent.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** What reconciling unconfirmed entry orders and pending exit orders against the venue resolved. */
@Value
@Builder
public class ReconciliationResult {

    int entriesConfirmed;
    int entriesCancelled;
    List<CloseResult> exitsConfirmed;
    int exitsAbandoned;
    int stillPending;

    public int resolved() {
        return entriesConfirmed + entriesCancelled + exitsConfirmed.size() + exitsAbandoned;
    }
}
