package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.CycleStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PositionManagementReport {

    CycleStatus status;
    Instant startedAt;
    Instant finishedAt;
    int reconciled;
    int positionsChecked;
    List<CloseResult> closed;
    BigDecimal realizedPnl;
    String message;

    public static PositionManagementReport aborted(
            CycleStatus status, Instant startedAt, Instant finishedAt, String message) {
        return PositionManagementReport.builder()
                .status(status)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .closed(List.of())
                .realizedPnl(BigDecimal.ZERO)
                .message(message)
                .build();
    }
}
