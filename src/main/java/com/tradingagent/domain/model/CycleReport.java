package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.CycleStatus;
import com.tradingagent.domain.enums.MarketSentiment;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CycleReport {

    CycleStatus status;
    Instant startedAt;
    Instant finishedAt;
    MarketSentiment sentiment;
    int reconciled;
    int opportunities;
    int executed;
    List<CycleDecision> decisions;
    String message;

    public static CycleReport aborted(CycleStatus status, Instant startedAt, Instant finishedAt, String message) {
        return CycleReport.builder()
                .status(status)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .decisions(List.of())
                .message(message)
                .build();
    }
}
