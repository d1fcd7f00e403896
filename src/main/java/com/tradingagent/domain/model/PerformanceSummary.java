package com.tradingagent.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Closed-trade statistics over a trailing window. {@code winRate} is a fraction in [0, 1]. */
@Value
@Builder
public class PerformanceSummary {

    int days;
    int totalTrades;
    int winningTrades;
    int losingTrades;
    double winRate;
    BigDecimal totalPnl;
    BigDecimal averagePnl;
    BigDecimal bestTrade;
    BigDecimal worstTrade;
}
