package com.tradingagent.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** Snapshot of the portfolio-level risk counters for one trading day. */
@Value
@Builder
public class RiskState {

    LocalDate tradingDay;
    BigDecimal portfolioValue;
    BigDecimal dailyPnl;
}
