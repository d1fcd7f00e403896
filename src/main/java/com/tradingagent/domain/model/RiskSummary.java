package com.tradingagent.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Current portfolio risk picture. {@code dailyPnlFraction} is a fraction of the portfolio value;
 * {@code totalRisk} is the loss if every open position were stopped out.
 */
@Value
@Builder
public class RiskSummary {

    LocalDate tradingDay;
    BigDecimal portfolioValue;
    BigDecimal dailyPnl;
    double dailyPnlFraction;
    int openPositions;
    int maxPositions;
    BigDecimal totalExposure;
    BigDecimal totalRisk;
    BigDecimal dailyLossLimit;
    BigDecimal remainingDailyRisk;
    boolean dailyLossLimitBreached;
}
