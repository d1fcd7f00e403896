package com.tradingagent.domain.model;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Aggregate statistics of a walk-forward replay. {@code winRate} and {@code maxDrawdown} are fractions;
 * {@code totalReturnPercent} is a percentage of the initial capital.
 */
@Value
@Builder
public class BacktestResult {

    String strategy;
    String symbol;
    int barsReplayed;
    BigDecimal initialCapital;
    BigDecimal finalCapital;
    int totalTrades;
    int winningTrades;
    int losingTrades;
    double winRate;
    BigDecimal totalReturn;
    BigDecimal totalReturnPercent;
    BigDecimal averageWin;
    BigDecimal averageLoss;
    BigDecimal profitFactor;
    double maxDrawdown;
    boolean positionOpenAtEnd;
    List<BacktestTrade> trades;
}
