package com.tradingagent.backtest;

import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/** Backtest sizing. Properties prefix: {@code tradingagent.backtest.*}. */
@Data
@Component
@ConfigurationProperties(prefix = "tradingagent.backtest")
public class BacktestProperties {

    private BigDecimal initialCapital = new BigDecimal("10000");

    /** Fraction of running capital committed to each simulated position. */
    private BigDecimal positionFraction = new BigDecimal("0.2");
}
