package com.tradingagent.risk;

import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Portfolio risk limits, loaded from application.properties.
 *
 * <p>Properties prefix: {@code tradingagent.risk.*}. All fractions are of the current portfolio value;
 * {@code highVolatilityThreshold} is a percentage, matching how return volatility is quoted.
 */
@Data
@Component
@ConfigurationProperties(prefix = "tradingagent.risk")
public class RiskProperties {

    private BigDecimal maxPositionFraction = new BigDecimal("0.20");
    private BigDecimal maxRiskFraction = new BigDecimal("0.02");
    private int maxPositions = 5;
    private BigDecimal dailyLossLimit = new BigDecimal("0.05");
    private BigDecimal stopLossFraction = new BigDecimal("0.02");
    private double minConfidence = 0.3;
    private BigDecimal capitalUsageLimit = new BigDecimal("0.9");
    private double highVolatilityThreshold = 3.0;
    private BigDecimal volatilitySizeFactor = new BigDecimal("0.5");
}
