package com.tradingagent.strategy;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Strategy parameters, loaded from application.properties.
 *
 * <p>Properties prefix: {@code tradingagent.strategy.*}. A disabled strategy is not registered with
 * the fusion agent at all, so it neither votes nor counts toward the strategy total.
 */
@Data
@Component
@ConfigurationProperties(prefix = "tradingagent.strategy")
public class StrategyProperties {

    private MeanReversion meanReversion = new MeanReversion();
    private Momentum momentum = new Momentum();

    @Data
    public static class MeanReversion {
        private boolean enabled = true;
        private int period = 20;
        private double stdDev = 1.5;
        private int rsiPeriod = 14;
        private int trendPeriod = 50;
        private int volumePeriod = 20;
    }

    @Data
    public static class Momentum {
        private boolean enabled = true;
        private int fastPeriod = 10;
        private int slowPeriod = 30;
        private int rsiPeriod = 14;
        private double rsiOverbought = 60.0;
        private double rsiOversold = 40.0;
    }
}
