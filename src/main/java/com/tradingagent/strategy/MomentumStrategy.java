package com.tradingagent.strategy;

import com.tradingagent.domain.enums.SignalAction;
import com.tradingagent.domain.model.Bar;
import com.tradingagent.domain.model.StrategyOutput;
import com.tradingagent.indicator.IndicatorLibrary;
import com.tradingagent.risk.RiskProperties;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Trend-following on a fast/slow moving-average crossover.
 *
 * <p>LONG when the fast average crosses above the slow one on the latest bar and RSI is below the
 * overbought level; SHORT on the mirror crossover with RSI above the oversold level. With no fresh
 * crossover, a fast average below the slow one and RSI above 60 emits CLOSE.
 *
 * <p>Strength is {@code min(|fast - slow| / slow * 100 / 5, 1)}: a 5% gap between the averages is full
 * strength. The stop sits {@code stopLossFraction} beyond the slow average.
 */
@Component
@ConditionalOnProperty(name = "tradingagent.strategy.momentum.enabled", havingValue = "true", matchIfMissing = true)
public class MomentumStrategy implements Strategy {

    private static final Logger log = LoggerFactory.getLogger(MomentumStrategy.class);

    public static final String NAME = "momentum";

    static final double CLOSE_STRENGTH = 0.8;
    static final double CLOSE_RSI_LEVEL = 60.0;
    private static final double FULL_STRENGTH_GAP_PERCENT = 5.0;

    private final IndicatorLibrary indicators;
    private final StrategyProperties.Momentum config;
    private final RiskProperties riskProperties;

    public MomentumStrategy(
            IndicatorLibrary indicators, StrategyProperties strategyProperties, RiskProperties riskProperties) {
        this.indicators = indicators;
        this.config = strategyProperties.getMomentum();
        this.riskProperties = riskProperties;
    }

    @Override
    public String getName() {
        return NAME;
    }

    /** The slow average on the previous bar must be formed as well, to detect a crossover. */
    @Override
    public int requiredBars() {
        return config.getSlowPeriod() + 2;
    }

    @Override
    public StrategyOutput generateSignal(String symbol, List<Bar> bars) {
        if (bars == null || bars.size() < requiredBars()) {
            return StrategyOutput.hold(NAME, "Insufficient data");
        }

        OptionalDouble fast = indicators.sma(bars, config.getFastPeriod());
        OptionalDouble slow = indicators.sma(bars, config.getSlowPeriod());
        OptionalDouble prevFast = indicators.smaAt(bars, config.getFastPeriod(), 1);
        OptionalDouble prevSlow = indicators.smaAt(bars, config.getSlowPeriod(), 1);
        OptionalDouble rsiValue = indicators.rsi(bars, config.getRsiPeriod());
        if (fast.isEmpty() || slow.isEmpty() || prevFast.isEmpty() || prevSlow.isEmpty() || rsiValue.isEmpty()) {
            return StrategyOutput.hold(NAME, "Insufficient data");
        }

        double fastMa = fast.getAsDouble();
        double slowMa = slow.getAsDouble();
        double rsi = rsiValue.getAsDouble();
        double trendStrength = slowMa == 0.0 ? 0.0 : (fastMa - slowMa) / slowMa * 100.0;
        double strength = Math.min(Math.abs(trendStrength) / FULL_STRENGTH_GAP_PERCENT, 1.0);
        BigDecimal close = bars.get(bars.size() - 1).getClose();

        log.debug("{} {}: fast={} slow={} rsi={} trendStrength={}", NAME, symbol, fastMa, slowMa, rsi, trendStrength);

        boolean crossedUp = fastMa > slowMa && prevFast.getAsDouble() <= prevSlow.getAsDouble();
        boolean crossedDown = fastMa < slowMa && prevFast.getAsDouble() >= prevSlow.getAsDouble();

        if (crossedUp && rsi < config.getRsiOverbought()) {
            return entry(
                    SignalAction.LONG,
                    strength,
                    close,
                    slowMa,
                    BigDecimal.ONE.subtract(riskProperties.getStopLossFraction()),
                    String.format("Bullish crossover. Fast MA %.2f, slow MA %.2f, RSI %.1f", fastMa, slowMa, rsi));
        }
        if (crossedDown && rsi > config.getRsiOversold()) {
            return entry(
                    SignalAction.SHORT,
                    strength,
                    close,
                    slowMa,
                    BigDecimal.ONE.add(riskProperties.getStopLossFraction()),
                    String.format("Bearish crossover. Fast MA %.2f, slow MA %.2f, RSI %.1f", fastMa, slowMa, rsi));
        }
        if (fastMa < slowMa && rsi > CLOSE_RSI_LEVEL) {
            return StrategyOutput.builder()
                    .strategyName(NAME)
                    .action(SignalAction.CLOSE)
                    .strength(CLOSE_STRENGTH)
                    .reason(String.format("Trend weakening. RSI %.1f", rsi))
                    .build();
        }

        String reason = fastMa > slowMa ? "In uptrend" : "In downtrend";
        if (rsi > config.getRsiOverbought()) {
            reason += ", RSI overbought";
        } else if (rsi < config.getRsiOversold()) {
            reason += ", RSI oversold";
        }
        return StrategyOutput.hold(NAME, reason);
    }

    private StrategyOutput entry(
            SignalAction action,
            double strength,
            BigDecimal close,
            double slowMa,
            BigDecimal stopMultiplier,
            String reason) {
        BigDecimal stop = BigDecimal.valueOf(slowMa).multiply(stopMultiplier).setScale(2, RoundingMode.HALF_UP);
        return StrategyOutput.builder()
                .strategyName(NAME)
                .action(action)
                .strength(strength)
                .entryPrice(close)
                .stopLoss(stop)
                .reason(reason)
                .build();
    }
}
