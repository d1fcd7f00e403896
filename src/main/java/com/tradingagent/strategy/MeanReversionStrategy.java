package com.tradingagent.strategy;

import com.tradingagent.domain.enums.MajorTrend;
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
 * Fades stretched moves back toward the rolling mean.
 *
 * <p>A close more than {@code stdDev} standard deviations below the mean is a LONG candidate, above it a
 * SHORT candidate. Candidates are filtered by RSI (must be at least mildly oversold / overbought), by
 * the major trend (no fading a move with a &gt;5% trend behind it) and by volume (at least 80% of the
 * average). A close within half a deviation of the mean emits CLOSE.
 *
 * <p>Confidence is the sum of four tiers, clamped to [0, 1]:
 * <ul>
 *   <li>z-score magnitude: +0.25 above 2.5, +0.15 above 2.0</li>
 *   <li>RSI extremity: +0.25 beyond 30/70, +0.15 beyond 40/60</li>
 *   <li>volume confirmation: +0.25</li>
 *   <li>trend alignment: +0.25 if aligned or neutral, -0.10 if counter-trend</li>
 * </ul>
 * Entry candidates below 0.4 confidence are downgraded to HOLD.
 */
@Component
@ConditionalOnProperty(
        name = "tradingagent.strategy.mean-reversion.enabled",
        havingValue = "true",
        matchIfMissing = true)
public class MeanReversionStrategy implements Strategy {

    private static final Logger log = LoggerFactory.getLogger(MeanReversionStrategy.class);

    public static final String NAME = "mean_reversion";

    static final double MIN_CONFIDENCE = 0.4;
    static final double CLOSE_BAND = 0.5;
    static final double VOLUME_THRESHOLD = 0.8;
    static final double MAJOR_TREND_BAND = 0.05;
    static final double RSI_OVERSOLD = 40.0;
    static final double RSI_OVERBOUGHT = 60.0;

    /** Extra history beyond the averaging period, so RSI and the volume average are fully formed. */
    private static final int WARMUP_BARS = 20;

    private final IndicatorLibrary indicators;
    private final StrategyProperties.MeanReversion config;
    private final RiskProperties riskProperties;

    public MeanReversionStrategy(
            IndicatorLibrary indicators, StrategyProperties strategyProperties, RiskProperties riskProperties) {
        this.indicators = indicators;
        this.config = strategyProperties.getMeanReversion();
        this.riskProperties = riskProperties;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int requiredBars() {
        return config.getPeriod() + WARMUP_BARS;
    }

    @Override
    public StrategyOutput generateSignal(String symbol, List<Bar> bars) {
        if (bars == null || bars.size() < requiredBars()) {
            return StrategyOutput.hold(NAME, "Insufficient data");
        }

        OptionalDouble zScore = indicators.zScore(bars, config.getPeriod());
        OptionalDouble rsi = indicators.rsi(bars, config.getRsiPeriod());
        OptionalDouble mean = indicators.sma(bars, config.getPeriod());
        if (zScore.isEmpty() || rsi.isEmpty() || mean.isEmpty()) {
            return StrategyOutput.hold(NAME, "Insufficient data");
        }
        OptionalDouble volumeRatio = indicators.volumeRatio(bars, config.getVolumePeriod());
        MajorTrend trend = majorTrend(bars);

        Decision decision = decide(
                zScore.getAsDouble(), rsi.getAsDouble(), volumeRatio.orElse(1.0), trend, config.getStdDev());
        log.debug(
                "{} {}: z={} rsi={} trend={} -> {} ({})",
                NAME,
                symbol,
                zScore.getAsDouble(),
                rsi.getAsDouble(),
                trend,
                decision.action(),
                decision.confidence());

        if (decision.action() == SignalAction.LONG || decision.action() == SignalAction.SHORT) {
            BigDecimal close = bars.get(bars.size() - 1).getClose();
            BigDecimal stopOffset = BigDecimal.ONE.subtract(riskProperties.getStopLossFraction());
            if (decision.action() == SignalAction.SHORT) {
                stopOffset = BigDecimal.ONE.add(riskProperties.getStopLossFraction());
            }
            return StrategyOutput.builder()
                    .strategyName(NAME)
                    .action(decision.action())
                    .strength(decision.confidence())
                    .entryPrice(close)
                    .stopLoss(close.multiply(stopOffset).setScale(2, RoundingMode.HALF_UP))
                    .targetPrice(BigDecimal.valueOf(mean.getAsDouble()).setScale(2, RoundingMode.HALF_UP))
                    .reason(decision.reason())
                    .build();
        }
        return StrategyOutput.builder()
                .strategyName(NAME)
                .action(decision.action())
                .strength(decision.action() == SignalAction.CLOSE ? decision.confidence() : 0.0)
                .reason(decision.reason())
                .build();
    }

    /**
     * The entry/exit rule on already-computed indicator values. Kept separate from
     * {@link #generateSignal} so the rule can be exercised without building a bar series.
     */
    public static Decision decide(double zScore, double rsi, double volumeRatio, MajorTrend trend, double stdDev) {
        boolean volumeOk = volumeRatio >= VOLUME_THRESHOLD;
        SignalAction action = SignalAction.HOLD;
        String reason = "Price within bands";

        if (zScore < -stdDev) {
            action = SignalAction.LONG;
            reason = String.format("Price %.2f std devs below mean", Math.abs(zScore));
            if (rsi > RSI_OVERSOLD) {
                action = SignalAction.HOLD;
                reason = String.format("RSI too high (%.1f > %.0f)", rsi, RSI_OVERSOLD);
            } else if (trend == MajorTrend.STRONG_DOWNTREND) {
                action = SignalAction.HOLD;
                reason = "Strong downtrend detected";
            } else if (!volumeOk) {
                action = SignalAction.HOLD;
                reason = "Insufficient volume";
            }
        } else if (zScore > stdDev) {
            action = SignalAction.SHORT;
            reason = String.format("Price %.2f std devs above mean", zScore);
            if (rsi < RSI_OVERBOUGHT) {
                action = SignalAction.HOLD;
                reason = String.format("RSI too low (%.1f < %.0f)", rsi, RSI_OVERBOUGHT);
            } else if (trend == MajorTrend.STRONG_UPTREND) {
                action = SignalAction.HOLD;
                reason = "Strong uptrend detected";
            } else if (!volumeOk) {
                action = SignalAction.HOLD;
                reason = "Insufficient volume";
            }
        } else if (Math.abs(zScore) < CLOSE_BAND) {
            action = SignalAction.CLOSE;
            reason = "Price returned to mean";
        }

        double confidence = confidence(zScore, rsi, volumeOk, trend, action);
        if ((action == SignalAction.LONG || action == SignalAction.SHORT) && confidence < MIN_CONFIDENCE) {
            return new Decision(SignalAction.HOLD, confidence, String.format("Low confidence (%.2f)", confidence));
        }
        return new Decision(action, confidence, reason);
    }

    static double confidence(double zScore, double rsi, boolean volumeOk, MajorTrend trend, SignalAction action) {
        double confidence = 0.0;

        double magnitude = Math.abs(zScore);
        if (magnitude > 2.5) {
            confidence += 0.25;
        } else if (magnitude > 2.0) {
            confidence += 0.15;
        }

        if (action == SignalAction.LONG) {
            if (rsi < 30) {
                confidence += 0.25;
            } else if (rsi < 40) {
                confidence += 0.15;
            }
        } else if (action == SignalAction.SHORT) {
            if (rsi > 70) {
                confidence += 0.25;
            } else if (rsi > 60) {
                confidence += 0.15;
            }
        }

        if (volumeOk) {
            confidence += 0.25;
        }

        if (action == SignalAction.LONG) {
            confidence += trend == MajorTrend.STRONG_DOWNTREND ? -0.10 : 0.25;
        } else if (action == SignalAction.SHORT) {
            confidence += trend == MajorTrend.STRONG_UPTREND ? -0.10 : 0.25;
        }

        return Math.max(0.0, Math.min(1.0, confidence));
    }

    private MajorTrend majorTrend(List<Bar> bars) {
        OptionalDouble longMean = indicators.sma(bars, config.getTrendPeriod());
        if (longMean.isEmpty()) {
            return MajorTrend.NEUTRAL;
        }
        double price = indicators.lastClose(bars);
        if (price > longMean.getAsDouble() * (1 + MAJOR_TREND_BAND)) {
            return MajorTrend.STRONG_UPTREND;
        }
        if (price < longMean.getAsDouble() * (1 - MAJOR_TREND_BAND)) {
            return MajorTrend.STRONG_DOWNTREND;
        }
        return MajorTrend.NEUTRAL;
    }

    /** Action, confidence in [0, 1] and a human-readable reason. */
    public record Decision(SignalAction action, double confidence, String reason) {}
}
