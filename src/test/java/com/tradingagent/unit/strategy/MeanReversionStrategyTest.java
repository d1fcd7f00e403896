package com.tradingagent.unit.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.tradingagent.domain.enums.MajorTrend;
import com.tradingagent.domain.enums.SignalAction;
import com.tradingagent.domain.model.Bar;
import com.tradingagent.domain.model.StrategyOutput;
import com.tradingagent.indicator.IndicatorLibrary;
import com.tradingagent.risk.RiskProperties;
import com.tradingagent.strategy.MeanReversionStrategy;
import com.tradingagent.strategy.StrategyProperties;
import com.tradingagent.support.TestBars;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for MeanReversionStrategy: the entry/exit rule on indicator values and signal generation
 * over real bar series.
 */
class MeanReversionStrategyTest {

    private MeanReversionStrategy strategy;

    @BeforeEach
    void setUp() {
        strategy = new MeanReversionStrategy(new IndicatorLibrary(), new StrategyProperties(), new RiskProperties());
    }

    // ==============================
    // DECISION RULE
    // ==============================

    @Nested
    @DisplayName("Decision rule")
    class DecisionRule {

        @Test
        @DisplayName("Oversold stretch below the band with volume and no trend goes long at 0.9")
        void oversoldStretchGoesLong() {
            MeanReversionStrategy.Decision decision =
                    MeanReversionStrategy.decide(-2.1, 25, 1.2, MajorTrend.NEUTRAL, 1.5);

            assertThat(decision.action()).isEqualTo(SignalAction.LONG);
            assertThat(decision.confidence()).isCloseTo(0.9, within(1e-9));
        }

        @Test
        @DisplayName("Long candidate with RSI above 40 is held")
        void longBlockedByRsi() {
            MeanReversionStrategy.Decision decision =
                    MeanReversionStrategy.decide(-2.1, 45, 1.2, MajorTrend.NEUTRAL, 1.5);

            assertThat(decision.action()).isEqualTo(SignalAction.HOLD);
            assertThat(decision.reason()).contains("RSI too high");
        }

        @Test
        @DisplayName("Long candidate against a strong downtrend is held")
        void longBlockedByDowntrend() {
            MeanReversionStrategy.Decision decision =
                    MeanReversionStrategy.decide(-2.1, 25, 1.2, MajorTrend.STRONG_DOWNTREND, 1.5);

            assertThat(decision.action()).isEqualTo(SignalAction.HOLD);
            assertThat(decision.reason()).isEqualTo("Strong downtrend detected");
        }

        @Test
        @DisplayName("Long candidate on thin volume is held")
        void longBlockedByVolume() {
            MeanReversionStrategy.Decision decision =
                    MeanReversionStrategy.decide(-2.1, 25, 0.5, MajorTrend.NEUTRAL, 1.5);

            assertThat(decision.action()).isEqualTo(SignalAction.HOLD);
            assertThat(decision.reason()).isEqualTo("Insufficient volume");
        }

        @Test
        @DisplayName("Overbought stretch above the band goes short with full confidence")
        void overboughtStretchGoesShort() {
            MeanReversionStrategy.Decision decision =
                    MeanReversionStrategy.decide(2.6, 75, 1.0, MajorTrend.NEUTRAL, 1.5);

            assertThat(decision.action()).isEqualTo(SignalAction.SHORT);
            assertThat(decision.confidence()).isCloseTo(1.0, within(1e-9));
        }

        @Test
        @DisplayName("Short candidate against a strong uptrend is held")
        void shortBlockedByUptrend() {
            MeanReversionStrategy.Decision decision =
                    MeanReversionStrategy.decide(2.6, 75, 1.0, MajorTrend.STRONG_UPTREND, 1.5);

            assertThat(decision.action()).isEqualTo(SignalAction.HOLD);
        }

        @Test
        @DisplayName("Price back within half a deviation of the mean emits CLOSE")
        void nearMeanCloses() {
            MeanReversionStrategy.Decision decision =
                    MeanReversionStrategy.decide(0.3, 50, 1.0, MajorTrend.NEUTRAL, 1.5);

            assertThat(decision.action()).isEqualTo(SignalAction.CLOSE);
            assertThat(decision.reason()).isEqualTo("Price returned to mean");
        }

        @Test
        @DisplayName("Between the close band and the entry band is HOLD")
        void betweenBandsHolds() {
            assertThat(MeanReversionStrategy.decide(1.0, 50, 1.0, MajorTrend.NEUTRAL, 1.5).action())
                    .isEqualTo(SignalAction.HOLD);
        }
    }

    // ==============================
    // SIGNAL GENERATION
    // ==============================

    @Nested
    @DisplayName("Signal generation")
    class SignalGeneration {

        @Test
        @DisplayName("Short history returns HOLD with insufficient data")
        void shortHistoryHolds() {
            StrategyOutput output = strategy.generateSignal("AAPL", TestBars.flat(30, 100));

            assertThat(output.getAction()).isEqualTo(SignalAction.HOLD);
            assertThat(output.getReason()).isEqualTo("Insufficient data");
            assertThat(output.getStrength()).isZero();
        }

        @Test
        @DisplayName("Sharp drop in a quiet range produces a long with stop and mean target")
        void sharpDropGoesLong() {
            StrategyOutput output = strategy.generateSignal("AAPL", quietRangeEndingAt(97));

            assertThat(output.getAction()).isEqualTo(SignalAction.LONG);
            assertThat(output.getStrength()).isCloseTo(0.9, within(1e-9));
            assertThat(output.getEntryPrice()).isEqualByComparingTo("97");
            assertThat(output.getStopLoss()).isEqualByComparingTo("95.06");
            assertThat(output.getTargetPrice()).isEqualByComparingTo("100.30");
        }

        @Test
        @DisplayName("Sharp rise with RSI below 60 is held")
        void sharpRiseWithoutOverboughtRsiHolds() {
            StrategyOutput output = strategy.generateSignal("AAPL", quietRangeEndingAt(104));

            assertThat(output.getAction()).isEqualTo(SignalAction.HOLD);
            assertThat(output.getReason()).contains("RSI too low");
            assertThat(output.getStopLoss()).isNull();
        }

        @Test
        @DisplayName("Same bars always give the same output")
        void deterministic() {
            List<Bar> bars = quietRangeEndingAt(97);

            assertThat(strategy.generateSignal("AAPL", bars)).isEqualTo(strategy.generateSignal("AAPL", bars));
        }
    }

    /** 59 bars alternating 100/101, then one bar at {@code lastClose}. */
    private static List<Bar> quietRangeEndingAt(double lastClose) {
        double[] closes = new double[60];
        for (int i = 0; i < 59; i++) {
            closes[i] = i % 2 == 0 ? 100 : 101;
        }
        closes[59] = lastClose;
        return TestBars.closes(closes);
    }
}
