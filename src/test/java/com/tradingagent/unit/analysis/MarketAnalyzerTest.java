package com.tradingagent.unit.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradingagent.analysis.MarketAnalyzer;
import com.tradingagent.domain.enums.MarketSentiment;
import com.tradingagent.domain.enums.Recommendation;
import com.tradingagent.domain.enums.Trend;
import com.tradingagent.domain.enums.VolatilityRegime;
import com.tradingagent.domain.model.Bar;
import com.tradingagent.domain.model.MarketOverview;
import com.tradingagent.domain.model.MarketRegime;
import com.tradingagent.indicator.IndicatorLibrary;
import com.tradingagent.risk.RiskProperties;
import com.tradingagent.support.TestBars;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MarketAnalyzerTest {

    private static final Instant NOW = Instant.parse("2024-06-03T14:30:00Z");

    private MarketAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new MarketAnalyzer(
                new IndicatorLibrary(), new RiskProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static List<Bar> rising() {
        return TestBars.series(60, i -> 100.0 * Math.pow(1.001, i));
    }

    private static List<Bar> falling() {
        return TestBars.series(60, i -> 100.0 * Math.pow(0.999, i));
    }

    private static List<Bar> choppy() {
        return TestBars.series(60, i -> i % 2 == 0 ? 100.0 : 110.0);
    }

    // ==============================
    // PER SYMBOL
    // ==============================

    @Nested
    @DisplayName("Symbol regime")
    class SymbolRegime {

        @Test
        @DisplayName("Fewer than 20 bars is reported as insufficient data")
        void insufficientData() {
            MarketRegime regime = analyzer.analyzeSymbol("AAPL", TestBars.flat(19, 100));

            assertThat(regime.hasData()).isFalse();
            assertThat(regime.getRecommendation()).isEqualTo(Recommendation.INSUFFICIENT_DATA);
        }

        @Test
        @DisplayName("Steady rise is an uptrend with low volatility")
        void steadyRise() {
            MarketRegime regime = analyzer.analyzeSymbol("AAPL", rising());

            assertThat(regime.getTrend()).isEqualTo(Trend.UP);
            assertThat(regime.getVolatilityRegime()).isEqualTo(VolatilityRegime.LOW);
            assertThat(regime.getRecommendation()).isEqualTo(Recommendation.NORMAL_TRADING);
            assertThat(regime.getPriceVsSma20Percent()).isPositive();
            assertThat(regime.getCurrentPrice().doubleValue()).isEqualTo(100.0 * Math.pow(1.001, 59));
        }

        @Test
        @DisplayName("Steady decline is a downtrend")
        void steadyDecline() {
            MarketRegime regime = analyzer.analyzeSymbol("AAPL", falling());

            assertThat(regime.getTrend()).isEqualTo(Trend.DOWN);
            assertThat(regime.getDailyReturnPercent()).isNegative();
        }

        @Test
        @DisplayName("Large daily swings are high volatility and high risk")
        void largeSwings() {
            MarketRegime regime = analyzer.analyzeSymbol("AAPL", choppy());

            assertThat(regime.getVolatilityRegime()).isEqualTo(VolatilityRegime.HIGH);
            assertThat(regime.getRecommendation()).isEqualTo(Recommendation.HIGH_RISK);
            assertThat(regime.isHighVolatility()).isTrue();
        }

        @Test
        @DisplayName("A volume spike on a calm symbol recommends active trading")
        void volumeSpike() {
            double[] closes = new double[60];
            long[] volumes = new long[60];
            for (int i = 0; i < 60; i++) {
                closes[i] = 100.0;
                volumes[i] = TestBars.DEFAULT_VOLUME;
            }
            volumes[59] = 5 * TestBars.DEFAULT_VOLUME;

            MarketRegime regime = analyzer.analyzeSymbol("AAPL", TestBars.closesWithVolumes(closes, volumes));

            assertThat(regime.getTrend()).isEqualTo(Trend.SIDEWAYS);
            assertThat(regime.getVolumeRatio()).isGreaterThan(1.5);
            assertThat(regime.getRecommendation()).isEqualTo(Recommendation.ACTIVE_TRADING);
        }

        @Test
        @DisplayName("Without 51 bars the trend cannot leave SIDEWAYS")
        void shortHistoryIsSideways() {
            MarketRegime regime = analyzer.analyzeSymbol("AAPL", TestBars.series(30, i -> 100.0 + i));

            assertThat(regime.hasData()).isTrue();
            assertThat(regime.getTrend()).isEqualTo(Trend.SIDEWAYS);
        }
    }

    // ==============================
    // UNIVERSE
    // ==============================

    @Nested
    @DisplayName("Market overview")
    class Overview {

        @Test
        @DisplayName("Uptrends in more than 60% of symbols is bullish")
        void bullish() {
            Map<String, List<Bar>> bars = new LinkedHashMap<>();
            bars.put("AAPL", rising());
            bars.put("MSFT", rising());
            bars.put("GOOGL", rising());

            MarketOverview overview = analyzer.analyzeMarket(bars);

            assertThat(overview.getSentiment()).isEqualTo(MarketSentiment.BULLISH);
            assertThat(overview.getUptrendCount()).isEqualTo(3);
            assertThat(overview.getRecommendation())
                    .isEqualTo("Bullish market conditions. Look for long opportunities.");
            assertThat(overview.getAnalyzedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Mixed trends are neutral")
        void neutral() {
            Map<String, List<Bar>> bars = new LinkedHashMap<>();
            bars.put("AAPL", rising());
            bars.put("MSFT", falling());
            bars.put("SPY", TestBars.flat(60, 400));

            MarketOverview overview = analyzer.analyzeMarket(bars);

            assertThat(overview.getSentiment()).isEqualTo(MarketSentiment.NEUTRAL);
            assertThat(overview.getRecommendation()).isEqualTo("Neutral market. Focus on mean reversion strategies.");
        }

        @Test
        @DisplayName("Symbols without data are kept in the regimes but left out of the aggregate")
        void skipsInsufficientSymbols() {
            Map<String, List<Bar>> bars = new LinkedHashMap<>();
            bars.put("AAPL", falling());
            bars.put("NEW", TestBars.flat(5, 10));

            MarketOverview overview = analyzer.analyzeMarket(bars);

            assertThat(overview.getRegimes()).containsKeys("AAPL", "NEW");
            assertThat(overview.getAnalyzedSymbols()).isEqualTo(1);
            assertThat(overview.getSentiment()).isEqualTo(MarketSentiment.BEARISH);
            assertThat(overview.regimeFor("MISSING").hasData()).isFalse();
        }

        @Test
        @DisplayName("High average volatility overrides the sentiment recommendation")
        void highVolatilityWarning() {
            MarketOverview overview = analyzer.analyzeMarket(Map.of("TSLA", choppy()));

            assertThat(overview.getRecommendation()).startsWith("High volatility detected");
        }

        @Test
        @DisplayName("No analyzable symbols is neutral with a warning")
        void nothingAnalyzed() {
            MarketOverview overview = analyzer.analyzeMarket(Map.of("AAPL", TestBars.flat(3, 100)));

            assertThat(overview.getSentiment()).isEqualTo(MarketSentiment.NEUTRAL);
            assertThat(overview.getRecommendation()).isEqualTo("Could not analyze any symbols.");
        }
    }
}
