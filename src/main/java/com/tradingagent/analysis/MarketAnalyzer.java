package com.tradingagent.analysis;

import com.tradingagent.domain.enums.MarketSentiment;
import com.tradingagent.domain.enums.Recommendation;
import com.tradingagent.domain.enums.Trend;
import com.tradingagent.domain.enums.VolatilityRegime;
import com.tradingagent.domain.model.Bar;
import com.tradingagent.domain.model.MarketOverview;
import com.tradingagent.domain.model.MarketRegime;
import com.tradingagent.indicator.IndicatorLibrary;
import com.tradingagent.risk.RiskProperties;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Classifies each symbol's volatility, trend and volume, and rolls the universe up into a sentiment.
 *
 * <p>A symbol needs at least {@value #MIN_BARS} bars; shorter histories are reported as
 * {@link Recommendation#INSUFFICIENT_DATA} and left out of the aggregate. With fewer than 51 bars the
 * 50-bar average falls back to the 20-bar one, so the trend can only come out SIDEWAYS.
 */
@Service
public class MarketAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(MarketAnalyzer.class);

    public static final int MIN_BARS = 20;

    private static final int SHORT_PERIOD = 20;
    private static final int LONG_PERIOD = 50;
    private static final double MEDIUM_VOLATILITY_THRESHOLD = 1.5;
    private static final double ACTIVE_VOLUME_RATIO = 1.5;
    private static final double SENTIMENT_MAJORITY = 0.6;

    private final IndicatorLibrary indicators;
    private final RiskProperties riskProperties;
    private final Clock clock;

    public MarketAnalyzer(IndicatorLibrary indicators, RiskProperties riskProperties, Clock clock) {
        this.indicators = indicators;
        this.riskProperties = riskProperties;
        this.clock = clock;
    }

    // ==============================
    // PER SYMBOL
    // ==============================

    public MarketRegime analyzeSymbol(String symbol, List<Bar> bars) {
        if (bars == null || bars.size() < MIN_BARS) {
            log.debug("Insufficient data for {}: {} bars", symbol, bars == null ? 0 : bars.size());
            return MarketRegime.insufficientData(symbol);
        }

        // Windows shrink by one at the 20-bar minimum, where only 19 returns exist.
        int window = Math.min(SHORT_PERIOD, bars.size() - 1);
        double volatility = indicators.returnVolatilityPercent(bars, window).orElse(0.0);
        double volumeRatio = indicators.volumeRatio(bars, window).orElse(1.0);
        double sma20 = indicators.sma(bars, window).orElse(indicators.lastClose(bars));
        double sma50 = indicators.sma(bars, LONG_PERIOD).orElse(sma20);
        double close = indicators.lastClose(bars);

        Trend trend = Trend.SIDEWAYS;
        if (close > sma20 && sma20 > sma50) {
            trend = Trend.UP;
        } else if (close < sma20 && sma20 < sma50) {
            trend = Trend.DOWN;
        }

        double highThreshold = riskProperties.getHighVolatilityThreshold();
        VolatilityRegime volatilityRegime = volatility > highThreshold
                ? VolatilityRegime.HIGH
                : volatility > MEDIUM_VOLATILITY_THRESHOLD ? VolatilityRegime.MEDIUM : VolatilityRegime.LOW;

        Recommendation recommendation;
        if (volatility > highThreshold) {
            recommendation = Recommendation.HIGH_RISK;
        } else if (volumeRatio > ACTIVE_VOLUME_RATIO) {
            recommendation = Recommendation.ACTIVE_TRADING;
        } else {
            recommendation = Recommendation.NORMAL_TRADING;
        }

        return MarketRegime.builder()
                .symbol(symbol)
                .currentPrice(bars.get(bars.size() - 1).getClose())
                .volatilityPercent(volatility)
                .volatilityRegime(volatilityRegime)
                .trend(trend)
                .volumeRatio(volumeRatio)
                .sma20(sma20)
                .sma50(sma50)
                .priceVsSma20Percent(sma20 == 0.0 ? 0.0 : (close - sma20) / sma20 * 100.0)
                .dailyReturnPercent(indicators.dailyReturnPercent(bars).orElse(0.0))
                .recommendation(recommendation)
                .build();
    }

    // ==============================
    // UNIVERSE
    // ==============================

    public MarketOverview analyzeMarket(Map<String, List<Bar>> barsBySymbol) {
        Map<String, MarketRegime> regimes = new LinkedHashMap<>();
        barsBySymbol.forEach((symbol, bars) -> regimes.put(symbol, analyzeSymbol(symbol, bars)));

        List<MarketRegime> analyzed =
                regimes.values().stream().filter(MarketRegime::hasData).toList();
        int uptrends = (int) analyzed.stream().filter(r -> r.getTrend() == Trend.UP).count();
        int downtrends = (int) analyzed.stream().filter(r -> r.getTrend() == Trend.DOWN).count();
        double averageVolatility = analyzed.stream()
                .mapToDouble(MarketRegime::getVolatilityPercent)
                .average()
                .orElse(0.0);

        MarketSentiment sentiment = MarketSentiment.NEUTRAL;
        if (!analyzed.isEmpty()) {
            if (uptrends > analyzed.size() * SENTIMENT_MAJORITY) {
                sentiment = MarketSentiment.BULLISH;
            } else if (downtrends > analyzed.size() * SENTIMENT_MAJORITY) {
                sentiment = MarketSentiment.BEARISH;
            }
        }

        String recommendation = recommendationFor(sentiment, averageVolatility, analyzed.isEmpty());
        log.info(
                "Market analysis: {} of {} symbols analyzed, sentiment={}, avgVolatility={}%, up={}, down={}",
                analyzed.size(),
                regimes.size(),
                sentiment,
                String.format("%.2f", averageVolatility),
                uptrends,
                downtrends);

        return MarketOverview.builder()
                .analyzedAt(Instant.now(clock))
                .regimes(regimes)
                .sentiment(sentiment)
                .analyzedSymbols(analyzed.size())
                .uptrendCount(uptrends)
                .downtrendCount(downtrends)
                .averageVolatilityPercent(averageVolatility)
                .recommendation(recommendation)
                .build();
    }

    private String recommendationFor(MarketSentiment sentiment, double averageVolatility, boolean noData) {
        if (noData) {
            return "Could not analyze any symbols.";
        }
        if (averageVolatility > riskProperties.getHighVolatilityThreshold()) {
            return "High volatility detected. Trade with caution, reduce position sizes.";
        }
        switch (sentiment) {
            case BULLISH:
                return "Bullish market conditions. Look for long opportunities.";
            case BEARISH:
                return "Bearish market conditions. Look for short opportunities or stay defensive.";
            default:
                return "Neutral market. Focus on mean reversion strategies.";
        }
    }
}
