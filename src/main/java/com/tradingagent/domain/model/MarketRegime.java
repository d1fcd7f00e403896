package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.Recommendation;
import com.tradingagent.domain.enums.Trend;
import com.tradingagent.domain.enums.VolatilityRegime;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Per-symbol market state, recomputed every cycle by {@code MarketAnalyzer}.
 *
 * <p>{@code volatilityPercent}, {@code priceVsSma20Percent} and {@code dailyReturnPercent} are
 * percentages (already multiplied by 100), matching how the values are quoted to operators.
 */
@Value
@Builder
public class MarketRegime {

    String symbol;
    BigDecimal currentPrice;
    double volatilityPercent;
    VolatilityRegime volatilityRegime;
    Trend trend;
    double volumeRatio;
    double sma20;
    double sma50;
    double priceVsSma20Percent;
    double dailyReturnPercent;
    Recommendation recommendation;

    public static MarketRegime insufficientData(String symbol) {
        return MarketRegime.builder()
                .symbol(symbol)
                .trend(Trend.SIDEWAYS)
                .volatilityRegime(VolatilityRegime.LOW)
                .recommendation(Recommendation.INSUFFICIENT_DATA)
                .build();
    }

    public boolean hasData() {
        return recommendation != Recommendation.INSUFFICIENT_DATA;
    }

    public boolean isHighVolatility() {
        return volatilityRegime == VolatilityRegime.HIGH;
    }
}
