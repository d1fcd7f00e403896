package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.MarketSentiment;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Universe-wide view: one {@link MarketRegime} per symbol plus the aggregate sentiment. */
@Value
@Builder
public class MarketOverview {

    Instant analyzedAt;
    Map<String, MarketRegime> regimes;
    MarketSentiment sentiment;
    int analyzedSymbols;
    int uptrendCount;
    int downtrendCount;
    double averageVolatilityPercent;
    String recommendation;

    public MarketRegime regimeFor(String symbol) {
        MarketRegime regime = regimes.get(symbol);
        return regime != null ? regime : MarketRegime.insufficientData(symbol);
    }
}
