package com.tradingagent.marketdata;

import com.tradingagent.domain.model.Bar;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Source of daily OHLCV history and latest prices.
 *
 * <p>Failures reaching the source throw {@link com.tradingagent.exception.MarketDataException}. A symbol
 * the source simply has no data for is left out of the result instead.
 */
public interface MarketDataSource {

    /**
     * Daily bars covering the last {@code lookbackDays} calendar days, per symbol, oldest first.
     * Symbols without data are absent from the map; iteration follows {@code symbols}.
     */
    Map<String, List<Bar>> getBars(List<String> symbols, int lookbackDays);

    Optional<BigDecimal> getLatestPrice(String symbol);
}
