package com.tradingagent.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One OHLCV sample for a symbol at a fixed timeframe. Series handed to indicators and strategies are
 * ordered by ascending {@code timestamp}.
 */
@Value
@Builder
public class Bar {

    Instant timestamp;
    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;
    long volume;
}
