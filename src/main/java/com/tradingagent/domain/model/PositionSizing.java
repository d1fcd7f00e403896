package com.tradingagent.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Result of risk-based sizing. {@code riskFraction} and {@code positionFraction} are fractions of the
 * portfolio value in [0, 1].
 */
@Value
@Builder
public class PositionSizing {

    int quantity;
    BigDecimal positionValue;
    BigDecimal riskPerShare;
    BigDecimal riskAmount;
    double riskFraction;
    double positionFraction;
    boolean approved;
    String reason;

    public static PositionSizing rejected(String reason) {
        return PositionSizing.builder()
                .quantity(0)
                .positionValue(BigDecimal.ZERO)
                .riskPerShare(BigDecimal.ZERO)
                .riskAmount(BigDecimal.ZERO)
                .approved(false)
                .reason(reason)
                .build();
    }
}
