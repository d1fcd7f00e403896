package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.ExitType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ExitDecision {

    String symbol;
    boolean shouldClose;
    ExitType exitType;
    BigDecimal price;
    String reason;

    public static ExitDecision hold(String symbol, BigDecimal price, String reason) {
        return ExitDecision.builder()
                .symbol(symbol)
                .shouldClose(false)
                .price(price)
                .reason(reason)
                .build();
    }

    public static ExitDecision close(String symbol, BigDecimal price, ExitType exitType, String reason) {
        return ExitDecision.builder()
                .symbol(symbol)
                .shouldClose(true)
                .exitType(exitType)
                .price(price)
                .reason(reason)
                .build();
    }
}
