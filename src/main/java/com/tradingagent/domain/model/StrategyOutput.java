package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.SignalAction;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * What a single strategy thinks about a symbol right now.
 *
 * <p>{@code strength} is in [0, 1]. Price levels are only populated on entry signals.
 */
@Value
@Builder
public class StrategyOutput {

    String strategyName;
    SignalAction action;
    double strength;
    BigDecimal entryPrice;
    BigDecimal stopLoss;
    BigDecimal targetPrice;
    String reason;

    public static StrategyOutput hold(String strategyName, String reason) {
        return StrategyOutput.builder()
                .strategyName(strategyName)
                .action(SignalAction.HOLD)
                .strength(0.0)
                .reason(reason)
                .build();
    }

    public boolean isEntry() {
        return action == SignalAction.LONG || action == SignalAction.SHORT;
    }
}
