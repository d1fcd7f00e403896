package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.TradeAction;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * The fused decision for one symbol. {@code confidence} is in [0, 1]; price levels are copied from the
 * strongest strategy that agreed with the winning action.
 */
@Value
@Builder
public class CombinedSignal {

    String symbol;
    TradeAction action;
    double confidence;
    String reasoning;
    BigDecimal entryPrice;
    BigDecimal stopLoss;
    BigDecimal targetPrice;
    List<StrategyOutput> strategyOutputs;

    public static CombinedSignal hold(String symbol, String reasoning, List<StrategyOutput> outputs) {
        return CombinedSignal.builder()
                .symbol(symbol)
                .action(TradeAction.HOLD)
                .confidence(0.0)
                .reasoning(reasoning)
                .strategyOutputs(outputs != null ? List.copyOf(outputs) : List.of())
                .build();
    }

    public boolean isEntry() {
        return action == TradeAction.BUY || action == TradeAction.SELL;
    }
}
