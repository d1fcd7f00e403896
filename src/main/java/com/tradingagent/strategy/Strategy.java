package com.tradingagent.strategy;

import com.tradingagent.domain.model.Bar;
import com.tradingagent.domain.model.StrategyOutput;
import java.util.List;

/**
 * A signal generator over one symbol's bar history.
 *
 * <p>Implementations are pure with respect to their input: the same bars always produce the same
 * output. A series shorter than {@link #requiredBars()} yields a HOLD rather than an exception.
 */
public interface Strategy {

    /** Stable identifier used in signals, trades and backtest requests. */
    String getName();

    /** Minimum number of bars needed to produce anything other than HOLD. */
    int requiredBars();

    StrategyOutput generateSignal(String symbol, List<Bar> bars);
}
