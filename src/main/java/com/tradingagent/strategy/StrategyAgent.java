package com.tradingagent.strategy;

import com.tradingagent.domain.enums.SignalAction;
import com.tradingagent.domain.enums.TradeAction;
import com.tradingagent.domain.model.Bar;
import com.tradingagent.domain.model.CombinedSignal;
import com.tradingagent.domain.model.MarketOverview;
import com.tradingagent.domain.model.MarketRegime;
import com.tradingagent.domain.model.StrategyOutput;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs every registered {@link Strategy} on a symbol and fuses their outputs into one
 * {@link CombinedSignal}.
 *
 * <p>Fusion rules:
 * <ul>
 *   <li>Any CLOSE vote wins outright, with confidence {@code closeVotes / total}.</li>
 *   <li>Otherwise BUY (or SELL) wins only with strictly more votes than both the opposite side and
 *       HOLD; every other split is HOLD with confidence 0.</li>
 *   <li>A winning BUY/SELL has confidence {@code (votes / total) * mean strength of the agreeing
 *       strategies}.</li>
 *   <li>High-volatility regimes multiply the confidence by {@value #HIGH_VOLATILITY_DISCOUNT}.</li>
 * </ul>
 * Price levels come from the strongest agreeing strategy.
 */
@Service
public class StrategyAgent {

    private static final Logger log = LoggerFactory.getLogger(StrategyAgent.class);

    public static final int MIN_BARS = 50;
    static final double HIGH_VOLATILITY_DISCOUNT = 0.7;
    static final double SCAN_MIN_CONFIDENCE = 0.3;

    private final List<Strategy> strategies;

    public StrategyAgent(List<Strategy> strategies) {
        this.strategies = List.copyOf(strategies);
        log.info(
                "StrategyAgent initialized with strategies: {}",
                this.strategies.stream().map(Strategy::getName).toList());
    }

    public List<Strategy> getStrategies() {
        return strategies;
    }

    public Optional<Strategy> findStrategy(String name) {
        return strategies.stream().filter(s -> s.getName().equals(name)).findFirst();
    }

    // ==============================
    // SIGNAL GENERATION
    // ==============================

    public CombinedSignal generateSignal(String symbol, List<Bar> bars, MarketRegime regime) {
        if (bars == null || bars.size() < MIN_BARS) {
            return CombinedSignal.hold(symbol, "Insufficient data", List.of());
        }
        List<StrategyOutput> outputs = new ArrayList<>(strategies.size());
        for (Strategy strategy : strategies) {
            outputs.add(strategy.generateSignal(symbol, bars));
        }
        return combine(symbol, outputs, regime);
    }

    /** Fuses already-computed strategy outputs. Pure: no I/O and no state. */
    public CombinedSignal combine(String symbol, List<StrategyOutput> outputs, MarketRegime regime) {
        if (outputs.isEmpty()) {
            return CombinedSignal.hold(symbol, "No strategies registered", outputs);
        }
        int total = outputs.size();
        int buyVotes = count(outputs, SignalAction.LONG);
        int sellVotes = count(outputs, SignalAction.SHORT);
        int closeVotes = count(outputs, SignalAction.CLOSE);
        int holdVotes = count(outputs, SignalAction.HOLD);

        TradeAction action;
        double confidence;
        String reasoning;
        SignalAction agreeing = null;

        if (closeVotes > 0) {
            action = TradeAction.CLOSE;
            confidence = (double) closeVotes / total;
            reasoning = String.format("%d/%d strategies suggest closing", closeVotes, total);
        } else if (buyVotes > sellVotes && buyVotes > holdVotes) {
            action = TradeAction.BUY;
            agreeing = SignalAction.LONG;
            confidence = (double) buyVotes / total * averageStrength(outputs, agreeing);
            reasoning = String.format("%d/%d strategies suggest buying", buyVotes, total);
        } else if (sellVotes > buyVotes && sellVotes > holdVotes) {
            action = TradeAction.SELL;
            agreeing = SignalAction.SHORT;
            confidence = (double) sellVotes / total * averageStrength(outputs, agreeing);
            reasoning = String.format("%d/%d strategies suggest selling", sellVotes, total);
        } else {
            return CombinedSignal.hold(symbol, "No clear consensus from strategies", outputs);
        }

        if (regime != null && regime.isHighVolatility()) {
            confidence *= HIGH_VOLATILITY_DISCOUNT;
            reasoning += " (reduced due to high volatility)";
        }

        CombinedSignal.CombinedSignalBuilder builder = CombinedSignal.builder()
                .symbol(symbol)
                .action(action)
                .confidence(Math.max(0.0, Math.min(1.0, confidence)))
                .reasoning(reasoning)
                .strategyOutputs(List.copyOf(outputs));

        if (agreeing != null) {
            SignalAction side = agreeing;
            outputs.stream()
                    .filter(o -> o.getAction() == side)
                    .max(Comparator.comparingDouble(StrategyOutput::getStrength))
                    .ifPresent(strongest -> builder.entryPrice(strongest.getEntryPrice())
                            .stopLoss(strongest.getStopLoss())
                            .targetPrice(strongest.getTargetPrice()));
        }
        return builder.build();
    }

    // ==============================
    // UNIVERSE SCAN
    // ==============================

    /**
     * Returns entry opportunities (BUY/SELL with confidence above {@value #SCAN_MIN_CONFIDENCE}), highest
     * confidence first. Ties keep the universe order.
     */
    public List<CombinedSignal> scanUniverse(Map<String, List<Bar>> barsBySymbol, MarketOverview overview) {
        List<CombinedSignal> opportunities = new ArrayList<>();
        barsBySymbol.forEach((symbol, bars) -> {
            MarketRegime regime = overview != null ? overview.regimeFor(symbol) : null;
            CombinedSignal signal = generateSignal(symbol, bars, regime);
            log.debug(
                    "{}: {} (confidence {}) {}",
                    symbol,
                    signal.getAction(),
                    signal.getConfidence(),
                    signal.getReasoning());
            if (signal.isEntry() && signal.getConfidence() > SCAN_MIN_CONFIDENCE) {
                opportunities.add(signal);
            }
        });
        opportunities.sort(Comparator.comparingDouble(CombinedSignal::getConfidence).reversed());
        log.info("Universe scan: {} opportunities from {} symbols", opportunities.size(), barsBySymbol.size());
        return opportunities;
    }

    private static int count(List<StrategyOutput> outputs, SignalAction action) {
        return (int) outputs.stream().filter(o -> o.getAction() == action).count();
    }

    private static double averageStrength(List<StrategyOutput> outputs, SignalAction action) {
        return outputs.stream()
                .filter(o -> o.getAction() == action)
                .mapToDouble(StrategyOutput::getStrength)
                .average()
                .orElse(0.0);
    }
}
