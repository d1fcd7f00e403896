package com.tradingagent.observability;

import com.tradingagent.event.PositionEvent;
import com.tradingagent.event.PositionEventType;
import com.tradingagent.event.RiskEvent;
import com.tradingagent.event.RiskEventType;
import com.tradingagent.risk.DailyRiskTracker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers the trading Micrometer metrics and keeps them current from application events.
 *
 * <ul>
 *   <li><b>trades.executed.count</b> (counter): positions opened on a confirmed entry fill</li>
 *   <li><b>trades.rejected.count</b> (counter): candidates rejected by pre-trade risk checks</li>
 *   <li><b>positions.closed.count</b> (counter): positions closed on a confirmed exit fill</li>
 *   <li><b>daily.pnl</b> (gauge): today's realised P&L, polled at scrape time</li>
 * </ul>
 */
@Service
public class TradingMetrics {

    private final Counter tradesExecutedCounter;
    private final Counter tradesRejectedCounter;
    private final Counter positionsClosedCounter;

    public TradingMetrics(MeterRegistry meterRegistry, DailyRiskTracker dailyRiskTracker) {
        this.tradesExecutedCounter = Counter.builder("trades.executed.count")
                .description("Entry orders filled and booked as open positions")
                .register(meterRegistry);

        this.tradesRejectedCounter = Counter.builder("trades.rejected.count")
                .description("Trade candidates rejected by pre-trade risk validation")
                .register(meterRegistry);

        this.positionsClosedCounter = Counter.builder("positions.closed.count")
                .description("Positions closed with realised P&L")
                .register(meterRegistry);

        meterRegistry.gauge(
                "daily.pnl", dailyRiskTracker, tracker -> tracker.getDailyPnl().doubleValue());
    }

    @EventListener
    @Order(20)
    public void onPositionEvent(PositionEvent event) {
        if (event.getEventType() == PositionEventType.OPENED) {
            tradesExecutedCounter.increment();
        } else if (event.getEventType() == PositionEventType.CLOSED) {
            positionsClosedCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        if (event.getEventType() == RiskEventType.TRADE_REJECTED) {
            tradesRejectedCounter.increment();
        }
    }
}
