package com.tradingagent.risk;

import com.tradingagent.config.TradingProperties;
import com.tradingagent.domain.model.RiskState;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holds the portfolio-level {@link RiskState}: portfolio value and the day's realised P&L.
 *
 * <p>The daily P&L resets the first time it is touched on a new trading day, as given by the injected
 * {@link Clock}. Updates come from the single cycle thread, but the REST surface reads concurrently, so
 * both values sit in {@link AtomicReference}s.
 */
@Component
public class DailyRiskTracker {

    private static final Logger log = LoggerFactory.getLogger(DailyRiskTracker.class);

    private final Clock clock;
    private final AtomicReference<BigDecimal> portfolioValue;
    private final AtomicReference<BigDecimal> dailyPnl = new AtomicReference<>(BigDecimal.ZERO);
    private volatile LocalDate currentDate;

    public DailyRiskTracker(TradingProperties tradingProperties, Clock clock) {
        this.clock = clock;
        this.portfolioValue = new AtomicReference<>(tradingProperties.getPortfolioValue());
        this.currentDate = LocalDate.now(clock);
    }

    public RiskState snapshot() {
        resetIfNewDay();
        return RiskState.builder()
                .tradingDay(currentDate)
                .portfolioValue(portfolioValue.get())
                .dailyPnl(dailyPnl.get())
                .build();
    }

    public BigDecimal getPortfolioValue() {
        return portfolioValue.get();
    }

    public BigDecimal getDailyPnl() {
        resetIfNewDay();
        return dailyPnl.get();
    }

    public void updatePortfolioValue(BigDecimal value) {
        if (value != null && value.signum() > 0) {
            portfolioValue.set(value);
        }
    }

    /** Adds a realised P&L amount (negative for losses) to today's total. */
    public BigDecimal recordRealisedPnl(BigDecimal pnl) {
        resetIfNewDay();
        BigDecimal total = dailyPnl.updateAndGet(current -> current.add(pnl));
        log.debug("Recorded realised P&L {}, daily total {}", pnl, total);
        return total;
    }

    /** Forces a reset of the daily counters, regardless of the date. */
    public void resetDaily() {
        currentDate = LocalDate.now(clock);
        dailyPnl.set(BigDecimal.ZERO);
        log.info("Daily risk counters reset for {}", currentDate);
    }

    void resetIfNewDay() {
        LocalDate today = LocalDate.now(clock);
        if (!today.equals(currentDate)) {
            log.info("New trading day {} (was {}), resetting daily P&L {}", today, currentDate, dailyPnl.get());
            currentDate = today;
            dailyPnl.set(BigDecimal.ZERO);
        }
    }
}
