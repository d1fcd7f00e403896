package com.tradingagent.reporting;

import com.tradingagent.domain.model.PerformanceSummary;
import com.tradingagent.domain.model.Trade;
import com.tradingagent.store.PositionStore;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Closed-trade statistics over a trailing window.
 *
 * <p>A trade counts toward the window when its exit falls within the last {@code days} days. Winners
 * have strictly positive P&L; everything else, including break-even, is a loser.
 */
@Service
public class PerformanceReportService {

    private static final Logger log = LoggerFactory.getLogger(PerformanceReportService.class);

    private final PositionStore positionStore;
    private final Clock clock;

    public PerformanceReportService(PositionStore positionStore, Clock clock) {
        this.positionStore = positionStore;
        this.clock = clock;
    }

    public PerformanceSummary getPerformanceSummary(int days) {
        Instant since = Instant.now(clock).minus(Duration.ofDays(days));
        List<BigDecimal> pnls = positionStore.getClosedTradesSince(since).stream()
                .map(Trade::getPnl)
                .filter(Objects::nonNull)
                .toList();

        if (pnls.isEmpty()) {
            return PerformanceSummary.builder()
                    .days(days)
                    .totalPnl(BigDecimal.ZERO)
                    .averagePnl(BigDecimal.ZERO)
                    .bestTrade(BigDecimal.ZERO)
                    .worstTrade(BigDecimal.ZERO)
                    .build();
        }

        int total = pnls.size();
        int winners = (int) pnls.stream().filter(pnl -> pnl.signum() > 0).count();
        BigDecimal totalPnl = pnls.stream().reduce(BigDecimal.ZERO, BigDecimal::add);

        PerformanceSummary summary = PerformanceSummary.builder()
                .days(days)
                .totalTrades(total)
                .winningTrades(winners)
                .losingTrades(total - winners)
                .winRate((double) winners / total)
                .totalPnl(totalPnl)
                .averagePnl(totalPnl.divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP))
                .bestTrade(pnls.stream().max(Comparator.naturalOrder()).orElse(BigDecimal.ZERO))
                .worstTrade(pnls.stream().min(Comparator.naturalOrder()).orElse(BigDecimal.ZERO))
                .build();
        log.debug("Performance over {} days: {} trades, {} winners, P&L {}", days, total, winners, totalPnl);
        return summary;
    }
}
