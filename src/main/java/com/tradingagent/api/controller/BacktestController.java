package com.tradingagent.api.controller;

import com.tradingagent.api.dto.request.BacktestRequest;
import com.tradingagent.backtest.Backtester;
import com.tradingagent.domain.model.BacktestResult;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/backtest")
public class BacktestController {

    private static final Logger log = LoggerFactory.getLogger(BacktestController.class);

    private final Backtester backtester;

    public BacktestController(Backtester backtester) {
        this.backtester = backtester;
    }

    /** Replays the named strategy over the symbol's history. Unknown strategy names answer 404. */
    @PostMapping
    public BacktestResult runBacktest(@Valid @RequestBody BacktestRequest request) {
        log.info(
                "Backtest requested: {} on {} over {} days",
                request.getStrategy(),
                request.getSymbol(),
                request.getLookbackDays());
        return backtester.backtest(request.getStrategy(), request.getSymbol(), request.getLookbackDays());
    }
}
