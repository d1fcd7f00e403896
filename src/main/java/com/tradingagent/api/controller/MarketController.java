package com.tradingagent.api.controller;

import com.tradingagent.domain.model.MarketOverview;
import com.tradingagent.orchestrator.TradingOrchestrator;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Market regime analysis of the configured universe. */
@RestController
@RequestMapping("/api/market")
public class MarketController {

    private final TradingOrchestrator tradingOrchestrator;

    public MarketController(TradingOrchestrator tradingOrchestrator) {
        this.tradingOrchestrator = tradingOrchestrator;
    }

    @GetMapping("/analysis")
    public MarketOverview getAnalysis() {
        return tradingOrchestrator.getMarketOverview();
    }
}
