package com.tradingagent.api.controller;

import com.tradingagent.domain.model.AccountSnapshot;
import com.tradingagent.domain.model.CycleReport;
import com.tradingagent.domain.model.Position;
import com.tradingagent.domain.model.PositionManagementReport;
import com.tradingagent.domain.model.Trade;
import com.tradingagent.execution.ExecutionAgent;
import com.tradingagent.orchestrator.TradingOrchestrator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Manual triggers for the two cycles plus read access to the position book and account.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/trading/cycle -- run one trading cycle</li>
 *   <li>POST /api/trading/positions/manage -- run one position management cycle</li>
 *   <li>GET /api/trading/positions -- open positions</li>
 *   <li>GET /api/trading/trades -- trade log, oldest first</li>
 *   <li>GET /api/trading/account -- venue account snapshot</li>
 *   <li>POST /api/trading/orders/cancel-all -- cancel every working order at the venue</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/trading")
public class TradingController {

    private static final Logger log = LoggerFactory.getLogger(TradingController.class);

    private final TradingOrchestrator tradingOrchestrator;
    private final ExecutionAgent executionAgent;

    public TradingController(TradingOrchestrator tradingOrchestrator, ExecutionAgent executionAgent) {
        this.tradingOrchestrator = tradingOrchestrator;
        this.executionAgent = executionAgent;
    }

    @PostMapping("/cycle")
    public ResponseEntity<CycleReport> runTradingCycle() {
        log.info("Trading cycle requested via API");
        return ResponseEntity.ok(tradingOrchestrator.runTradingCycle());
    }

    @PostMapping("/positions/manage")
    public ResponseEntity<PositionManagementReport> managePositions() {
        log.info("Position management requested via API");
        return ResponseEntity.ok(tradingOrchestrator.runPositionManagementCycle());
    }

    @GetMapping("/positions")
    public ResponseEntity<List<Position>> getPositions() {
        return ResponseEntity.ok(executionAgent.getOpenPositions());
    }

    @GetMapping("/trades")
    public ResponseEntity<List<Trade>> getTrades() {
        return ResponseEntity.ok(executionAgent.getTrades());
    }

    @GetMapping("/account")
    public ResponseEntity<AccountSnapshot> getAccount() {
        return ResponseEntity.ok(executionAgent.getAccount());
    }

    @PostMapping("/orders/cancel-all")
    public ResponseEntity<Map<String, Object>> cancelAllOrders() {
        log.warn("Cancel all orders requested via API");
        int cancelled = executionAgent.cancelAllOrders();
        return ResponseEntity.ok(Map.of("message", "Cancel all orders submitted", "ordersCancelled", cancelled));
    }
}
