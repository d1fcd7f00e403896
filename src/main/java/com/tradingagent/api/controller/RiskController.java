package com.tradingagent.api.controller;

import com.tradingagent.domain.model.RiskSummary;
import com.tradingagent.risk.RiskManager;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for portfolio risk.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/risk/summary -- exposure, risk at stop and daily loss headroom</li>
 *   <li>POST /api/risk/daily-reset -- zero the daily P&L and lift the daily loss breaker</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/risk")
public class RiskController {

    private static final Logger log = LoggerFactory.getLogger(RiskController.class);

    private final RiskManager riskManager;

    public RiskController(RiskManager riskManager) {
        this.riskManager = riskManager;
    }

    @GetMapping("/summary")
    public ResponseEntity<RiskSummary> getRiskSummary() {
        return ResponseEntity.ok(riskManager.getRiskSummary());
    }

    @PostMapping("/daily-reset")
    public ResponseEntity<Map<String, String>> resetDaily() {
        log.warn("Manual daily risk reset requested via API");
        riskManager.resetDaily();
        return ResponseEntity.ok(Map.of("message", "Daily risk counters reset"));
    }
}
