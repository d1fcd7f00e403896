package com.tradingagent.api.controller;

import com.tradingagent.domain.model.PerformanceSummary;
import com.tradingagent.reporting.PerformanceReportService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Trading performance reports.
 *
 * <p>{@code GET /api/reports/performance?days=30} -- closed-trade statistics over the trailing window.
 */
@RestController
@Validated
@RequestMapping("/api/reports")
public class ReportController {

    private final PerformanceReportService performanceReportService;

    public ReportController(PerformanceReportService performanceReportService) {
        this.performanceReportService = performanceReportService;
    }

    @GetMapping("/performance")
    public PerformanceSummary getPerformance(@RequestParam(defaultValue = "30") @Min(1) @Max(3650) int days) {
        return performanceReportService.getPerformanceSummary(days);
    }
}
