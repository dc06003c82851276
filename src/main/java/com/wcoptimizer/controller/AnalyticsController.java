package com.wcoptimizer.controller;

import com.wcoptimizer.config.WcOptimizerProperties;
import com.wcoptimizer.dto.AnalysisResult;
import com.wcoptimizer.service.CashCycleService;
import com.wcoptimizer.service.ClassificationService;
import com.wcoptimizer.service.DemandAnalyticsService;
import com.wcoptimizer.service.InventoryPolicyService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Validated
@RestController
@RequestMapping("/api/v1/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private final CashCycleService cashCycle;
    private final ClassificationService classification;
    private final InventoryPolicyService inventory;
    private final DemandAnalyticsService demand;
    private final WcOptimizerProperties properties;

    @GetMapping("/kpi/summary")
    public ResponseEntity<AnalysisResult> kpiSummary() {
        return ResponseEntity.ok(cashCycle.kpiSummary());
    }

    @GetMapping("/abc-xyz")
    public ResponseEntity<AnalysisResult> abcXyz(
            @RequestParam(defaultValue = "100") @Min(1) @Max(10000) int limit) {
        return ResponseEntity.ok(classification.abcXyz(limit));
    }

    @GetMapping("/reorder-alerts")
    public ResponseEntity<AnalysisResult> reorderAlerts() {
        return ResponseEntity.ok(inventory.reorderAlerts());
    }

    @GetMapping("/dead-stock")
    public ResponseEntity<AnalysisResult> deadStock(
            @RequestParam(required = false) @Min(1) @Max(3650) Integer days) {
        int threshold = days != null ? days : properties.getPolicy().getDeadStockDays();
        return ResponseEntity.ok(inventory.deadStock(threshold));
    }

    @GetMapping("/stockout-risk")
    public ResponseEntity<AnalysisResult> stockoutRisk(
            @RequestParam(required = false) @Min(1) @Max(365) Integer horizonDays) {
        int horizon = horizonDays != null ? horizonDays : properties.getPolicy().getStockoutHorizonDays();
        return ResponseEntity.ok(inventory.stockoutRisk(horizon));
    }

    @GetMapping("/top-skus")
    public ResponseEntity<AnalysisResult> topSkus(
            @RequestParam(defaultValue = "20") @Min(1) @Max(1000) int limit) {
        return ResponseEntity.ok(demand.topSkus(limit));
    }
}
