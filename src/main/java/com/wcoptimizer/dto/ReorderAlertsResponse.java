package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ReorderAlertsResponse implements AnalysisResult {
    int criticalCount;
    int warningCount;
    List<Alert> alerts;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Alert {
        String sku;
        String locationId;
        double qtyOnHand;
        double reorderPoint;
        Double safetyStockTarget;
        Double daysOfSupply;
        /** on-hand over reorder point; absent when the reorder point is 0. */
        Double coverageRatio;
        String severity;
    }
}
