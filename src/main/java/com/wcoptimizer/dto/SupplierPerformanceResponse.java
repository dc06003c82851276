package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SupplierPerformanceResponse implements AnalysisResult {
    int count;
    List<SupplierMetrics> suppliers;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SupplierMetrics {
        String supplierId;
        String supplierName;
        String country;
        Double avgLeadTimeDays;
        Double onTimeDeliveryRate;
        Double qualityRejectionRate;
        Double riskScore;
        Double rating;
    }
}
