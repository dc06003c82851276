package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SupplierRiskResponse implements AnalysisResult {
    int count;
    int highRisk;
    int mediumRisk;
    int lowRisk;
    List<SupplierScore> suppliers;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SupplierScore {
        String supplierId;
        String supplierName;
        Double leadTime;
        Double otdRate;
        Double qrr;
        double riskScore;
        String riskLevel;
    }
}
