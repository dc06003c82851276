package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SafetyStockResponse implements AnalysisResult {
    double serviceLevel;
    double zScore;
    List<SkuSafetyStock> results;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SkuSafetyStock {
        String sku;
        double demandStdDev;
        double leadTimeDays;
        long safetyStock;
        String note;
    }
}
