package com.wcoptimizer.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SalesVelocityResponse implements AnalysisResult {
    int count;
    List<SkuVelocity> skus;

    @Value
    @Builder
    public static class SkuVelocity {
        String sku;
        double totalUnits;
        long sellingDays;
        double unitsPerDay;
    }
}
