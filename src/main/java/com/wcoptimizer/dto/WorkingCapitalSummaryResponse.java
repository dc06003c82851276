package com.wcoptimizer.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class WorkingCapitalSummaryResponse implements AnalysisResult {
    double totalTrappedCash;
    long totalUnits;
    int skuCount;
    List<SkuCash> topSkus;

    @Value
    @Builder
    public static class SkuCash {
        String sku;
        long totalUnits;
        double trappedCash;
        double sharePct;
    }
}
