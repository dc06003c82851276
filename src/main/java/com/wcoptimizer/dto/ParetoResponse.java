package com.wcoptimizer.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ParetoResponse implements AnalysisResult {
    String dimension;
    int totalSkus;
    int skusDriving80Pct;
    double pctOfSkus;
    double totalValue;
    List<Entry> paretoData;

    @Value
    @Builder
    public static class Entry {
        int rank;
        String sku;
        double value;
        double cumulativePct;
        String abcClass;
    }
}
