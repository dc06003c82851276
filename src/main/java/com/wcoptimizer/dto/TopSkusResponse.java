package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TopSkusResponse implements AnalysisResult {
    int count;
    List<SkuSales> skus;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SkuSales {
        String sku;
        double revenue;
        double units;
        Double profit;
        long transactions;
    }
}
