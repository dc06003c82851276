package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SmartReorderResponse implements AnalysisResult {
    int count;
    List<Recommendation> recommendations;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Recommendation {
        String sku;
        String stockStatus;
        int priority;
        double qtyOnHand;
        double reorderPoint;
        Double daysOfSupply;
        long recommendedQty;
        String qtyBasis;
        Double leadTimeDays;
    }
}
