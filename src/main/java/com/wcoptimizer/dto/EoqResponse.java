package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class EoqResponse implements AnalysisResult {
    double orderCost;
    double holdingCostPct;
    List<SkuEoq> results;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SkuEoq {
        String sku;
        double annualDemand;
        double unitCost;
        double holdingCostPerUnit;
        long eoq;
        String note;
    }
}
