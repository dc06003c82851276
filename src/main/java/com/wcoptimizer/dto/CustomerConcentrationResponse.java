package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CustomerConcentrationResponse implements AnalysisResult {
    int topN;
    double topNSharePct;
    String concentrationRisk;
    List<CustomerShare> customers;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CustomerShare {
        String customerId;
        String customerName;
        double revenue;
        double revenuePct;
        long uniqueProducts;
    }
}
