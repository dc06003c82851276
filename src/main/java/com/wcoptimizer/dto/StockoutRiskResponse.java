package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class StockoutRiskResponse implements AnalysisResult {
    int horizonDays;
    int count;
    List<Item> items;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Item {
        String sku;
        String locationId;
        double qtyOnHand;
        double daysOfSupply;
        String stockStatus;
    }
}
