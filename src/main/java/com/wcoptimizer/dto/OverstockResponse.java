package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class OverstockResponse implements AnalysisResult {
    int count;
    double totalValue;
    List<Item> items;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Item {
        String sku;
        String locationId;
        double qtyOnHand;
        Double reorderPoint;
        double inventoryValue;
        Double daysOfSupply;
    }
}
