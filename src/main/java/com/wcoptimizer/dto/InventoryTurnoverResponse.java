package com.wcoptimizer.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class InventoryTurnoverResponse implements AnalysisResult {
    int count;
    List<SkuTurnover> skus;

    @Value
    @Builder
    public static class SkuTurnover {
        String sku;
        double qtyOnHand;
        double inventoryValue;
        double unitsSold;
        double revenue;
        double turnoverRatio;
    }
}
