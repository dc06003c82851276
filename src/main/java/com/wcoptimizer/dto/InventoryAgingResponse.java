package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class InventoryAgingResponse implements AnalysisResult {
    List<Bucket> agingBuckets;
    List<SkuAge> details;

    @Value
    @Builder
    public static class Bucket {
        String bucket;
        int skuCount;
        double totalUnits;
        double totalValue;
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SkuAge {
        String sku;
        double qtyOnHand;
        Double inventoryValue;
        double daysIdle;
        String bucket;
    }
}
