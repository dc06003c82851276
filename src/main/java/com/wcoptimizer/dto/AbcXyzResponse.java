package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class AbcXyzResponse implements AnalysisResult {
    int totalSkus;
    Map<String, Integer> matrix;
    List<Entry> skus;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Entry {
        String sku;
        String productName;
        String category;
        /** Null for products classified by the master alone, with no sales. */
        Double revenue;
        Double cumulativePct;
        Double coefficientOfVariation;
        String abcClass;
        String xyzClass;
        String segment;
        /** "computed", "product_master" or "mixed". */
        String classificationSource;
    }
}
