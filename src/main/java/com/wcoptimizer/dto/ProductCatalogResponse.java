package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ProductCatalogResponse implements AnalysisResult {
    int total;
    List<Product> products;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Product {
        String productId;
        String productName;
        String category;
        String subcategory;
        Double unitCost;
        Double unitPrice;
        String supplierId;
        Double leadTimeDays;
        String abcClass;
        String xyzClass;
    }
}
