package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SupplierNetworkResponse implements AnalysisResult {
    /** "graph" or "tabular". */
    String source;
    String note;
    int relationships;
    List<Edge> network;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Edge {
        String supplierId;
        String supplierName;
        Double leadTime;
        String productId;
    }
}
