package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SingleSourceRiskResponse implements AnalysisResult {
    String source;
    String note;
    int total;
    List<Risk> risks;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Risk {
        String productId;
        String soleSupplierId;
        String soleSupplier;
        String risk;
    }
}
