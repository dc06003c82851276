package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SupplierConcentrationResponse implements AnalysisResult {
    double top3ValuePct;
    String concentrationRisk;
    List<SupplierShare> suppliers;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SupplierShare {
        String supplierId;
        long orders;
        Double totalValue;
        Double valuePct;
    }
}
