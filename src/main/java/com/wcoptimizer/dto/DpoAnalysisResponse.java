package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DpoAnalysisResponse implements AnalysisResult {
    Double overallDpo;
    String dpoNote;
    List<SupplierDays> bySupplier;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SupplierDays {
        String supplierId;
        String supplierName;
        Double contractedPaymentDays;
        long invoices;
        double totalInvoiced;
        Double weightedDpo;
    }
}
