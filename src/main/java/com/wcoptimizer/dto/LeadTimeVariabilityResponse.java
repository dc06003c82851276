package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LeadTimeVariabilityResponse implements AnalysisResult {
    String source;
    String note;
    List<SupplierLeadTime> suppliers;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SupplierLeadTime {
        String supplierId;
        String supplierName;
        Double leadTime;
        Double rating;
    }
}
