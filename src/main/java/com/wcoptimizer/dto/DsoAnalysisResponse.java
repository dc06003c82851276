package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DsoAnalysisResponse implements AnalysisResult {
    Double overallDso;
    String dsoNote;
    List<CustomerDays> byCustomer;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CustomerDays {
        String customerId;
        String customerName;
        String segment;
        long invoices;
        double totalBilled;
        Double weightedDso;
    }
}
