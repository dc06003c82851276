package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AlternativeSuppliersResponse implements AnalysisResult {
    String source;
    String note;
    String productId;
    Candidate current;
    List<Candidate> alternatives;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Candidate {
        String supplierId;
        String supplierName;
        Double leadTime;
        Double rating;
        String country;
    }
}
