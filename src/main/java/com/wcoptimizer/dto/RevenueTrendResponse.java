package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class RevenueTrendResponse implements AnalysisResult {
    String granularity;
    int periods;
    List<Period> trends;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Period {
        @JsonFormat(pattern = "yyyy-MM-dd")
        LocalDate period;
        double revenue;
        double units;
        long transactions;
        Double growthPct;
    }
}
