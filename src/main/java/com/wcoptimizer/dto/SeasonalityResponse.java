package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SeasonalityResponse implements AnalysisResult {
    String sku;
    double monthlyAverage;
    Integer peakMonth;
    Integer lowMonth;
    List<Month> months;

    @Value
    @Builder
    public static class Month {
        int month;
        double units;
        double revenue;
        double seasonalityIndex;
    }
}
