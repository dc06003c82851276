package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DemandForecastResponse implements AnalysisResult {
    String productId;
    int historicalDays;
    int window;
    int horizonDays;
    double movingAverage;
    Double priorMovingAverage;
    String trend;
    double totalPredicted;
}
