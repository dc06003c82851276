package com.wcoptimizer.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class AnomalyResponse implements AnalysisResult {
    String table;
    String column;
    double zThreshold;
    long observations;
    double mean;
    double stdDev;
    long anomaliesFound;
    List<Anomaly> anomalies;

    @Value
    @Builder
    public static class Anomaly {
        double value;
        double zScore;
        /** The full source row; its columns depend on the uploaded table. */
        Map<String, Object> row;
    }
}
