package com.wcoptimizer.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CccSimulationResponse implements AnalysisResult {
    double annualRevenue;
    String revenueBasis;
    double dailyRevenue;
    double totalDaysSaved;
    double totalCashFreed;
    List<Lever> breakdown;

    @Value
    @Builder
    public static class Lever {
        String action;
        double days;
        double cash;
    }
}
