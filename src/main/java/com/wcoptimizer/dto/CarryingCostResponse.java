package com.wcoptimizer.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CarryingCostResponse implements AnalysisResult {
    double inventoryValue;
    double holdingCostPct;
    double annualCarryingCost;
    double monthlyCarryingCost;
    double dailyCarryingCost;
}
