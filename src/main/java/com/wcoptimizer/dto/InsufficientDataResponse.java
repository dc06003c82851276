package com.wcoptimizer.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class InsufficientDataResponse implements AnalysisResult {
    String analysis;
    String message;
    List<String> missing;

    public String getStatus() {
        return "insufficient_data";
    }
}
