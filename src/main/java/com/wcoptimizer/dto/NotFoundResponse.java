package com.wcoptimizer.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class NotFoundResponse implements AnalysisResult {
    String analysis;
    String message;

    public String getStatus() {
        return "not_found";
    }
}
