package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class DatabaseStatusResponse implements AnalysisResult {
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant checkedAt;
    TabularStatus tabular;
    GraphStatus graph;

    @Value
    @Builder
    public static class TabularStatus {
        String status;
        int tableCount;
        Map<String, Long> tables;
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class GraphStatus {
        /** "connected" or "unavailable". */
        String status;
        Long suppliers;
        Long products;
        Long relationships;
        String reason;
    }
}
