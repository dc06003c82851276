package com.wcoptimizer.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class DataQualityResponse implements AnalysisResult {
    List<TableQuality> tables;

    @Value
    @Builder
    public static class TableQuality {
        String table;
        long rows;
        int columns;
        /** Only columns with at least one null. */
        Map<String, Long> nullCounts;
        long duplicateRows;
        int qualityScore;
    }
}
