package com.wcoptimizer.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class SqlQueryResponse implements AnalysisResult {
    List<String> columns;
    List<Map<String, Object>> rows;
    int rowCount;
    long totalRows;
    boolean truncated;
}
