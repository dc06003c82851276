package com.wcoptimizer.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class SchemaInfoResponse implements AnalysisResult {
    String table;
    long rowCount;
    List<Column> columns;
    List<Map<String, Object>> sample;

    @Value
    @Builder
    public static class Column {
        String name;
        String type;
    }
}
