package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DatasetStatusResponse implements AnalysisResult {
    int uploaded;
    int total;
    List<Dataset> files;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Dataset {
        String category;
        String description;
        /** "uploaded" or "not_uploaded". */
        String status;
        Long rows;
        String destination;
    }
}
