package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UploadResponse {
    String category;
    String table;
    String filename;
    long rows;
    List<String> columns;
    boolean valid;
    List<String> missingColumns;
    String destination;
    Boolean graphSynced;
    String graphNote;
}
