package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UploadHistoryResponse implements AnalysisResult {
    String note;
    List<Upload> uploads;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Upload {
        Long id;
        String category;
        String filename;
        LocalDateTime uploadedAt;
        long rowCount;
        String status;
    }
}
