package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Cash-cycle KPIs. A sub-metric that cannot be computed is reported as 0 with a
 * matching {@code *Note}; CCC is always derived from the three reported values.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class KpiSummaryResponse implements AnalysisResult {
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
    String formula;
    String unit;
    double dio;
    String dioNote;
    double dso;
    String dsoNote;
    double dpo;
    String dpoNote;
    double ccc;
}
