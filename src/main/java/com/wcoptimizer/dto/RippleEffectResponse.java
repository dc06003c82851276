package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RippleEffectResponse implements AnalysisResult {
    String source;
    String note;
    String supplierId;
    String supplier;
    List<String> impacted;
    int count;
    String severity;
}
