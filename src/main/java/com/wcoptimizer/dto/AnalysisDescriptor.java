package com.wcoptimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AnalysisDescriptor {
    String name;
    String group;
    String description;
    List<String> requires;
    List<Parameter> parameters;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Parameter {
        String name;
        String type;
        boolean required;
        Object defaultValue;
        String description;
    }
}
