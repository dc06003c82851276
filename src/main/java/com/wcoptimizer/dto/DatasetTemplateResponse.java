package com.wcoptimizer.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DatasetTemplateResponse {
    String category;
    String description;
    List<String> requiredColumns;
    List<String> optionalColumns;
    String destination;
}
