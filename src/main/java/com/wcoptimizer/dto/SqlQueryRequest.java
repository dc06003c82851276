package com.wcoptimizer.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class SqlQueryRequest {

    @NotBlank(message = "sql is required")
    String sql;
}
