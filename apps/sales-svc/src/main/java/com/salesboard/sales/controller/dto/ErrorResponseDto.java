package com.salesboard.sales.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ErrorResponseDto(
        @JsonProperty("code") String code,
        @JsonProperty("message") String message,
        @JsonProperty("detail") String detail,
        @JsonProperty("trace_id") String traceId
) {
}
