package com.salesboard.sales.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record TransactionsListResponseDto(
        @JsonProperty("total") long total,
        @JsonProperty("limit") int limit,
        @JsonProperty("offset") int offset,
        @JsonProperty("data") List<TransactionResponseDto> data
) {
}
