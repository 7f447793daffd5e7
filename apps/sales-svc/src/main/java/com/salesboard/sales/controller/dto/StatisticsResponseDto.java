package com.salesboard.sales.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StatisticsResponseDto(
        @JsonProperty("total_units") long totalUnits,
        @JsonProperty("total_amount") double totalAmount,
        @JsonProperty("total_discount") double totalDiscount,
        @JsonProperty("total_transactions") long totalTransactions
) {
}
