package com.salesboard.sales.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;
import java.util.List;

public record TransactionResponseDto(
        @JsonProperty("transaction_id") String transactionId,
        @JsonProperty("date") LocalDate date,
        @JsonProperty("customer_id") String customerId,
        @JsonProperty("customer_name") String customerName,
        @JsonProperty("phone_number") String phoneNumber,
        @JsonProperty("gender") String gender,
        @JsonProperty("age") Integer age,
        @JsonProperty("customer_region") String customerRegion,
        @JsonProperty("product_category") String productCategory,
        @JsonProperty("quantity") Integer quantity,
        @JsonProperty("price_per_unit") double pricePerUnit,
        @JsonProperty("total_amount") double totalAmount,
        @JsonProperty("discount") double discount,
        @JsonProperty("payment_method") String paymentMethod,
        @JsonProperty("tags") List<String> tags
) {
}
