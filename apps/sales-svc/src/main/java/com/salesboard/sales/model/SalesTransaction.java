package com.salesboard.sales.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record SalesTransaction(
        String transactionId,
        LocalDate date,
        String customerId,
        String customerName,
        String phoneNumber,
        String gender,
        Integer age,
        String customerRegion,
        String productCategory,
        Integer quantity,
        BigDecimal pricePerUnit,
        BigDecimal totalAmount,
        BigDecimal discount,
        String paymentMethod,
        List<String> tags
) {
    public SalesTransaction {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
