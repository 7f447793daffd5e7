package com.salesboard.sales.model;

import java.math.BigDecimal;

public record SalesStatistics(
        long totalUnits,
        BigDecimal totalAmount,
        BigDecimal totalDiscount,
        long totalTransactions
) {
    public SalesStatistics {
        totalAmount = totalAmount == null ? BigDecimal.ZERO : totalAmount;
        totalDiscount = totalDiscount == null ? BigDecimal.ZERO : totalDiscount;
    }

    public static SalesStatistics empty() {
        return new SalesStatistics(0L, BigDecimal.ZERO, BigDecimal.ZERO, 0L);
    }
}
