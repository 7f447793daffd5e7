package com.salesboard.sales.model;

import java.util.List;

public record TransactionPage(
        long total,
        int limit,
        int offset,
        List<SalesTransaction> records
) {
}
