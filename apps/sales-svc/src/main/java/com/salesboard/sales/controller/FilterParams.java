package com.salesboard.sales.controller;

import com.salesboard.sales.model.FilterSelection;
import java.time.LocalDate;
import java.util.List;

/**
 * Maps the shared multi-select query parameters of the listing and statistics endpoints to a
 * {@link FilterSelection}, so both endpoints interpret a request identically.
 */
final class FilterParams {

    private FilterParams() {
    }

    static FilterSelection toSelection(
            List<String> customerRegions,
            List<String> genders,
            List<String> ageRanges,
            List<String> productCategories,
            List<String> tags,
            List<String> paymentMethods,
            LocalDate startDate,
            LocalDate endDate,
            String search
    ) {
        return FilterSelection.builder()
                .regions(customerRegions)
                .genders(genders)
                .ageRangeTokens(ageRanges)
                .categories(productCategories)
                .tags(tags)
                .paymentMethods(paymentMethods)
                .startDate(startDate)
                .endDate(endDate)
                .search(search)
                .build();
    }
}
