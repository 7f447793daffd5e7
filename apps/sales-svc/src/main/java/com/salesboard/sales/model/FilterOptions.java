package com.salesboard.sales.model;

import java.util.List;

public record FilterOptions(
        List<String> customerRegions,
        List<String> genders,
        List<String> ageRanges,
        List<String> productCategories,
        List<String> tags,
        List<String> paymentMethods
) {
}
