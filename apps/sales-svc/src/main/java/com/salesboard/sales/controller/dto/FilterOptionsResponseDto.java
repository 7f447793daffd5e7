package com.salesboard.sales.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record FilterOptionsResponseDto(
        @JsonProperty("customer_regions") List<String> customerRegions,
        @JsonProperty("genders") List<String> genders,
        @JsonProperty("age_ranges") List<String> ageRanges,
        @JsonProperty("product_categories") List<String> productCategories,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("payment_methods") List<String> paymentMethods
) {
}
