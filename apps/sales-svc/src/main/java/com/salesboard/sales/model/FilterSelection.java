package com.salesboard.sales.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Request-scoped filter state. Values inside one dimension are alternatives, dimensions are
 * combined with AND, and an empty dimension does not constrain anything.
 */
public record FilterSelection(
        List<String> regions,
        List<String> genders,
        List<AgeRange> ageRanges,
        List<String> categories,
        List<String> tags,
        List<String> paymentMethods,
        Optional<LocalDate> startDate,
        Optional<LocalDate> endDate,
        Optional<String> search
) {

    public FilterSelection {
        regions = clean(regions);
        genders = clean(genders);
        ageRanges = ageRanges == null ? List.of() : ageRanges.stream().filter(Objects::nonNull).distinct().toList();
        categories = clean(categories);
        tags = clean(tags);
        paymentMethods = clean(paymentMethods);
        startDate = startDate == null ? Optional.empty() : startDate;
        endDate = endDate == null ? Optional.empty() : endDate;
        search = search == null ? Optional.empty() : search.map(String::trim).filter(value -> !value.isEmpty());
    }

    public static FilterSelection empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Names of the dimensions that carry a constraint, for log output.
     */
    public List<String> activeDimensions() {
        List<String> active = new ArrayList<>();
        if (!regions.isEmpty()) active.add("customer_regions");
        if (!genders.isEmpty()) active.add("genders");
        if (!ageRanges.isEmpty()) active.add("age_ranges");
        if (!categories.isEmpty()) active.add("product_categories");
        if (!tags.isEmpty()) active.add("tags");
        if (!paymentMethods.isEmpty()) active.add("payment_methods");
        startDate.ifPresent(value -> active.add("start_date"));
        endDate.ifPresent(value -> active.add("end_date"));
        search.ifPresent(value -> active.add("search"));
        return active;
    }

    private static List<String> clean(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(value -> value != null && !value.isBlank())
                .distinct()
                .toList();
    }

    public static final class Builder {
        private List<String> regions;
        private List<String> genders;
        private final List<AgeRange> ageRanges = new ArrayList<>();
        private List<String> categories;
        private List<String> tags;
        private List<String> paymentMethods;
        private LocalDate startDate;
        private LocalDate endDate;
        private String search;

        private Builder() {
        }

        public Builder regions(List<String> regions) {
            this.regions = regions;
            return this;
        }

        public Builder genders(List<String> genders) {
            this.genders = genders;
            return this;
        }

        /**
         * Adds the parsable {@code start-end} tokens; malformed ones are dropped.
         */
        public Builder ageRangeTokens(Collection<String> tokens) {
            if (tokens != null) {
                tokens.forEach(token -> AgeRange.parse(token).ifPresent(ageRanges::add));
            }
            return this;
        }

        public Builder ageRanges(List<AgeRange> ranges) {
            if (ranges != null) {
                ageRanges.addAll(ranges);
            }
            return this;
        }

        public Builder categories(List<String> categories) {
            this.categories = categories;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder paymentMethods(List<String> paymentMethods) {
            this.paymentMethods = paymentMethods;
            return this;
        }

        public Builder startDate(LocalDate startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(LocalDate endDate) {
            this.endDate = endDate;
            return this;
        }

        public Builder search(String search) {
            this.search = search;
            return this;
        }

        public FilterSelection build() {
            return new FilterSelection(
                    regions,
                    genders,
                    ageRanges,
                    categories,
                    tags,
                    paymentMethods,
                    Optional.ofNullable(startDate),
                    Optional.ofNullable(endDate),
                    Optional.ofNullable(search)
            );
        }
    }
}
