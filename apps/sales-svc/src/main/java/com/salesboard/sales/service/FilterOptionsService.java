package com.salesboard.sales.service;

import com.salesboard.sales.model.AgeRange;
import com.salesboard.sales.model.CategoricalDimension;
import com.salesboard.sales.model.FilterOptions;
import com.salesboard.sales.model.TagListCodec;
import com.salesboard.sales.repository.SalesTransactionRepository;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Dropdown choices for the dashboard. Always computed over the whole store so the available
 * options do not shrink while the user narrows a selection.
 */
@Service
public class FilterOptionsService {
    private static final Logger log = LoggerFactory.getLogger(FilterOptionsService.class);

    private final SalesTransactionRepository salesTransactionRepository;

    public FilterOptionsService(SalesTransactionRepository salesTransactionRepository) {
        this.salesTransactionRepository = salesTransactionRepository;
    }

    @Transactional(readOnly = true)
    public FilterOptions loadOptions() {
        FilterOptions options = new FilterOptions(
                distinctSorted(CategoricalDimension.CUSTOMER_REGION),
                distinctSorted(CategoricalDimension.GENDER),
                ageRangeTokens(),
                distinctSorted(CategoricalDimension.PRODUCT_CATEGORY),
                tagUnion(),
                distinctSorted(CategoricalDimension.PAYMENT_METHOD)
        );
        log.debug("Filter options loaded: regions={} genders={} ageRanges={} categories={} tags={} paymentMethods={}",
                options.customerRegions().size(), options.genders().size(), options.ageRanges().size(),
                options.productCategories().size(), options.tags().size(), options.paymentMethods().size());
        return options;
    }

    private List<String> distinctSorted(CategoricalDimension dimension) {
        // ordering is applied here, not by the database, so it does not depend on collation
        return List.copyOf(salesTransactionRepository.findDistinctValues(dimension).stream()
                .filter(Objects::nonNull)
                .filter(value -> !value.isBlank())
                .collect(Collectors.toCollection(TreeSet::new)));
    }

    private List<String> tagUnion() {
        TreeSet<String> tags = new TreeSet<>();
        for (String encoded : salesTransactionRepository.findEncodedTags()) {
            tags.addAll(TagListCodec.decode(encoded));
        }
        tags.removeIf(String::isBlank);
        return List.copyOf(tags);
    }

    private List<String> ageRangeTokens() {
        return salesTransactionRepository.findAgeBounds()
                .map(bounds -> AgeRange.buckets(bounds.min(), bounds.max()).stream()
                        .map(AgeRange::token)
                        .toList())
                .orElse(List.of());
    }
}
