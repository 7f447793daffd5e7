package com.salesboard.sales.service;

import com.salesboard.sales.config.SalesboardProperties;
import com.salesboard.sales.model.FilterSelection;
import com.salesboard.sales.model.SortSpec;
import com.salesboard.sales.model.TransactionPage;
import com.salesboard.sales.repository.SalesTransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TransactionListingService {
    private static final Logger log = LoggerFactory.getLogger(TransactionListingService.class);

    private final SalesTransactionRepository salesTransactionRepository;
    private final SalesboardProperties properties;

    public TransactionListingService(SalesTransactionRepository salesTransactionRepository,
                                     SalesboardProperties properties) {
        this.salesTransactionRepository = salesTransactionRepository;
        this.properties = properties;
    }

    /**
     * Filters, orders and windows the store. The limit is clamped into the configured range
     * and the returned total counts every matching row, not just the page.
     */
    @Transactional(readOnly = true)
    public TransactionPage list(FilterSelection selection, String sortBy, String sortOrder, Integer limit, Integer offset) {
        int safeLimit = properties.query().clampLimit(limit);
        int safeOffset = offset == null ? 0 : Math.max(offset, 0);
        SortSpec sort = SortSpec.resolve(sortBy, sortOrder);
        log.debug("Listing transactions filters={} sort={} desc={} limit={} offset={}",
                selection.activeDimensions(), sort.field().apiName(), sort.descending(), safeLimit, safeOffset);

        var result = salesTransactionRepository.findPage(selection, sort, safeOffset, safeLimit);
        return new TransactionPage(result.totalElements(), safeLimit, safeOffset, result.transactions());
    }
}
