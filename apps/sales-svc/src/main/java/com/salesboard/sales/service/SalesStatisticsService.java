package com.salesboard.sales.service;

import com.salesboard.sales.model.FilterSelection;
import com.salesboard.sales.model.SalesStatistics;
import com.salesboard.sales.repository.SalesTransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class SalesStatisticsService {
    private static final Logger log = LoggerFactory.getLogger(SalesStatisticsService.class);

    private final SalesTransactionRepository salesTransactionRepository;

    public SalesStatisticsService(SalesTransactionRepository salesTransactionRepository) {
        this.salesTransactionRepository = salesTransactionRepository;
    }

    @Transactional(readOnly = true)
    public SalesStatistics summarize(FilterSelection selection) {
        log.debug("Summarising transactions filters={}", selection.activeDimensions());
        SalesStatistics statistics = salesTransactionRepository.loadStatistics(selection);
        return statistics != null ? statistics : SalesStatistics.empty();
    }
}
