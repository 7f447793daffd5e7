package com.salesboard.sales.repository;

import com.salesboard.sales.model.CategoricalDimension;
import com.salesboard.sales.model.FilterSelection;
import com.salesboard.sales.model.SalesStatistics;
import com.salesboard.sales.model.SalesTransaction;
import com.salesboard.sales.model.SortSpec;
import java.util.List;
import java.util.Optional;

/**
 * Read access to the sales transactions store. Every filtered read goes through
 * {@link SalesTransactionQueryBuilder}, so a page and its statistics always describe the
 * same row-set.
 */
public interface SalesTransactionRepository {
    record PageResult(List<SalesTransaction> transactions, long totalElements) {}

    record AgeBounds(int min, int max) {}

    PageResult findPage(FilterSelection selection, SortSpec sort, int offset, int limit);

    SalesStatistics loadStatistics(FilterSelection selection);

    List<String> findDistinctValues(CategoricalDimension dimension);

    List<String> findEncodedTags();

    Optional<AgeBounds> findAgeBounds();
}
