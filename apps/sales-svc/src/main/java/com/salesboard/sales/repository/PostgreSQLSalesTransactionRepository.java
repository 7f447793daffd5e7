package com.salesboard.sales.repository;

import com.salesboard.sales.entity.SalesTransactionEntity;
import com.salesboard.sales.model.CategoricalDimension;
import com.salesboard.sales.model.FilterSelection;
import com.salesboard.sales.model.SalesStatistics;
import com.salesboard.sales.model.SalesTransaction;
import com.salesboard.sales.model.SortSpec;
import com.salesboard.sales.model.TagListCodec;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Tuple;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Repository;

@Repository
public class PostgreSQLSalesTransactionRepository implements SalesTransactionRepository {

    private final JpaSalesTransactionRepository jpaSalesTransactionRepository;
    private final EntityManager entityManager;

    public PostgreSQLSalesTransactionRepository(JpaSalesTransactionRepository jpaSalesTransactionRepository,
                                                EntityManager entityManager) {
        this.jpaSalesTransactionRepository = jpaSalesTransactionRepository;
        this.entityManager = entityManager;
    }

    @Override
    public PageResult findPage(FilterSelection selection, SortSpec sort, int offset, int limit) {
        Specification<SalesTransactionEntity> spec = specificationFor(selection);
        Page<SalesTransactionEntity> page = jpaSalesTransactionRepository.findAll(
                spec, new OffsetPageRequest(offset, limit, toSort(sort)));
        List<SalesTransaction> transactions = page.getContent().stream()
                .map(this::toModel)
                .toList();
        // the page total is the count of the whole filtered row-set, not of this window
        return new PageResult(transactions, page.getTotalElements());
    }

    @Override
    public SalesStatistics loadStatistics(FilterSelection selection) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Tuple> query = cb.createTupleQuery();
        Root<SalesTransactionEntity> root = query.from(SalesTransactionEntity.class);
        query.multiselect(
                cb.sumAsLong(root.get("quantity")).alias("totalUnits"),
                cb.sum(root.<BigDecimal>get("totalAmount")).alias("totalAmount"),
                cb.sum(root.<BigDecimal>get("discount")).alias("totalDiscount"),
                cb.count(root).alias("totalTransactions")
        );
        Predicate predicate = specificationFor(selection).toPredicate(root, query, cb);
        if (predicate != null) {
            query.where(predicate);
        }
        Tuple row = entityManager.createQuery(query).getSingleResult();
        return new SalesStatistics(
                longValue(row.get("totalUnits")),
                decimalValue(row.get("totalAmount")),
                decimalValue(row.get("totalDiscount")),
                longValue(row.get("totalTransactions"))
        );
    }

    @Override
    public List<String> findDistinctValues(CategoricalDimension dimension) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<String> query = cb.createQuery(String.class);
        Root<SalesTransactionEntity> root = query.from(SalesTransactionEntity.class);
        Path<String> column = root.get(dimension.attribute());
        query.select(column)
                .distinct(true)
                .where(cb.isNotNull(column), cb.notEqual(column, ""));
        return entityManager.createQuery(query).getResultList();
    }

    @Override
    public List<String> findEncodedTags() {
        return jpaSalesTransactionRepository.findEncodedTags();
    }

    @Override
    public Optional<AgeBounds> findAgeBounds() {
        List<Object[]> rows = jpaSalesTransactionRepository.findAgeBounds();
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        Object[] bounds = rows.get(0);
        // MIN/MAX over no non-null ages come back as nulls
        if (bounds[0] == null || bounds[1] == null) {
            return Optional.empty();
        }
        return Optional.of(new AgeBounds(((Number) bounds[0]).intValue(), ((Number) bounds[1]).intValue()));
    }

    private Specification<SalesTransactionEntity> specificationFor(FilterSelection selection) {
        return SalesTransactionQueryBuilder.build(selection, irregularTagListsContaining(selection.tags()));
    }

    // padded or brace-less tag text escapes the LIKE patterns, so such lists are resolved here
    private Set<String> irregularTagListsContaining(List<String> tags) {
        if (tags.isEmpty()) {
            return Set.of();
        }
        return jpaSalesTransactionRepository.findEncodedTags().stream()
                .filter(encoded -> !TagListCodec.isCanonical(encoded))
                .filter(encoded -> TagListCodec.decode(encoded).stream().anyMatch(tags::contains))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static Sort toSort(SortSpec sort) {
        Sort.Direction direction = sort.descending() ? Sort.Direction.DESC : Sort.Direction.ASC;
        Sort primary = Sort.by(direction, sort.field().attribute());
        if (sort.field() == SortSpec.FALLBACK_FIELD) {
            return primary;
        }
        return primary.and(Sort.by(Sort.Direction.ASC, SortSpec.FALLBACK_FIELD.attribute()));
    }

    private SalesTransaction toModel(SalesTransactionEntity entity) {
        return new SalesTransaction(
                entity.getTransactionId(),
                entity.getDate(),
                entity.getCustomerId(),
                entity.getCustomerName(),
                entity.getPhoneNumber(),
                entity.getGender(),
                entity.getAge(),
                entity.getCustomerRegion(),
                entity.getProductCategory(),
                entity.getQuantity(),
                entity.getPricePerUnit(),
                entity.getTotalAmount(),
                entity.getDiscount(),
                entity.getPaymentMethod(),
                TagListCodec.decode(entity.getTags())
        );
    }

    private static long longValue(Object value) {
        return value == null ? 0L : ((Number) value).longValue();
    }

    private static BigDecimal decimalValue(Object value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        return new BigDecimal(value.toString());
    }
}
