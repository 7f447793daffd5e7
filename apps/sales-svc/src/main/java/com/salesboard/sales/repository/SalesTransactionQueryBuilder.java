package com.salesboard.sales.repository;

import com.salesboard.sales.entity.SalesTransactionEntity;
import com.salesboard.sales.model.AgeRange;
import com.salesboard.sales.model.FilterSelection;
import com.salesboard.sales.model.TagListCodec;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.springframework.data.jpa.domain.Specification;

/**
 * Turns a {@link FilterSelection} into one JPA {@link Specification}: the AND of one clause
 * per constrained dimension. Dimensions without a selection contribute no clause at all, and
 * a selection without any constraint produces no predicate, i.e. no WHERE clause.
 *
 * <p>Tags are matched with {@link TagListCodec#elementPatterns} against canonically encoded
 * rows. Tag text stored in any other shape is matched by value: the caller passes the exact
 * non-canonical encodings already known to hold a requested tag.
 */
public final class SalesTransactionQueryBuilder {

    private SalesTransactionQueryBuilder() {
    }

    public static Specification<SalesTransactionEntity> build(FilterSelection selection,
                                                              Collection<String> irregularTagLists) {
        return (root, query, cb) -> {
            List<Predicate> clauses = clauses(selection, irregularTagLists, root, cb);
            if (clauses.isEmpty()) {
                return null;
            }
            return cb.and(clauses.toArray(Predicate[]::new));
        };
    }

    private static List<Predicate> clauses(FilterSelection selection, Collection<String> irregularTagLists,
                                           Root<SalesTransactionEntity> root, CriteriaBuilder cb) {
        List<Predicate> clauses = new ArrayList<>();
        if (!selection.regions().isEmpty()) {
            clauses.add(root.get("customerRegion").in(selection.regions()));
        }
        if (!selection.genders().isEmpty()) {
            clauses.add(root.get("gender").in(selection.genders()));
        }
        if (!selection.ageRanges().isEmpty()) {
            clauses.add(ageInAnyRange(selection.ageRanges(), root, cb));
        }
        if (!selection.categories().isEmpty()) {
            clauses.add(root.get("productCategory").in(selection.categories()));
        }
        if (!selection.tags().isEmpty()) {
            clauses.add(hasAnyTag(selection.tags(), irregularTagLists, root, cb));
        }
        if (!selection.paymentMethods().isEmpty()) {
            clauses.add(root.get("paymentMethod").in(selection.paymentMethods()));
        }
        selection.startDate().ifPresent(start ->
                clauses.add(cb.greaterThanOrEqualTo(root.<LocalDate>get("date"), start)));
        selection.endDate().ifPresent(end ->
                clauses.add(cb.lessThanOrEqualTo(root.<LocalDate>get("date"), end)));
        selection.search().ifPresent(search -> clauses.add(matchesSearch(search, root, cb)));
        return clauses;
    }

    private static Predicate ageInAnyRange(List<AgeRange> ranges, Root<SalesTransactionEntity> root, CriteriaBuilder cb) {
        Expression<Integer> age = root.get("age");
        Predicate[] alternatives = ranges.stream()
                .map(range -> cb.between(age, range.start(), range.end()))
                .toArray(Predicate[]::new);
        return cb.or(alternatives);
    }

    private static Predicate hasAnyTag(List<String> tags, Collection<String> irregularTagLists,
                                       Root<SalesTransactionEntity> root, CriteriaBuilder cb) {
        Expression<String> encoded = root.get("tags");
        List<Predicate> alternatives = tags.stream()
                .flatMap(tag -> TagListCodec.elementPatterns(tag).stream())
                .map(pattern -> cb.like(encoded, pattern, TagListCodec.LIKE_ESCAPE))
                .collect(Collectors.toCollection(ArrayList::new));
        if (!irregularTagLists.isEmpty()) {
            alternatives.add(encoded.in(irregularTagLists));
        }
        return cb.or(alternatives.toArray(Predicate[]::new));
    }

    // whole-value match on name (case-insensitive) or phone, never a substring match
    private static Predicate matchesSearch(String search, Root<SalesTransactionEntity> root, CriteriaBuilder cb) {
        return cb.or(
                cb.equal(cb.lower(root.get("customerName")), search.toLowerCase(Locale.ROOT)),
                cb.equal(root.get("phoneNumber"), search)
        );
    }
}
