package com.salesboard.sales.model;

/**
 * Resolved ordering for a listing. {@code transaction_id} ascending is always applied after
 * the primary field so offset pages stay stable.
 */
public record SortSpec(SortField field, boolean descending) {

    public static final SortField DEFAULT_FIELD = SortField.CUSTOMER_NAME;
    public static final SortField FALLBACK_FIELD = SortField.TRANSACTION_ID;

    public SortSpec {
        if (field == null) {
            throw new IllegalArgumentException("field must be provided");
        }
    }

    /**
     * An absent field means the default ({@code customer_name}); an unknown one is ignored
     * and falls back to {@code transaction_id}. Only {@code desc} selects descending order.
     */
    public static SortSpec resolve(String sortBy, String sortOrder) {
        boolean descending = sortOrder != null && sortOrder.trim().equalsIgnoreCase("desc");
        if (sortBy == null || sortBy.isBlank()) {
            return new SortSpec(DEFAULT_FIELD, descending);
        }
        return SortField.fromApiName(sortBy)
                .map(field -> new SortSpec(field, descending))
                .orElseGet(() -> new SortSpec(FALLBACK_FIELD, false));
    }
}
