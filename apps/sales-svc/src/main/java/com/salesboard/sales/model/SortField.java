package com.salesboard.sales.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Columns a listing may be ordered by. Request values are looked up here by their API name;
 * nothing outside this list ever reaches the query.
 */
public enum SortField {
    TRANSACTION_ID("transaction_id", "transactionId"),
    DATE("date", "date"),
    CUSTOMER_ID("customer_id", "customerId"),
    CUSTOMER_NAME("customer_name", "customerName"),
    PHONE_NUMBER("phone_number", "phoneNumber"),
    GENDER("gender", "gender"),
    AGE("age", "age"),
    CUSTOMER_REGION("customer_region", "customerRegion"),
    PRODUCT_CATEGORY("product_category", "productCategory"),
    QUANTITY("quantity", "quantity"),
    PRICE_PER_UNIT("price_per_unit", "pricePerUnit"),
    TOTAL_AMOUNT("total_amount", "totalAmount"),
    DISCOUNT("discount", "discount"),
    PAYMENT_METHOD("payment_method", "paymentMethod");

    private final String apiName;
    private final String attribute;

    SortField(String apiName, String attribute) {
        this.apiName = apiName;
        this.attribute = attribute;
    }

    public String apiName() {
        return apiName;
    }

    public String attribute() {
        return attribute;
    }

    public static Optional<SortField> fromApiName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim();
        return Arrays.stream(values())
                .filter(field -> field.apiName.equals(normalized))
                .findFirst();
    }
}
