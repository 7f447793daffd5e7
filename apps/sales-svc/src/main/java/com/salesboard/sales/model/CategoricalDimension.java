package com.salesboard.sales.model;

/**
 * Filter dimensions whose options are the distinct stored values of one column.
 */
public enum CategoricalDimension {
    CUSTOMER_REGION("customerRegion"),
    GENDER("gender"),
    PRODUCT_CATEGORY("productCategory"),
    PAYMENT_METHOD("paymentMethod");

    private final String attribute;

    CategoricalDimension(String attribute) {
        this.attribute = attribute;
    }

    public String attribute() {
        return attribute;
    }
}
