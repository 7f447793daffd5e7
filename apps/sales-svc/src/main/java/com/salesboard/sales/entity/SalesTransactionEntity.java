package com.salesboard.sales.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDate;

@Entity
@Table(name = "sales_transactions")
public class SalesTransactionEntity {
    @Id
    @Column(name = "transaction_id", nullable = false, updatable = false)
    private String transactionId;

    @Column(name = "date")
    private LocalDate date;

    @Column(name = "customer_id")
    private String customerId;

    @Column(name = "customer_name")
    private String customerName;

    @Column(name = "phone_number")
    private String phoneNumber;

    @Column(name = "gender")
    private String gender;

    @Column(name = "age")
    private Integer age;

    @Column(name = "customer_region")
    private String customerRegion;

    @Column(name = "product_category")
    private String productCategory;

    @Column(name = "quantity")
    private Integer quantity;

    @Column(name = "price_per_unit", precision = 12, scale = 2)
    private BigDecimal pricePerUnit;

    @Column(name = "total_amount", precision = 14, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "discount", precision = 12, scale = 2)
    private BigDecimal discount;

    @Column(name = "payment_method")
    private String paymentMethod;

    // encoded list text, see TagListCodec
    @Column(name = "tags")
    private String tags;

    // Default constructor for JPA
    public SalesTransactionEntity() {}

    public SalesTransactionEntity(String transactionId, LocalDate date, String customerId, String customerName,
                                  String phoneNumber, String gender, Integer age, String customerRegion,
                                  String productCategory, Integer quantity, BigDecimal pricePerUnit,
                                  BigDecimal totalAmount, BigDecimal discount, String paymentMethod, String tags) {
        this.transactionId = transactionId;
        this.date = date;
        this.customerId = customerId;
        this.customerName = customerName;
        this.phoneNumber = phoneNumber;
        this.gender = gender;
        this.age = age;
        this.customerRegion = customerRegion;
        this.productCategory = productCategory;
        this.quantity = quantity;
        this.pricePerUnit = pricePerUnit;
        this.totalAmount = totalAmount;
        this.discount = discount;
        this.paymentMethod = paymentMethod;
        this.tags = tags;
    }

    // Getters only: rows are written by the import job, never by this service
    public String getTransactionId() { return transactionId; }

    public LocalDate getDate() { return date; }

    public String getCustomerId() { return customerId; }

    public String getCustomerName() { return customerName; }

    public String getPhoneNumber() { return phoneNumber; }

    public String getGender() { return gender; }

    public Integer getAge() { return age; }

    public String getCustomerRegion() { return customerRegion; }

    public String getProductCategory() { return productCategory; }

    public Integer getQuantity() { return quantity; }

    public BigDecimal getPricePerUnit() { return pricePerUnit; }

    public BigDecimal getTotalAmount() { return totalAmount; }

    public BigDecimal getDiscount() { return discount; }

    public String getPaymentMethod() { return paymentMethod; }

    public String getTags() { return tags; }
}
