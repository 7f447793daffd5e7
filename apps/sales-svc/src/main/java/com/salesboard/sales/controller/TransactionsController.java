package com.salesboard.sales.controller;

import com.salesboard.sales.controller.dto.TransactionResponseDto;
import com.salesboard.sales.controller.dto.TransactionsListResponseDto;
import com.salesboard.sales.model.FilterSelection;
import com.salesboard.sales.model.SalesTransaction;
import com.salesboard.sales.model.TransactionPage;
import com.salesboard.sales.service.TransactionListingService;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/transactions")
public class TransactionsController {

    private final TransactionListingService transactionListingService;

    public TransactionsController(TransactionListingService transactionListingService) {
        this.transactionListingService = transactionListingService;
    }

    @GetMapping
    public ResponseEntity<TransactionsListResponseDto> listTransactions(
            @RequestParam(value = "customer_regions", required = false) List<String> customerRegions,
            @RequestParam(value = "genders", required = false) List<String> genders,
            @RequestParam(value = "age_ranges", required = false) List<String> ageRanges,
            @RequestParam(value = "product_categories", required = false) List<String> productCategories,
            @RequestParam(value = "tags", required = false) List<String> tags,
            @RequestParam(value = "payment_methods", required = false) List<String> paymentMethods,
            @RequestParam(value = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(value = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(value = "search", required = false) String search,
            @RequestParam(value = "sort_by", required = false) String sortBy,
            @RequestParam(value = "sort_order", required = false, defaultValue = "asc") String sortOrder,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "offset", required = false, defaultValue = "0") Integer offset
    ) {
        FilterSelection selection = FilterParams.toSelection(
                customerRegions, genders, ageRanges, productCategories, tags, paymentMethods,
                startDate, endDate, search);
        TransactionPage page = transactionListingService.list(selection, sortBy, sortOrder, limit, offset);
        var response = new TransactionsListResponseDto(
                page.total(),
                page.limit(),
                page.offset(),
                page.records().stream().map(this::map).toList()
        );
        return ResponseEntity.ok(response);
    }

    private TransactionResponseDto map(SalesTransaction transaction) {
        return new TransactionResponseDto(
                transaction.transactionId(),
                transaction.date(),
                transaction.customerId(),
                transaction.customerName(),
                transaction.phoneNumber(),
                transaction.gender(),
                transaction.age(),
                transaction.customerRegion(),
                transaction.productCategory(),
                transaction.quantity(),
                amount(transaction.pricePerUnit()),
                amount(transaction.totalAmount()),
                amount(transaction.discount()),
                transaction.paymentMethod(),
                transaction.tags()
        );
    }

    private static double amount(BigDecimal value) {
        return value == null ? 0d : value.doubleValue();
    }
}
