package com.salesboard.sales.controller;

import com.salesboard.sales.controller.dto.StatisticsResponseDto;
import com.salesboard.sales.model.FilterSelection;
import com.salesboard.sales.model.SalesStatistics;
import com.salesboard.sales.service.SalesStatisticsService;
import java.time.LocalDate;
import java.util.List;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/statistics")
public class StatisticsController {

    private final SalesStatisticsService salesStatisticsService;

    public StatisticsController(SalesStatisticsService salesStatisticsService) {
        this.salesStatisticsService = salesStatisticsService;
    }

    @GetMapping
    public ResponseEntity<StatisticsResponseDto> getStatistics(
            @RequestParam(value = "customer_regions", required = false) List<String> customerRegions,
            @RequestParam(value = "genders", required = false) List<String> genders,
            @RequestParam(value = "age_ranges", required = false) List<String> ageRanges,
            @RequestParam(value = "product_categories", required = false) List<String> productCategories,
            @RequestParam(value = "tags", required = false) List<String> tags,
            @RequestParam(value = "payment_methods", required = false) List<String> paymentMethods,
            @RequestParam(value = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(value = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(value = "search", required = false) String search
    ) {
        FilterSelection selection = FilterParams.toSelection(
                customerRegions, genders, ageRanges, productCategories, tags, paymentMethods,
                startDate, endDate, search);
        SalesStatistics statistics = salesStatisticsService.summarize(selection);
        return ResponseEntity.ok(new StatisticsResponseDto(
                statistics.totalUnits(),
                statistics.totalAmount().doubleValue(),
                statistics.totalDiscount().doubleValue(),
                statistics.totalTransactions()
        ));
    }
}
