package com.salesboard.sales.controller;

import com.salesboard.sales.controller.dto.FilterOptionsResponseDto;
import com.salesboard.sales.model.FilterOptions;
import com.salesboard.sales.service.FilterOptionsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/filters")
public class FilterOptionsController {

    private final FilterOptionsService filterOptionsService;

    public FilterOptionsController(FilterOptionsService filterOptionsService) {
        this.filterOptionsService = filterOptionsService;
    }

    @GetMapping("/options")
    public ResponseEntity<FilterOptionsResponseDto> getOptions() {
        FilterOptions options = filterOptionsService.loadOptions();
        return ResponseEntity.ok(new FilterOptionsResponseDto(
                options.customerRegions(),
                options.genders(),
                options.ageRanges(),
                options.productCategories(),
                options.tags(),
                options.paymentMethods()
        ));
    }
}
