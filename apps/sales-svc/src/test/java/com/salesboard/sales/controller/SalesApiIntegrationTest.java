package com.salesboard.sales.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesboard.sales.entity.SalesTransactionEntity;
import com.salesboard.sales.repository.JpaSalesTransactionRepository;
import com.salesboard.sales.web.TraceIdFilter;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.transaction.annotation.Transactional;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Transactional
class SalesApiIntegrationTest {

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @Autowired
    JpaSalesTransactionRepository jpaSalesTransactionRepository;

    @BeforeEach
    void seed() {
        List<SalesTransactionEntity> rows = new ArrayList<>(List.of(
                row("T001", "2023-01-05", "John Smith", "5550001", "Male", 29, "North", "Electronics", 2, "100.00", "200.00", "10.00", "Credit Card", "{electronics,\"home goods\"}"),
                row("T002", "2023-01-10", "John Smithson", "5550002", "Male", 30, "South", "Clothing", 1, "50.00", "50.00", "0.00", "Cash", "{fashion}"),
                row("T003", "2023-02-01", "Alice Jones", "5550003", "Female", 15, "North", "Beauty", 3, "20.00", "60.00", "5.00", "UPI", "{beauty,\"home goods\"}"),
                row("T004", "2023-02-15", "Bob Brown", "5550004", "Male", 5, "East", "Electronics", 1, "300.00", "300.00", "30.00", "Credit Card", "{gadgets}"),
                row("T005", "2023-03-01", "Carol White", "5550005", "Female", 22, "West", "Home", 4, "25.00", "100.00", "0.00", "Debit Card", "{home,organic}"),
                row("T006", "2023-03-20", "Dan Green", "5550006", "Male", 45, "South", "Clothing", 2, "40.00", "80.00", "8.00", "Cash", "{}"),
                row("T007", "2023-04-02", "Eve Black", "5550007", "Female", 61, "East", "Beauty", 5, "10.00", "50.00", "2.50", "UPI", null)
        ));
        for (int i = 1; i <= 8; i++) {
            rows.add(row("B00" + i, "2023-05-0" + i, "Bulk Buyer " + i, "555100" + i, "Male", 40, "Central", "Grocery",
                    1, "10.00", "10.00", "0.00", "Cash", "{bulk}"));
        }
        jpaSalesTransactionRepository.saveAllAndFlush(rows);
    }

    @Test
    void unfilteredListingCoversWholeStore() throws Exception {
        mockMvc.perform(get("/api/transactions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(15))
                .andExpect(jsonPath("$.limit").value(50))
                .andExpect(jsonPath("$.offset").value(0))
                .andExpect(jsonPath("$.data", hasSize(15)));
    }

    @Test
    void statisticsMatchListingTotalForSameFilters() throws Exception {
        List<String> queries = List.of(
                "",
                "customer_regions=North&customer_regions=South",
                "genders=Female&age_ranges=10-19&age_ranges=60-69",
                "tags=home goods&payment_methods=UPI",
                "start_date=2023-02-01&end_date=2023-03-01",
                "search=john smith",
                "product_categories=Grocery&limit=5&offset=3",
                "customer_regions=Nowhere"
        );
        for (String query : queries) {
            JsonNode listing = readJson(withQuery("/api/transactions", query));
            JsonNode statistics = readJson(withQuery("/api/statistics", query));

            assertThat(statistics.get("total_transactions").asLong())
                    .as("total for '%s'", query)
                    .isEqualTo(listing.get("total").asLong());
        }
    }

    @Test
    void ageRangesAreInclusiveAndAlternative() throws Exception {
        mockMvc.perform(get("/api/transactions")
                        .param("age_ranges", "0-9", "20-29")
                        .param("sort_by", "transaction_id"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(3))
                .andExpect(jsonPath("$.data[*].transaction_id", contains("T001", "T004", "T005")));

        mockMvc.perform(get("/api/transactions").param("age_ranges", "30-39"))
                .andExpect(jsonPath("$.data[*].transaction_id", contains("T002")));
    }

    @Test
    void malformedAgeTokenIsIgnored() throws Exception {
        mockMvc.perform(get("/api/transactions").param("age_ranges", "abc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(15));

        mockMvc.perform(get("/api/transactions").param("age_ranges", "abc", "0-9"))
                .andExpect(jsonPath("$.data[*].transaction_id", contains("T004")));
    }

    @Test
    void dimensionsCombineWithAnd() throws Exception {
        mockMvc.perform(get("/api/transactions")
                        .param("customer_regions", "North")
                        .param("genders", "Female"))
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.data[0].transaction_id").value("T003"));

        mockMvc.perform(get("/api/transactions")
                        .param("customer_regions", "North", "South"))
                .andExpect(jsonPath("$.total").value(4));
    }

    @Test
    void dateBoundsAreInclusive() throws Exception {
        mockMvc.perform(get("/api/transactions")
                        .param("start_date", "2023-02-01")
                        .param("end_date", "2023-03-01")
                        .param("sort_by", "date"))
                .andExpect(jsonPath("$.data[*].transaction_id", contains("T003", "T004", "T005")))
                .andExpect(jsonPath("$.data[0].date").value("2023-02-01"));
    }

    @Test
    void searchMatchesWholeNameIgnoringCaseOrExactPhone() throws Exception {
        mockMvc.perform(get("/api/transactions").param("search", "  john smith "))
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.data[0].customer_name").value("John Smith"));

        mockMvc.perform(get("/api/transactions").param("search", "5550003"))
                .andExpect(jsonPath("$.data[*].transaction_id", contains("T003")));

        mockMvc.perform(get("/api/transactions").param("search", "john"))
                .andExpect(jsonPath("$.total").value(0));
    }

    @Test
    void tagsMatchWholeElementsOnly() throws Exception {
        mockMvc.perform(get("/api/transactions").param("tags", "home"))
                .andExpect(jsonPath("$.data[*].transaction_id", contains("T005")));

        mockMvc.perform(get("/api/transactions").param("tags", "home goods"))
                .andExpect(jsonPath("$.data[*].transaction_id", containsInAnyOrder("T001", "T003")));

        mockMvc.perform(get("/api/transactions").param("tags", "home", "fashion"))
                .andExpect(jsonPath("$.data[*].transaction_id", containsInAnyOrder("T002", "T005")));

        mockMvc.perform(get("/api/transactions").param("tags", "elec"))
                .andExpect(jsonPath("$.total").value(0));
    }

    @Test
    void recordsAreReturnedDecoded() throws Exception {
        mockMvc.perform(get("/api/transactions").param("search", "John Smith"))
                .andExpect(jsonPath("$.data[0].tags", contains("electronics", "home goods")))
                .andExpect(jsonPath("$.data[0].total_amount").value(200.0))
                .andExpect(jsonPath("$.data[0].price_per_unit").value(100.0))
                .andExpect(jsonPath("$.data[0].age").value(29))
                .andExpect(jsonPath("$.data[0].date").value("2023-01-05"));

        mockMvc.perform(get("/api/transactions").param("search", "Eve Black"))
                .andExpect(jsonPath("$.data[0].tags", hasSize(0)));
    }

    @Test
    void limitIsClampedIntoSafeRange() throws Exception {
        mockMvc.perform(get("/api/transactions").param("limit", "5"))
                .andExpect(jsonPath("$.limit").value(10))
                .andExpect(jsonPath("$.data", hasSize(10)))
                .andExpect(jsonPath("$.total").value(15));

        mockMvc.perform(get("/api/transactions").param("limit", "1000"))
                .andExpect(jsonPath("$.limit").value(200))
                .andExpect(jsonPath("$.data", hasSize(15)));
    }

    @Test
    void offsetWindowsTheSortedRowSet() throws Exception {
        mockMvc.perform(get("/api/transactions")
                        .param("sort_by", "transaction_id")
                        .param("limit", "10")
                        .param("offset", "10"))
                .andExpect(jsonPath("$.total").value(15))
                .andExpect(jsonPath("$.offset").value(10))
                .andExpect(jsonPath("$.data[*].transaction_id", contains("T003", "T004", "T005", "T006", "T007")));

        mockMvc.perform(get("/api/transactions").param("offset", "100"))
                .andExpect(jsonPath("$.total").value(15))
                .andExpect(jsonPath("$.data", hasSize(0)));
    }

    @Test
    void sortsByAllowListedFieldAndIgnoresUnknownOnes() throws Exception {
        mockMvc.perform(get("/api/transactions")
                        .param("sort_by", "age")
                        .param("sort_order", "desc"))
                .andExpect(jsonPath("$.data[0].transaction_id").value("T007"))
                .andExpect(jsonPath("$.data[1].transaction_id").value("T006"));

        mockMvc.perform(get("/api/transactions")
                        .param("sort_by", "no_such_column")
                        .param("sort_order", "desc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(15))
                .andExpect(jsonPath("$.data[0].transaction_id").value("B001"));
    }

    @Test
    void statisticsAggregateFilteredRows() throws Exception {
        mockMvc.perform(get("/api/statistics").param("customer_regions", "North"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_units").value(5))
                .andExpect(jsonPath("$.total_amount").value(260.0))
                .andExpect(jsonPath("$.total_discount").value(15.0))
                .andExpect(jsonPath("$.total_transactions").value(2));
    }

    @Test
    void statisticsWithoutMatchesAreZero() throws Exception {
        mockMvc.perform(get("/api/statistics").param("customer_regions", "Nowhere"))
                .andExpect(jsonPath("$.total_units").value(0))
                .andExpect(jsonPath("$.total_amount").value(0.0))
                .andExpect(jsonPath("$.total_discount").value(0.0))
                .andExpect(jsonPath("$.total_transactions").value(0));
    }

    @Test
    void filterOptionsReflectWholeStore() throws Exception {
        mockMvc.perform(get("/api/filters/options"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.customer_regions", contains("Central", "East", "North", "South", "West")))
                .andExpect(jsonPath("$.genders", contains("Female", "Male")))
                .andExpect(jsonPath("$.product_categories", contains("Beauty", "Clothing", "Electronics", "Grocery", "Home")))
                .andExpect(jsonPath("$.payment_methods", contains("Cash", "Credit Card", "Debit Card", "UPI")))
                .andExpect(jsonPath("$.tags", contains("beauty", "bulk", "electronics", "fashion", "gadgets", "home", "home goods", "organic")))
                .andExpect(jsonPath("$.age_ranges", contains("5-14", "15-24", "25-34", "35-44", "45-54", "55-64")));
    }

    @Test
    void filterOptionsDeduplicateRegions() throws Exception {
        jpaSalesTransactionRepository.deleteAllInBatch();
        jpaSalesTransactionRepository.saveAllAndFlush(List.of(
                row("R1", "2023-01-01", "A", "1", "Male", 20, "North", "Home", 1, "1.00", "1.00", "0.00", "Cash", "{}"),
                row("R2", "2023-01-02", "B", "2", "Male", 20, "South", "Home", 1, "1.00", "1.00", "0.00", "Cash", "{}"),
                row("R3", "2023-01-03", "C", "3", "Male", 30, "North", "Home", 1, "1.00", "1.00", "0.00", "Cash", "{}")
        ));

        mockMvc.perform(get("/api/filters/options"))
                .andExpect(jsonPath("$.customer_regions", contains("North", "South")))
                .andExpect(jsonPath("$.age_ranges", contains("20-29")));
    }

    @Test
    void singleDistinctAgeOffersNoAgeRange() throws Exception {
        jpaSalesTransactionRepository.deleteAllInBatch();
        jpaSalesTransactionRepository.saveAllAndFlush(List.of(
                row("S1", "2023-01-01", "A", "1", "Male", 20, "North", "Home", 1, "1.00", "1.00", "0.00", "Cash", "{}"),
                row("S2", "2023-01-02", "B", "2", "Female", 20, "South", "Home", 1, "1.00", "1.00", "0.00", "Cash", "{}")
        ));

        mockMvc.perform(get("/api/filters/options"))
                .andExpect(jsonPath("$.age_ranges", hasSize(0)));
    }

    @Test
    void tagsStoredWithPaddingOrWithoutBracesStillMatch() throws Exception {
        jpaSalesTransactionRepository.saveAllAndFlush(List.of(
                row("P001", "2023-06-01", "Pat Padded", "5552001", "Female", 33, "West", "Electronics", 1, "80.00", "80.00", "0.00", "Cash", "{electronics, home}"),
                row("P002", "2023-06-02", "Bea Bare", "5552002", "Male", 52, "West", "Grocery", 2, "5.00", "10.00", "0.00", "UPI", "eco,organic")
        ));

        mockMvc.perform(get("/api/filters/options"))
                .andExpect(jsonPath("$.tags", containsInAnyOrder(
                        "beauty", "bulk", "eco", "electronics", "fashion", "gadgets", "home", "home goods", "organic")));

        mockMvc.perform(get("/api/transactions").param("tags", "home"))
                .andExpect(jsonPath("$.data[*].transaction_id", containsInAnyOrder("P001", "T005")));

        mockMvc.perform(get("/api/transactions").param("tags", "organic"))
                .andExpect(jsonPath("$.data[*].transaction_id", containsInAnyOrder("P002", "T005")));

        mockMvc.perform(get("/api/transactions").param("tags", "eco"))
                .andExpect(jsonPath("$.data[*].transaction_id", contains("P002")))
                .andExpect(jsonPath("$.data[0].tags", contains("eco", "organic")));

        mockMvc.perform(get("/api/statistics").param("tags", "home"))
                .andExpect(jsonPath("$.total_transactions").value(2));
    }

    @Test
    void emptyStoreYieldsEmptyOptionsAndZeroStatistics() throws Exception {
        jpaSalesTransactionRepository.deleteAllInBatch();

        mockMvc.perform(get("/api/filters/options"))
                .andExpect(jsonPath("$.age_ranges", hasSize(0)))
                .andExpect(jsonPath("$.customer_regions", hasSize(0)))
                .andExpect(jsonPath("$.tags", hasSize(0)));

        mockMvc.perform(get("/api/statistics"))
                .andExpect(jsonPath("$.total_transactions").value(0))
                .andExpect(jsonPath("$.total_units").value(0));

        mockMvc.perform(get("/api/transactions"))
                .andExpect(jsonPath("$.total").value(0))
                .andExpect(jsonPath("$.data", hasSize(0)));
    }

    @Test
    void malformedDateIsRejectedAsBadRequest() throws Exception {
        mockMvc.perform(get("/api/transactions").param("start_date", "yesterday"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"))
                .andExpect(jsonPath("$.trace_id").isNotEmpty());

        mockMvc.perform(get("/api/transactions").param("limit", "ten"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void traceHeaderIsEchoed() throws Exception {
        mockMvc.perform(get("/api/statistics").header(TraceIdFilter.TRACE_HEADER, "trace-123"))
                .andExpect(header().string(TraceIdFilter.TRACE_HEADER, "trace-123"));
    }

    private JsonNode readJson(MockHttpServletRequestBuilder request) throws Exception {
        String body = mockMvc.perform(request)
                .andExpect(status().isOk())
                .andReturn()
                .getResponse()
                .getContentAsString();
        return objectMapper.readTree(body);
    }

    private static MockHttpServletRequestBuilder withQuery(String path, String query) {
        MockHttpServletRequestBuilder request = get(path);
        if (query.isEmpty()) {
            return request;
        }
        for (String pair : query.split("&")) {
            String[] parts = pair.split("=", 2);
            request.param(parts[0], parts[1]);
        }
        return request;
    }

    private static SalesTransactionEntity row(String id, String date, String name, String phone, String gender, int age,
                                              String region, String category, int quantity, String price,
                                              String total, String discount, String paymentMethod, String tags) {
        return new SalesTransactionEntity(
                id,
                LocalDate.parse(date),
                "CUST-" + id,
                name,
                phone,
                gender,
                age,
                region,
                category,
                quantity,
                new BigDecimal(price),
                new BigDecimal(total),
                new BigDecimal(discount),
                paymentMethod,
                tags
        );
    }
}
