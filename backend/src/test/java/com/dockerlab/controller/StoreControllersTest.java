package com.dockerlab.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Health, db-test, products and stats with a reachable store.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class StoreControllersTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("GET /health reports healthy with a non-negative latency")
    void healthy() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.service").value("backend-api"))
            .andExpect(jsonPath("$.status").value("healthy"))
            .andExpect(jsonPath("$.database.status").value("connected"))
            .andExpect(jsonPath("$.database.latency_ms").value(greaterThanOrEqualTo(0)))
            .andExpect(jsonPath("$.database.server_time").isNotEmpty())
            .andExpect(jsonPath("$.database.error").doesNotExist())
            .andExpect(jsonPath("$.environment").value("test"));
    }

    @Test
    @DisplayName("GET /db-test returns the store time and version")
    void dbTest() throws Exception {
        mockMvc.perform(get("/db-test"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.data.current_time").isNotEmpty())
            .andExpect(jsonPath("$.data.version").value(startsWith("H2")))
            .andExpect(jsonPath("$.message").value("PostgreSQL connection successful"));
    }

    @Test
    @DisplayName("GET /products lists the seeded catalog")
    void products() throws Exception {
        mockMvc.perform(get("/products"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.count").value(3))
            .andExpect(jsonPath("$.products", hasSize(3)))
            .andExpect(jsonPath("$.products[?(@.name == 'Mouse')].price").value(25.5))
            .andExpect(jsonPath("$.products[?(@.name == 'Mouse')].stock").value(50));
    }

    @Test
    @DisplayName("GET /stats reports counts and server metadata")
    void stats() throws Exception {
        mockMvc.perform(get("/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.stats.users.total").value(greaterThanOrEqualTo(2)))
            .andExpect(jsonPath("$.stats.products.total").value(3))
            .andExpect(jsonPath("$.stats.products.total_stock").value(90))
            .andExpect(jsonPath("$.stats.database.connection").value("active"))
            .andExpect(jsonPath("$.stats.database.version").isNotEmpty())
            .andExpect(jsonPath("$.stats.api.start_time").isNotEmpty())
            .andExpect(jsonPath("$.stats.api.memory_usage").value(endsWith("MB")));
    }
}
