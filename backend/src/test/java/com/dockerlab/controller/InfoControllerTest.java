package com.dockerlab.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.matchesPattern;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class InfoControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("POST /echo returns the body unchanged under 'received'")
    void echoReturnsPayload() throws Exception {
        mockMvc.perform(post("/echo")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"a\":1}"))
            .andExpect(status().isOk())
            .andExpect(content().json("{\"received\":{\"a\":1}}"))
            .andExpect(jsonPath("$.received.a").value(1))
            .andExpect(jsonPath("$.echoed_at").isNotEmpty())
            .andExpect(jsonPath("$.message").value("Data received successfully"));
    }

    @Test
    @DisplayName("POST /echo keeps nested structures and key names as sent")
    void echoKeepsNestedPayload() throws Exception {
        String payload = "{\"someKey\":[1,{\"innerKey\":true}],\"text\":\"hi\"}";

        MvcResult result = mockMvc.perform(post("/echo")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isOk())
            .andReturn();

        JsonNode received = objectMapper.readTree(result.getResponse().getContentAsString()).get("received");
        assertThat(received).isEqualTo(objectMapper.readTree(payload));
    }

    @Test
    @DisplayName("POST /echo without a body echoes an empty object")
    void echoWithoutBody() throws Exception {
        mockMvc.perform(post("/echo").contentType(MediaType.APPLICATION_JSON))
            .andExpect(status().isOk())
            .andExpect(content().json("{\"received\":{}}"));
    }

    @Test
    @DisplayName("POST /echo with a non-JSON body echoes an empty object")
    void echoPlainText() throws Exception {
        mockMvc.perform(post("/echo")
                .contentType(MediaType.TEXT_PLAIN)
                .content("hello"))
            .andExpect(status().isOk())
            .andExpect(content().json("{\"received\":{}}"))
            .andExpect(jsonPath("$.message").value("Data received successfully"));
    }

    @Test
    @DisplayName("GET /data returns the fixed sample items")
    void sampleData() throws Exception {
        mockMvc.perform(get("/data"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("Data from the backend"))
            .andExpect(jsonPath("$.items", hasSize(3)))
            .andExpect(jsonPath("$.items[0].name").value("Item A"))
            .andExpect(jsonPath("$.items[2].value").value(300))
            .andExpect(jsonPath("$.total").value(3))
            .andExpect(jsonPath("$.generated_at").isNotEmpty());
    }

    @Test
    @DisplayName("GET /info lists the endpoint paths")
    void info() throws Exception {
        mockMvc.perform(get("/info"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.service").value("Backend API"))
            .andExpect(jsonPath("$.version").value("3.0.0"))
            .andExpect(jsonPath("$.endpoints").value(hasItem("/echo")))
            .andExpect(jsonPath("$.database").value("PostgreSQL"));
    }

    @Test
    @DisplayName("GET /system-info describes endpoints, server and project")
    void systemInfo() throws Exception {
        mockMvc.perform(get("/system-info"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.endpoints", hasSize(13)))
            .andExpect(jsonPath("$.endpoints[0].method").value("GET"))
            .andExpect(jsonPath("$.endpoints[0].path").value("/health"))
            .andExpect(jsonPath("$.database.type").value("PostgreSQL"))
            .andExpect(jsonPath("$.database.connected").value(true))
            .andExpect(jsonPath("$.database.host").value("localhost"))
            .andExpect(jsonPath("$.server.uptime").value(matchesPattern("\\d+d \\d+h \\d+m \\d+s")))
            .andExpect(jsonPath("$.server.environment").value("test"))
            .andExpect(jsonPath("$.server.memory_usage.heap_used_mb").isNumber())
            .andExpect(jsonPath("$.project.services", hasSize(3)));
    }

    @Test
    @DisplayName("unknown route is a 404 listing the known routes")
    void unknownRoute() throws Exception {
        mockMvc.perform(get("/does-not-exist"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("Route not found"))
            .andExpect(jsonPath("$.available_routes").value(hasItem("/users/:id")));
    }

    @Test
    @DisplayName("known path with an unsupported method is a 404")
    void unsupportedMethod() throws Exception {
        mockMvc.perform(delete("/products"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.available_routes").value(hasItem("/products")));
    }

    @Test
    @DisplayName("cross-origin requests are allowed from any origin")
    void corsIsPermissive() throws Exception {
        mockMvc.perform(get("/data").header(HttpHeaders.ORIGIN, "http://localhost:8080"))
            .andExpect(status().isOk())
            .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*"));
    }

    @Test
    @DisplayName("CORS preflight for a write is accepted")
    void corsPreflight() throws Exception {
        mockMvc.perform(options("/users")
                .header(HttpHeaders.ORIGIN, "http://localhost:8080")
                .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST"))
            .andExpect(status().isOk())
            .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*"));
    }
}
