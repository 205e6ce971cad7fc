package com.dockerlab.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.OffsetDateTime;

// ========== Health Check Response ==========
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HealthResponse {

    public static final String HEALTHY = "healthy";
    public static final String UNHEALTHY = "unhealthy";

    private String service;
    private String status;
    private Instant timestamp;
    private DatabaseStatus database;
    private String environment;
    private Long uptimeSeconds;

    @JsonIgnore
    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class DatabaseStatus {
        public static final String CONNECTED = "connected";
        public static final String DISCONNECTED = "disconnected";

        private String status;
        private Long latencyMs;
        private OffsetDateTime serverTime;
        private String error;
    }
}
