package com.dockerlab.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

// ========== Stats Response ==========
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatsResponse {
    private boolean success;
    private Stats stats;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Stats {
        private UserStats users;
        private ProductStats products;
        private DatabaseStats database;
        private ApiStats api;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UserStats {
        private long total;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProductStats {
        private long total;
        private long totalStock;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DatabaseStats {
        private String version;
        private String connection;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ApiStats {
        private String uptime;
        private Instant startTime;
        private String environment;
        private String memoryUsage;
    }
}
