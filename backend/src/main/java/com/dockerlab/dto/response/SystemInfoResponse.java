package com.dockerlab.dto.response;

import com.dockerlab.config.RouteCatalog;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

// ========== System Info Response ==========
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemInfoResponse {
    private boolean success;
    private String service;
    private String version;
    private String description;
    private List<RouteCatalog.Route> endpoints;
    private DatabaseInfo database;
    private ServerInfo server;
    private ProjectInfo project;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DatabaseInfo {
        private String type;
        // whether the startup connection succeeded
        private boolean connected;
        private String host;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ServerInfo {
        private Instant startTime;
        private String uptime;
        private String javaVersion;
        private String environment;
        private MemoryUsage memoryUsage;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MemoryUsage {
        private long heapUsedMb;
        private long heapCommittedMb;
        private long heapMaxMb;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProjectInfo {
        private String name;
        private int members;
        private List<String> services;
    }
}
