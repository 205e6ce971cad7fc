package com.dockerlab.service;

import com.dockerlab.config.AppProperties;
import com.dockerlab.config.ServerRuntime;
import com.dockerlab.dto.response.DbTestResponse;
import com.dockerlab.dto.response.HealthResponse;
import com.dockerlab.dto.response.HealthResponse.DatabaseStatus;
import com.dockerlab.model.StoreProbe;
import com.dockerlab.repository.StoreRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Reports whether the store answers right now. Store failures become an
 * unhealthy report, never an exception.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StoreHealthService {

    private final StoreRepository storeRepository;
    private final ServerRuntime serverRuntime;
    private final AppProperties appProperties;

    public HealthResponse checkHealth() {
        HealthResponse.HealthResponseBuilder response = HealthResponse.builder()
            .service(appProperties.serviceName())
            .timestamp(serverRuntime.now())
            .environment(appProperties.environment());

        long started = System.nanoTime();
        try {
            StoreProbe probe = storeRepository.probe();
            long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            return response
                .status(HealthResponse.HEALTHY)
                .database(DatabaseStatus.builder()
                    .status(DatabaseStatus.CONNECTED)
                    .latencyMs(latencyMs)
                    .serverTime(probe.currentTime())
                    .build())
                .uptimeSeconds(serverRuntime.uptime().getSeconds())
                .build();
        } catch (DataAccessException e) {
            log.warn("Health check failed, store unreachable: {}", e.getMessage());

            return response
                .status(HealthResponse.UNHEALTHY)
                .database(DatabaseStatus.builder()
                    .status(DatabaseStatus.DISCONNECTED)
                    .error(appProperties.isProduction() ? null : e.getMessage())
                    .build())
                .build();
        }
    }

    public DbTestResponse testConnection() {
        try {
            StoreProbe probe = storeRepository.probe();
            return DbTestResponse.builder()
                .success(true)
                .data(probe)
                .message("PostgreSQL connection successful")
                .build();
        } catch (DataAccessException e) {
            log.warn("Database test failed: {}", e.getMessage());
            return DbTestResponse.builder()
                .success(false)
                .message("Error connecting to PostgreSQL")
                .error(appProperties.isProduction() ? null : e.getMessage())
                .build();
        }
    }
}
