package com.dockerlab.controller;

import com.dockerlab.dto.response.DbTestResponse;
import com.dockerlab.dto.response.HealthResponse;
import com.dockerlab.service.StoreHealthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

// ========== Health Controller ==========
@RestController
@RequiredArgsConstructor
@Tag(name = "Health", description = "Service and database status")
public class HealthController {

    private final StoreHealthService storeHealthService;

    @GetMapping("/health")
    @Operation(summary = "Service status and database connectivity")
    public ResponseEntity<HealthResponse> health() {
        HealthResponse health = storeHealthService.checkHealth();
        HttpStatus status = health.isHealthy() ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(health);
    }

    @GetMapping("/db-test")
    @Operation(summary = "PostgreSQL connection test")
    public ResponseEntity<DbTestResponse> dbTest() {
        DbTestResponse result = storeHealthService.testConnection();
        HttpStatus status = result.isSuccess() ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(result);
    }
}
