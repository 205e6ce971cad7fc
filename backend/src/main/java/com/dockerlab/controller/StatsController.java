package com.dockerlab.controller;

import com.dockerlab.dto.response.StatsResponse;
import com.dockerlab.service.StatsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

// ========== Stats Controller ==========
@RestController
@RequiredArgsConstructor
@Tag(name = "Stats", description = "Record counts and server metadata")
public class StatsController {

    private final StatsService statsService;

    @GetMapping("/stats")
    @Operation(summary = "User and product counts, database version and API uptime")
    public ResponseEntity<StatsResponse> getStats() {
        return ResponseEntity.ok(statsService.collectStats());
    }
}
