package com.dockerlab.controller;

import com.dockerlab.dto.response.EchoResponse;
import com.dockerlab.dto.response.InfoResponse;
import com.dockerlab.dto.response.SampleDataResponse;
import com.dockerlab.dto.response.SystemInfoResponse;
import com.dockerlab.service.SystemInfoService;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

// ========== Info Controller ==========
@RestController
@RequiredArgsConstructor
@Tag(name = "Info", description = "Static service information and test endpoints")
public class InfoController {

    private final SystemInfoService systemInfoService;

    @GetMapping("/system-info")
    @Operation(summary = "Full API information")
    public ResponseEntity<SystemInfoResponse> systemInfo() {
        return ResponseEntity.ok(systemInfoService.systemInfo());
    }

    @GetMapping("/info")
    @Operation(summary = "Basic information")
    public ResponseEntity<InfoResponse> info() {
        return ResponseEntity.ok(systemInfoService.info());
    }

    @GetMapping("/data")
    @Operation(summary = "Fixed sample data")
    public ResponseEntity<SampleDataResponse> data() {
        return ResponseEntity.ok(systemInfoService.sampleData());
    }

    @PostMapping(value = "/echo", consumes = {MediaType.APPLICATION_JSON_VALUE, "application/*+json"})
    @Operation(summary = "Echo the request body back")
    public ResponseEntity<EchoResponse> echo(@RequestBody(required = false) JsonNode payload) {
        return ResponseEntity.ok(systemInfoService.echo(payload));
    }

    // non-JSON bodies are ignored and echoed as an empty object
    @PostMapping("/echo")
    @Operation(summary = "Echo for non-JSON bodies")
    public ResponseEntity<EchoResponse> echoNonJson() {
        return ResponseEntity.ok(systemInfoService.echo(null));
    }
}
