package com.dockerlab.service;

import com.dockerlab.config.AppProperties;
import com.dockerlab.config.RouteCatalog;
import com.dockerlab.config.ServerRuntime;
import com.dockerlab.dto.response.EchoResponse;
import com.dockerlab.dto.response.InfoResponse;
import com.dockerlab.dto.response.SampleDataResponse;
import com.dockerlab.dto.response.SystemInfoResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Static descriptions of the service. Nothing here touches the store.
 */
@Service
@RequiredArgsConstructor
public class SystemInfoService {

    private static final List<SampleDataResponse.Item> SAMPLE_ITEMS = List.of(
        new SampleDataResponse.Item(1, "Item A", 100),
        new SampleDataResponse.Item(2, "Item B", 200),
        new SampleDataResponse.Item(3, "Item C", 300)
    );

    private final AppProperties appProperties;
    private final RouteCatalog routeCatalog;
    private final ServerRuntime serverRuntime;
    private final StoreConnector storeConnector;

    public SystemInfoResponse systemInfo() {
        return SystemInfoResponse.builder()
            .success(true)
            .service("Backend API - DockerLab")
            .version(appProperties.version())
            .description("REST API with Spring Boot and PostgreSQL for the Docker project")
            .endpoints(routeCatalog.routes())
            .database(new SystemInfoResponse.DatabaseInfo(
                "PostgreSQL", storeConnector.isConnected(), appProperties.store().host()))
            .server(SystemInfoResponse.ServerInfo.builder()
                .startTime(serverRuntime.getStartTime())
                .uptime(serverRuntime.formattedUptime())
                .javaVersion(serverRuntime.javaVersion())
                .environment(appProperties.environment())
                .memoryUsage(new SystemInfoResponse.MemoryUsage(
                    serverRuntime.heapUsedMb(),
                    serverRuntime.heapCommittedMb(),
                    serverRuntime.heapMaxMb()))
                .build())
            .project(new SystemInfoResponse.ProjectInfo(
                "DockerLab - Group Project 2",
                3,
                List.of("Backend API", "PostgreSQL", "Frontend Nginx")))
            .build();
    }

    public InfoResponse info() {
        return InfoResponse.builder()
            .service("Backend API")
            .version(appProperties.version())
            .endpoints(routeCatalog.paths())
            .database("PostgreSQL")
            .documentation("See README.md or the /system-info endpoint")
            .build();
    }

    public SampleDataResponse sampleData() {
        return SampleDataResponse.builder()
            .message("Data from the backend")
            .items(SAMPLE_ITEMS)
            .total(SAMPLE_ITEMS.size())
            .generatedAt(serverRuntime.now())
            .build();
    }

    public EchoResponse echo(JsonNode payload) {
        return EchoResponse.builder()
            .received(payload == null ? JsonNodeFactory.instance.objectNode() : payload)
            .echoedAt(serverRuntime.now())
            .message("Data received successfully")
            .build();
    }
}
