package com.dockerlab.service;

import com.dockerlab.config.AppProperties;
import com.dockerlab.config.RouteCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class StoreStartupRunner implements ApplicationRunner {

    private final StoreConnector storeConnector;
    private final RouteCatalog routeCatalog;
    private final AppProperties appProperties;

    @Override
    public void run(ApplicationArguments args) {
        boolean connected = storeConnector.connect();

        log.info("{} v{} started (environment: {}, store: {})",
            appProperties.serviceName(), appProperties.version(), appProperties.environment(),
            connected ? "connected" : "unavailable");
        routeCatalog.routes().forEach(route ->
            log.info("  {} {} - {}", String.format("%-6s", route.method()), route.path(), route.description()));
    }
}
