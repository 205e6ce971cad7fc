package com.dockerlab.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings under {@code app.*}, fed from the container environment.
 */
@ConfigurationProperties(prefix = "app")
public record AppProperties(
        @DefaultValue("development") String environment,
        @DefaultValue("backend-api") String serviceName,
        @DefaultValue("3.0.0") String version,
        @DefaultValue Store store) {

    public boolean isProduction() {
        return "production".equalsIgnoreCase(environment);
    }

    public record Store(
            @DefaultValue("database") String host,
            @DefaultValue("5432") int port,
            @DefaultValue("proyecto_db") String name,
            @DefaultValue ConnectRetry connectRetry) {
    }

    /**
     * Bounded, fixed-delay retry applied only to the first connection at startup.
     */
    public record ConnectRetry(
            @DefaultValue("5") int maxAttempts,
            @DefaultValue("3000") long delayMs) {
    }
}
