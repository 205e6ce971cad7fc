package com.dockerlab.config;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * The routes this service answers, as advertised by the info endpoints and the 404 fallback.
 */
@Component
public class RouteCatalog {

    public record Route(String method, String path, String description) {}

    private static final List<Route> ROUTES = List.of(
        new Route("GET", "/health", "System status and database connectivity"),
        new Route("GET", "/db-test", "PostgreSQL connection test"),
        new Route("GET", "/users", "List all users"),
        new Route("GET", "/users/:id", "Get a user by ID"),
        new Route("POST", "/users", "Create a user"),
        new Route("PUT", "/users/:id", "Update a user"),
        new Route("DELETE", "/users/:id", "Delete a user"),
        new Route("GET", "/products", "List all products"),
        new Route("GET", "/stats", "System statistics"),
        new Route("GET", "/system-info", "Full API information"),
        new Route("GET", "/info", "Basic information"),
        new Route("GET", "/data", "Sample data"),
        new Route("POST", "/echo", "Echo endpoint")
    );

    public List<Route> routes() {
        return ROUTES;
    }

    /**
     * Distinct paths in declaration order.
     */
    public List<String> paths() {
        return ROUTES.stream()
            .map(Route::path)
            .distinct()
            .toList();
    }
}
