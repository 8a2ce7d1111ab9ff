package com.finch.security;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Static allow-list of routes that skip authentication.
 *
 * <p>Paths and methods are matched exactly; there is no globbing. Every {@code OPTIONS} request
 * (CORS pre-flight) bypasses regardless of path.
 */
public final class AuthenticationBypass {

    public static final String PREFLIGHT_METHOD = "OPTIONS";

    private static final Map<String, Set<String>> DEFAULT_ROUTES = defaultRoutes();

    private final Map<String, Set<String>> routes;

    /**
     * @param routes path to the set of HTTP methods allowed without a token
     */
    public AuthenticationBypass(Map<String, Set<String>> routes) {
        this.routes = Map.copyOf(routes);
    }

    /**
     * Health, metrics, login, registration and token refresh.
     */
    public static AuthenticationBypass defaults() {
        return new AuthenticationBypass(DEFAULT_ROUTES);
    }

    public boolean matches(String path, String method) {
        if (PREFLIGHT_METHOD.equals(method)) {
            return true;
        }
        Set<String> methods = routes.get(path);
        return methods != null && methods.contains(method);
    }

    private static Map<String, Set<String>> defaultRoutes() {
        Map<String, Set<String>> routes = new LinkedHashMap<>();
        routes.put("/health", Set.of("GET"));
        routes.put("/metrics", Set.of("GET"));
        routes.put("/api/v1/auth/login", Set.of("POST"));
        routes.put("/api/v1/auth/register", Set.of("POST"));
        routes.put("/api/v1/auth/refresh", Set.of("POST"));
        return Map.copyOf(routes);
    }
}
