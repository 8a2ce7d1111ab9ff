package com.finch.security;

import java.util.Optional;

/**
 * Extracts bearer tokens from HTTP Authorization headers.
 */
public final class BearerTokenExtractor {

    /** Literal scheme prefix, including the separating space. Matched case-sensitively. */
    public static final String PREFIX = "Bearer ";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Extracts the bearer token from an Authorization header value.
     * <p>
     * Expects format: {@code "Bearer <token>"}
     *
     * @param authorizationHeader the full Authorization header value (may be null)
     * @return the token string, or empty if the header is missing, uses another scheme, or has
     *     nothing after the prefix
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isEmpty()) {
            return Optional.empty();
        }
        if (!authorizationHeader.startsWith(PREFIX)) {
            return Optional.empty();
        }
        String token = authorizationHeader.substring(PREFIX.length());
        if (token.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(token);
    }
}
