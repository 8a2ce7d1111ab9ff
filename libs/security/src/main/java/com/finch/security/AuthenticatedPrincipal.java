package com.finch.security;

import java.util.Objects;
import java.util.UUID;

/**
 * Verified identity of the caller for the duration of one request.
 *
 * <p>Built by {@link Authenticator} once the bearer token has been validated and read-only from
 * then on. Never shared between requests.
 *
 * @param subjectId unique user identifier (from the token's {@code sub} claim)
 * @param email     user's email address, {@code null} when the token carried none
 * @param role      role assigned by the configured {@link RoleResolver}
 */
public record AuthenticatedPrincipal(UUID subjectId, String email, Role role) {

    public AuthenticatedPrincipal {
        Objects.requireNonNull(subjectId, "subjectId must not be null");
        Objects.requireNonNull(role, "role must not be null");
    }
}
