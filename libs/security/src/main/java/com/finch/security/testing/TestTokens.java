package com.finch.security.testing;

import com.finch.security.AuthenticatedPrincipal;
import com.finch.security.Role;
import com.finch.security.TokenService;

import java.time.Clock;
import java.util.UUID;

/**
 * Fixtures for tests that need real tokens or principals.
 * <p>
 * Lives in src/main so other modules can use it from their test scope through a regular
 * dependency. Package {@code com.finch.security.testing} marks it as test-only.
 */
public final class TestTokens {

    /** Signing secret shared by test configurations; long enough for HS256. */
    public static final String SECRET = "finch-test-signing-secret-0123456789abcdef";

    public static final String EMAIL = "test-user@finch.local";

    private TestTokens() {
        // utility class
    }

    /** Token service keyed with {@link #SECRET} on the system clock. */
    public static TokenService tokenService() {
        return new TokenService(SECRET);
    }

    /** Token service keyed with {@link #SECRET} on the given clock. */
    public static TokenService tokenService(Clock clock) {
        return new TokenService(SECRET, clock);
    }

    /** A fresh access token for the subject, signed with {@link #SECRET}. */
    public static String accessToken(UUID subjectId) {
        return tokenService().issueAccessToken(subjectId, EMAIL);
    }

    /** Principal with a random subject and {@link Role#USER}. */
    public static AuthenticatedPrincipal principal() {
        return principal(Role.USER);
    }

    public static AuthenticatedPrincipal principal(Role role) {
        return new AuthenticatedPrincipal(UUID.randomUUID(), EMAIL, role);
    }
}
