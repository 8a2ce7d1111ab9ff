package com.finch.security;

import java.time.Instant;
import java.util.UUID;

/**
 * Payload of a verified token.
 *
 * <p>Reconstructed from the token on every validation and never mutated.
 *
 * @param subjectId the {@code sub} claim
 * @param email     the {@code email} claim, {@code null} on refresh tokens
 * @param issuer    the {@code iss} claim
 * @param issuedAt  the {@code iat} claim
 * @param notBefore the {@code nbf} claim
 * @param expiresAt the {@code exp} claim
 */
public record IdentityClaims(
        UUID subjectId,
        String email,
        String issuer,
        Instant issuedAt,
        Instant notBefore,
        Instant expiresAt) {

    public boolean hasEmail() {
        return email != null && !email.isEmpty();
    }
}
