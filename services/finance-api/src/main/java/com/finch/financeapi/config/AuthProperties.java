package com.finch.financeapi.config;

import com.finch.security.PasswordHasher;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Authentication settings bound from {@code finch.auth.*}.
 *
 * <pre>
 * finch:
 *   auth:
 *     jwt-secret: ${FINCH_JWT_SECRET}
 *     password-hash-cost: 10
 *     enforce-ownership: false
 * </pre>
 *
 * <p>There is no default secret: an unset {@code jwt-secret} fails startup.
 *
 * @param jwtSecret        HMAC signing secret, at least 32 bytes. Required.
 * @param passwordHashCost bcrypt work factor (default 10)
 * @param enforceOwnership when true, {@code @RequireSelf} routes whose path names no user are
 *                         denied instead of passed through
 */
@ConfigurationProperties(prefix = "finch.auth")
@Validated
public record AuthProperties(@NotBlank String jwtSecret, int passwordHashCost, boolean enforceOwnership) {

    /**
     * Compact constructor, applies defaults for optional fields before Bean Validation runs.
     */
    public AuthProperties {
        if (passwordHashCost <= 0) {
            passwordHashCost = PasswordHasher.DEFAULT_COST;
        }
    }

    /** Keeps the secret out of logs and failure analysis output. */
    @Override
    public String toString() {
        return "AuthProperties[jwtSecret=****, passwordHashCost=%d, enforceOwnership=%s]"
                .formatted(passwordHashCost, enforceOwnership);
    }
}
