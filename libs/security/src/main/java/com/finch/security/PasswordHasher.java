package com.finch.security;

import com.finch.validation.ValidationErrors;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.nio.charset.StandardCharsets;

/**
 * Salted bcrypt hashing gated by {@link PasswordPolicy}.
 *
 * <p>The encoded hash embeds its own cost and salt, so verification needs nothing but the hash.
 * Hashing is CPU-bound and intentionally slow; at the default cost of
 * {@value #DEFAULT_COST} a hash takes tens of milliseconds on commodity hardware.
 *
 * <p>Immutable and thread-safe.
 */
public final class PasswordHasher {

    public static final int DEFAULT_COST = 10;
    public static final int MIN_COST = 4;
    public static final int MAX_COST = 31;

    /** bcrypt ignores every byte past this one, so longer passwords are refused outright. */
    public static final int MAX_PASSWORD_BYTES = 72;

    private final int cost;
    private final BCryptPasswordEncoder encoder;

    public PasswordHasher() {
        this(DEFAULT_COST);
    }

    /**
     * @param cost bcrypt log2 work factor, {@value #MIN_COST}..{@value #MAX_COST}
     */
    public PasswordHasher(int cost) {
        if (cost < MIN_COST || cost > MAX_COST) {
            throw new IllegalArgumentException(
                    "bcrypt cost must be between %d and %d, got %d".formatted(MIN_COST, MAX_COST, cost));
        }
        this.cost = cost;
        this.encoder = new BCryptPasswordEncoder(cost);
    }

    public int cost() {
        return cost;
    }

    /**
     * Validates the password and returns its encoded hash.
     *
     * @throws PasswordPolicyException if the password breaks any strength rule or is longer than
     *     {@value #MAX_PASSWORD_BYTES} bytes in UTF-8; nothing is hashed
     */
    public String hash(String password) {
        ValidationErrors errors = PasswordPolicy.validate(password);
        if (errors.hasErrors()) {
            throw new PasswordPolicyException(errors);
        }
        if (!fitsBcrypt(password)) {
            throw new PasswordPolicyException(new ValidationErrors().add(PasswordPolicy.FIELD,
                    "must be at most %d bytes when UTF-8 encoded".formatted(MAX_PASSWORD_BYTES)));
        }
        return encoder.encode(password);
    }

    /**
     * Checks a password against a stored hash using a constant-time comparison.
     *
     * @throws InvalidCredentialsException on mismatch or when the hash is not a readable bcrypt
     *     string
     */
    public void verify(String hash, String password) {
        if (!matches(hash, password)) {
            throw new InvalidCredentialsException();
        }
    }

    /**
     * Non-throwing form of {@link #verify(String, String)}. A password too long to have been hashed
     * never matches, even when its first {@value #MAX_PASSWORD_BYTES} bytes do.
     */
    public boolean matches(String hash, String password) {
        if (hash == null || password == null || !fitsBcrypt(password)) {
            return false;
        }
        try {
            return encoder.matches(password, hash);
        } catch (IllegalArgumentException e) {
            // hash shaped like bcrypt but with an unusable salt or cost
            return false;
        }
    }

    private static boolean fitsBcrypt(String password) {
        return password.getBytes(StandardCharsets.UTF_8).length <= MAX_PASSWORD_BYTES;
    }
}
