package com.finch.financeapi.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A registered user. {@code passwordHash} is a bcrypt hash and never leaves the service.
 *
 * @param lastLogin null until the first successful login
 */
public record UserAccount(
        UUID id,
        String email,
        String passwordHash,
        String firstName,
        String lastName,
        boolean active,
        Instant createdAt,
        Instant updatedAt,
        Instant lastLogin) {

    public UserAccount {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(email, "email must not be null");
        Objects.requireNonNull(passwordHash, "passwordHash must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(updatedAt, "updatedAt must not be null");
    }

    /** New active account with creation and update times set to {@code now}. */
    public static UserAccount register(
            UUID id, String email, String passwordHash, String firstName, String lastName, Instant now) {
        return new UserAccount(id, email, passwordHash, firstName, lastName, true, now, now, null);
    }

    public UserAccount withLastLogin(Instant at) {
        return new UserAccount(id, email, passwordHash, firstName, lastName, active, createdAt, at, at);
    }
}
