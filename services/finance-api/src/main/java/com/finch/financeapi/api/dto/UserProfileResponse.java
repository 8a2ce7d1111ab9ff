package com.finch.financeapi.api.dto;

import com.finch.financeapi.domain.UserAccount;
import java.time.Instant;
import java.util.UUID;

/** Public view of a {@link UserAccount}; never includes the password hash. */
public record UserProfileResponse(
        UUID id,
        String email,
        String firstName,
        String lastName,
        boolean isActive,
        Instant createdAt,
        Instant lastLogin) {

    public static UserProfileResponse from(UserAccount account) {
        return new UserProfileResponse(
                account.id(),
                account.email(),
                account.firstName(),
                account.lastName(),
                account.active(),
                account.createdAt(),
                account.lastLogin());
    }
}
