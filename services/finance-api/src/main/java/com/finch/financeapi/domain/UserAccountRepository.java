package com.finch.financeapi.domain;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Storage port for {@link UserAccount}. Emails are compared in their normalized (lower-case) form. */
public interface UserAccountRepository {

    Optional<UserAccount> findById(UUID id);

    Optional<UserAccount> findByEmail(String email);

    /**
     * Inserts or replaces the account.
     *
     * @throws DuplicateAccountException if another account already uses the email
     */
    UserAccount save(UserAccount account);

    /** All accounts, oldest first. */
    List<UserAccount> findAll();
}
