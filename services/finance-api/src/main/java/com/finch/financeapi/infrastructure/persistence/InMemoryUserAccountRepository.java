package com.finch.financeapi.infrastructure.persistence;

import com.finch.financeapi.domain.DuplicateAccountException;
import com.finch.financeapi.domain.UserAccount;
import com.finch.financeapi.domain.UserAccountRepository;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Repository;

/**
 * Process-local {@link UserAccountRepository}. Data is lost on restart.
 *
 * <p>Writes are serialized so the email uniqueness check and the insert happen atomically.
 */
@Repository
public class InMemoryUserAccountRepository implements UserAccountRepository {

    private final Map<UUID, UserAccount> accountsById = new HashMap<>();
    private final Map<String, UUID> idsByEmail = new HashMap<>();

    @Override
    public synchronized Optional<UserAccount> findById(UUID id) {
        return Optional.ofNullable(accountsById.get(id));
    }

    @Override
    public synchronized Optional<UserAccount> findByEmail(String email) {
        return Optional.ofNullable(idsByEmail.get(email)).map(accountsById::get);
    }

    @Override
    public synchronized UserAccount save(UserAccount account) {
        UUID owner = idsByEmail.get(account.email());
        if (owner != null && !owner.equals(account.id())) {
            throw new DuplicateAccountException(account.email());
        }
        UserAccount previous = accountsById.put(account.id(), account);
        if (previous != null && !previous.email().equals(account.email())) {
            idsByEmail.remove(previous.email());
        }
        idsByEmail.put(account.email(), account.id());
        return account;
    }

    @Override
    public synchronized List<UserAccount> findAll() {
        return accountsById.values().stream()
                .sorted(Comparator.comparing(UserAccount::createdAt).thenComparing(UserAccount::email))
                .toList();
    }
}
