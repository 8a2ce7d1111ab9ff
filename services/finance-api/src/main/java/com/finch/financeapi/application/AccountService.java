package com.finch.financeapi.application;

import com.finch.financeapi.api.dto.LoginRequest;
import com.finch.financeapi.api.dto.RegisterRequest;
import com.finch.financeapi.domain.AccountNotFoundException;
import com.finch.financeapi.domain.UserAccount;
import com.finch.financeapi.domain.UserAccountRepository;
import com.finch.security.AuthenticationException;
import com.finch.security.InvalidCredentialsException;
import com.finch.security.PasswordHasher;
import com.finch.security.PasswordPolicy;
import com.finch.security.TokenKind;
import com.finch.security.TokenService;
import com.finch.validation.FieldValidators;
import com.finch.validation.ValidationErrors;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Registration, login, token refresh and profile lookup.
 *
 * <p>Login failures are indistinguishable to the caller: unknown email, inactive account and wrong
 * password all raise {@link InvalidCredentialsException}, and all of them pay for one bcrypt
 * comparison.
 */
@Service
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private final UserAccountRepository repository;
    private final PasswordHasher passwordHasher;
    private final TokenService tokenService;
    private final Clock clock;
    private final String timingHash;

    public AccountService(
            UserAccountRepository repository,
            PasswordHasher passwordHasher,
            TokenService tokenService,
            Clock clock) {
        this.repository = repository;
        this.passwordHasher = passwordHasher;
        this.tokenService = tokenService;
        this.clock = clock;
        this.timingHash = passwordHasher.hash(UUID.randomUUID() + "-Aa1!");
    }

    /**
     * Validates every field, reporting all problems at once, then stores the account.
     *
     * @throws com.finch.validation.ValidationException if any field or the password policy fails
     * @throws com.finch.financeapi.domain.DuplicateAccountException if the email is taken
     */
    public UserAccount register(RegisterRequest request) {
        var errors = new ValidationErrors();
        FieldValidators.email(errors, "email", request.email());
        FieldValidators.name(errors, "first_name", request.firstName());
        FieldValidators.name(errors, "last_name", request.lastName());
        errors.addAll(PasswordPolicy.validate(request.password()));
        errors.throwIfInvalid();

        UserAccount account = UserAccount.register(
                UUID.randomUUID(),
                normalizeEmail(request.email()),
                passwordHasher.hash(request.password()),
                request.firstName().strip(),
                request.lastName().strip(),
                clock.instant());
        repository.save(account);
        log.info("Registered account {}", account.id());
        return account;
    }

    public LoginResult login(LoginRequest request) {
        var errors = new ValidationErrors();
        FieldValidators.required(errors, "email", request.email());
        FieldValidators.required(errors, "password", request.password());
        errors.throwIfInvalid();

        UserAccount account = repository.findByEmail(normalizeEmail(request.email()))
                .filter(UserAccount::active)
                .orElse(null);
        if (account == null) {
            passwordHasher.matches(timingHash, request.password());
            log.info("Login refused: no active account for the given email");
            throw new InvalidCredentialsException();
        }
        passwordHasher.verify(account.passwordHash(), request.password());

        UserAccount loggedIn = repository.save(account.withLastLogin(clock.instant()));
        log.info("Account {} logged in", loggedIn.id());
        return new LoginResult(loggedIn, issueTokens(loggedIn));
    }

    /**
     * Exchanges a valid refresh token for a new token pair.
     *
     * @throws AuthenticationException if the token is invalid or its account is gone or inactive
     */
    public IssuedTokens refresh(String refreshToken) {
        UUID subjectId = tokenService.extractSubjectId(refreshToken);
        UserAccount account = repository.findById(subjectId)
                .filter(UserAccount::active)
                .orElseThrow(AuthenticationException::new);
        log.debug("Refreshed tokens for account {}", account.id());
        return issueTokens(account);
    }

    public UserAccount profile(UUID id) {
        return repository.findById(id).orElseThrow(() -> new AccountNotFoundException(id));
    }

    public List<UserAccount> listAccounts() {
        return repository.findAll();
    }

    private IssuedTokens issueTokens(UserAccount account) {
        return new IssuedTokens(
                tokenService.issueAccessToken(account.id(), account.email()),
                tokenService.issueRefreshToken(account.id()),
                TokenKind.ACCESS.timeToLive());
    }

    private static String normalizeEmail(String email) {
        return email.strip().toLowerCase(Locale.ROOT);
    }
}
