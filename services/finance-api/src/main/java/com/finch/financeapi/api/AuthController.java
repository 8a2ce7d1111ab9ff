package com.finch.financeapi.api;

import com.finch.financeapi.api.dto.LoginRequest;
import com.finch.financeapi.api.dto.LoginResponse;
import com.finch.financeapi.api.dto.RefreshRequest;
import com.finch.financeapi.api.dto.RegisterRequest;
import com.finch.financeapi.api.dto.RegistrationResponse;
import com.finch.financeapi.api.dto.TokenResponse;
import com.finch.financeapi.api.dto.UserProfileResponse;
import com.finch.financeapi.application.AccountService;
import com.finch.financeapi.domain.UserAccount;
import com.finch.security.PasswordPolicy;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** Public authentication endpoints. All three are on the authentication allow-list. */
@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {

    private final AccountService accountService;

    public AuthController(AccountService accountService) {
        this.accountService = accountService;
    }

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public RegistrationResponse register(@RequestBody RegisterRequest request) {
        UserAccount account = accountService.register(request);
        return new RegistrationResponse(
                UserProfileResponse.from(account), PasswordPolicy.label(request.password()));
    }

    @PostMapping("/login")
    public LoginResponse login(@RequestBody LoginRequest request) {
        return LoginResponse.from(accountService.login(request));
    }

    @PostMapping("/refresh")
    public TokenResponse refresh(@RequestBody RefreshRequest request) {
        return TokenResponse.from(accountService.refresh(request.refreshToken()));
    }
}
