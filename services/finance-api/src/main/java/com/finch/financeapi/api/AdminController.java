package com.finch.financeapi.api;

import com.finch.financeapi.api.dto.UserProfileResponse;
import com.finch.financeapi.application.AccountService;
import com.finch.financeapi.infrastructure.web.RequireRole;
import com.finch.security.Role;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Administrative endpoints, restricted to {@link Role#ADMIN}. */
@RestController
@RequestMapping("/api/v1/admin")
@RequireRole(Role.ADMIN)
public class AdminController {

    private final AccountService accountService;

    public AdminController(AccountService accountService) {
        this.accountService = accountService;
    }

    @GetMapping("/users")
    public List<UserProfileResponse> users() {
        return accountService.listAccounts().stream().map(UserProfileResponse::from).toList();
    }
}
