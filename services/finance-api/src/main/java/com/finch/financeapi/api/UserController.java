package com.finch.financeapi.api;

import com.finch.financeapi.api.dto.UserProfileResponse;
import com.finch.financeapi.application.AccountService;
import com.finch.financeapi.infrastructure.web.RequireSelf;
import com.finch.security.AuthenticatedPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/users")
public class UserController {

    private final AccountService accountService;

    public UserController(AccountService accountService) {
        this.accountService = accountService;
    }

    @GetMapping("/me")
    public UserProfileResponse me(AuthenticatedPrincipal principal) {
        return UserProfileResponse.from(accountService.profile(principal.subjectId()));
    }

    /**
     * Profile of the user in the path. The ownership guard has already matched the path id
     * against the caller, so the caller's own id is used for the lookup.
     */
    @GetMapping("/{userId}")
    @RequireSelf
    public UserProfileResponse profile(AuthenticatedPrincipal principal) {
        return UserProfileResponse.from(accountService.profile(principal.subjectId()));
    }
}
