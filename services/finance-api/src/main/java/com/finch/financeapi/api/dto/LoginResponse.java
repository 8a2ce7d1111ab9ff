package com.finch.financeapi.api.dto;

import com.finch.financeapi.application.LoginResult;

public record LoginResponse(
        UserProfileResponse user, String token, String refreshToken, String tokenType, long expiresIn) {

    public static LoginResponse from(LoginResult result) {
        TokenResponse tokens = TokenResponse.from(result.tokens());
        return new LoginResponse(
                UserProfileResponse.from(result.account()),
                tokens.token(),
                tokens.refreshToken(),
                tokens.tokenType(),
                tokens.expiresIn());
    }
}
