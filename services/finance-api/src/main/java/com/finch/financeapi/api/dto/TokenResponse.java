package com.finch.financeapi.api.dto;

import com.finch.financeapi.application.IssuedTokens;

/**
 * @param expiresIn access token lifetime in seconds
 */
public record TokenResponse(String token, String refreshToken, String tokenType, long expiresIn) {

    public static TokenResponse from(IssuedTokens tokens) {
        return new TokenResponse(
                tokens.accessToken(), tokens.refreshToken(), "Bearer", tokens.accessTokenTtl().toSeconds());
    }
}
