package com.finch.financeapi.application;

import java.time.Duration;

/** Access and refresh token minted together for one subject. */
public record IssuedTokens(String accessToken, String refreshToken, Duration accessTokenTtl) {}
