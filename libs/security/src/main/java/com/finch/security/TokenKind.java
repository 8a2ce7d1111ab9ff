package com.finch.security;

import java.time.Duration;

/**
 * Purpose a token is minted for, with its fixed lifetime.
 *
 * <p>The kind is not written into the token, so the verifier accepts a refresh token wherever an
 * access token is expected. Distinguishing them means emitting a claim from {@link #name()} in
 * {@link TokenService} and comparing it during validation.
 */
public enum TokenKind {

    ACCESS(Duration.ofHours(24)),
    REFRESH(Duration.ofDays(7));

    private final Duration timeToLive;

    TokenKind(Duration timeToLive) {
        this.timeToLive = timeToLive;
    }

    public Duration timeToLive() {
        return timeToLive;
    }
}
