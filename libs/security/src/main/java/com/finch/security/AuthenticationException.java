package com.finch.security;

/**
 * The caller could not be authenticated.
 *
 * <p>Covers a missing or malformed header, a bad signature, an unexpected algorithm and an
 * expired or not-yet-valid token alike. The cause is kept for debugging but never exposed to the
 * client.
 */
public class AuthenticationException extends RuntimeException {

    public static final String DEFAULT_MESSAGE = "Invalid or expired authorization token";

    public AuthenticationException() {
        super(DEFAULT_MESSAGE);
    }

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(Throwable cause) {
        super(DEFAULT_MESSAGE, cause);
    }
}
