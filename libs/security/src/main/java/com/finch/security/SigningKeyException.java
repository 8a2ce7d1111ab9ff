package com.finch.security;

/**
 * The token signing key is missing or unusable. Raised while wiring the application, never per
 * request.
 */
public class SigningKeyException extends RuntimeException {

    public SigningKeyException(String message) {
        super(message);
    }

    public SigningKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
