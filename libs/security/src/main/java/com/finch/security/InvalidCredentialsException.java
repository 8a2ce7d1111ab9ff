package com.finch.security;

/**
 * A password did not match its stored hash, or the stored hash was unreadable. The two cases
 * share one message.
 */
public class InvalidCredentialsException extends RuntimeException {

    public static final String MESSAGE = "Invalid credentials";

    public InvalidCredentialsException() {
        super(MESSAGE);
    }
}
