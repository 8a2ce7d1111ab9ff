package com.finch.security;

/**
 * The caller is authenticated but not allowed to perform the request.
 */
public class AccessDeniedException extends RuntimeException {

    public AccessDeniedException(String message) {
        super(message);
    }
}
