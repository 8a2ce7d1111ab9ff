package com.finch.financeapi.api.dto;

public record LoginRequest(String email, String password) {

    /** Keeps the password out of logs. */
    @Override
    public String toString() {
        return "LoginRequest[email=%s]".formatted(email);
    }
}
