package com.finch.financeapi.api.dto;

public record RegisterRequest(String email, String password, String firstName, String lastName) {

    /** Keeps the password out of logs. */
    @Override
    public String toString() {
        return "RegisterRequest[email=%s, firstName=%s, lastName=%s]".formatted(email, firstName, lastName);
    }
}
