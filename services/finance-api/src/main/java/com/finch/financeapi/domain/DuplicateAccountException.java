package com.finch.financeapi.domain;

/** An account with the same email already exists. */
public class DuplicateAccountException extends RuntimeException {

    public DuplicateAccountException(String email) {
        super("An account with email " + email + " already exists");
    }
}
