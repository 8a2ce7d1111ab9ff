package com.finch.financeapi.domain;

import java.util.UUID;

public class AccountNotFoundException extends RuntimeException {

    public AccountNotFoundException(UUID id) {
        super("User " + id + " not found");
    }
}
