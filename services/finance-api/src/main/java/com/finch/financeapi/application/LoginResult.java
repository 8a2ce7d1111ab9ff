package com.finch.financeapi.application;

import com.finch.financeapi.domain.UserAccount;

public record LoginResult(UserAccount account, IssuedTokens tokens) {}
