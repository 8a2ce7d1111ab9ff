package com.finch.financeapi.api.dto;

public record RefreshRequest(String refreshToken) {}
