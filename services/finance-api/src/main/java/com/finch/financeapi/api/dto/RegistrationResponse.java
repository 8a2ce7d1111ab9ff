package com.finch.financeapi.api.dto;

/**
 * @param passwordStrength label such as {@code "Strong"}, derived from the submitted password
 */
public record RegistrationResponse(UserProfileResponse user, String passwordStrength) {}
