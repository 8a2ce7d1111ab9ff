package com.finch.security;

import java.util.Optional;

/**
 * Roles an authenticated caller can hold.
 *
 * <p>There is no hierarchy: a guard demanding {@link #ADMIN} is satisfied only by {@link #ADMIN}.
 */
public enum Role {

    USER("user"),
    ADMIN("admin");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g., "user"). */
    public String value() {
        return value;
    }

    /**
     * Looks up a Role by its canonical string value.
     *
     * @param value the string to match
     * @return the matching Role, or empty if not found
     */
    public static Optional<Role> fromString(String value) {
        for (Role role : values()) {
            if (role.value.equals(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
