package com.finch.validation;

/**
 * A single field-level validation failure.
 *
 * @param field   name of the offending field as the client sent it (e.g. {@code "email"})
 * @param message human-readable description of the problem
 */
public record FieldError(String field, String message) {

    /** Renders as {@code "field: message"}. */
    @Override
    public String toString() {
        return field + ": " + message;
    }
}
