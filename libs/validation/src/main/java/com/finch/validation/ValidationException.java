package com.finch.validation;

import java.util.List;

/**
 * Thrown when input fails field validation. Carries the full set of failures so callers can
 * report every problem at once.
 */
public class ValidationException extends RuntimeException {

    private final List<FieldError> errors;

    public ValidationException(ValidationErrors errors) {
        super(errors.render());
        this.errors = errors.errors();
    }

    public List<FieldError> errors() {
        return errors;
    }
}
