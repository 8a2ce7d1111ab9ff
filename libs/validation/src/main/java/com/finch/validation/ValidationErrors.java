package com.finch.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered collection of {@link FieldError}s gathered during one validation pass.
 *
 * <p>An empty instance means "valid". Instances are created fresh per validation call and are
 * not thread-safe; they are meant to live on the stack of the validating thread.
 *
 * <pre>
 * var errors = new ValidationErrors();
 * errors.add("email", "required");
 * errors.add("password", "too short");
 * errors.render(); // "email: required; password: too short"
 * </pre>
 */
public final class ValidationErrors {

    private static final String SEPARATOR = "; ";

    private final List<FieldError> errors = new ArrayList<>();

    /** Appends a failure for the given field. */
    public ValidationErrors add(String field, String message) {
        errors.add(new FieldError(field, message));
        return this;
    }

    /** Appends every failure from {@code other}, keeping its order. */
    public ValidationErrors addAll(ValidationErrors other) {
        errors.addAll(other.errors);
        return this;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public int size() {
        return errors.size();
    }

    /** Immutable snapshot of the failures in insertion order. */
    public List<FieldError> errors() {
        return List.copyOf(errors);
    }

    /**
     * Joins every failure as {@code "field: message"} separated by {@code "; "}.
     *
     * @return the rendered failures, or the empty string when there are none
     */
    public String render() {
        return errors.stream().map(FieldError::toString).collect(Collectors.joining(SEPARATOR));
    }

    /**
     * Throws a {@link ValidationException} carrying these failures if there are any.
     */
    public void throwIfInvalid() {
        if (hasErrors()) {
            throw new ValidationException(this);
        }
    }

    @Override
    public String toString() {
        return render();
    }
}
