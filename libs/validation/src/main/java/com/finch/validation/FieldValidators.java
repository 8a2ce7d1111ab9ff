package com.finch.validation;

import java.util.regex.Pattern;

/**
 * Format checks for common domain fields.
 *
 * <p>Each check appends at most one failure to the supplied {@link ValidationErrors} and returns
 * whether the value passed, so callers can chain dependent checks without short-circuiting the
 * whole validation pass.
 */
public final class FieldValidators {

    /** RFC 5321 path limit. */
    public static final int MAX_EMAIL_LENGTH = 254;

    private static final Pattern EMAIL =
            Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");
    private static final Pattern NAME = Pattern.compile("^[a-zA-Z\\s\\-']+$");

    private FieldValidators() {
        // utility class
    }

    /** Fails when the value is null or only whitespace. */
    public static boolean required(ValidationErrors errors, String field, String value) {
        if (value == null || value.isBlank()) {
            errors.add(field, field + " is required");
            return false;
        }
        return true;
    }

    /**
     * Checks the trimmed length of {@code value}. A bound of zero or less disables that side of
     * the check.
     */
    public static boolean length(ValidationErrors errors, String field, String value, int min, int max) {
        int length = value == null ? 0 : value.strip().length();
        if (min > 0 && length < min) {
            errors.add(field, "%s must be at least %d characters long".formatted(field, min));
            return false;
        }
        if (max > 0 && length > max) {
            errors.add(field, "%s must be no more than %d characters long".formatted(field, max));
            return false;
        }
        return true;
    }

    /** Requires a syntactically plausible address of at most {@value #MAX_EMAIL_LENGTH} chars. */
    public static boolean email(ValidationErrors errors, String field, String value) {
        if (!required(errors, field, value)) {
            return false;
        }
        if (!EMAIL.matcher(value).matches()) {
            errors.add(field, "invalid email format");
            return false;
        }
        if (value.length() > MAX_EMAIL_LENGTH) {
            errors.add(field, "email too long (max %d characters)".formatted(MAX_EMAIL_LENGTH));
            return false;
        }
        return true;
    }

    /** Person names: 2 to 100 characters of letters, spaces, hyphens and apostrophes. */
    public static boolean name(ValidationErrors errors, String field, String value) {
        if (!required(errors, field, value) || !length(errors, field, value, 2, 100)) {
            return false;
        }
        if (!NAME.matcher(value).matches()) {
            errors.add(field,
                    field + " can only contain letters, spaces, hyphens, and apostrophes");
            return false;
        }
        return true;
    }
}
