package com.finch.security;

import com.finch.validation.ValidationErrors;

/**
 * Password strength rules and scoring.
 *
 * <p>{@link #validate(String)} checks every rule and reports all violations together; nothing
 * short-circuits. Length is counted in Unicode code points.
 */
public final class PasswordPolicy {

    public static final String FIELD = "password";
    public static final int MIN_LENGTH = 8;
    public static final int MAX_LENGTH = 128;
    public static final int MAX_SCORE = 100;

    private PasswordPolicy() {
        // utility class
    }

    /**
     * Checks the password against the strength rules.
     *
     * @param password the candidate password ({@code null} is treated as empty)
     * @return every violation found, empty when the password is acceptable
     */
    public static ValidationErrors validate(String password) {
        String candidate = password == null ? "" : password;
        var errors = new ValidationErrors();
        int length = candidate.codePointCount(0, candidate.length());

        if (length < MIN_LENGTH) {
            errors.add(FIELD, "must be at least %d characters long".formatted(MIN_LENGTH));
        }
        if (length > MAX_LENGTH) {
            errors.add(FIELD, "must be at most %d characters long".formatted(MAX_LENGTH));
        }

        var composition = Composition.of(candidate);
        if (!composition.upper) {
            errors.add(FIELD, "must contain at least one uppercase letter");
        }
        if (!composition.lower) {
            errors.add(FIELD, "must contain at least one lowercase letter");
        }
        if (!composition.digit) {
            errors.add(FIELD, "must contain at least one number");
        }
        if (!composition.symbol) {
            errors.add(FIELD, "must contain at least one special character");
        }
        return errors;
    }

    /** Convenience for {@code !validate(password).hasErrors()}. */
    public static boolean isAcceptable(String password) {
        return !validate(password).hasErrors();
    }

    /**
     * Additive strength heuristic in the range 0..100.
     *
     * <p>Length of at least 8, 12 and 16 adds 20, 10 and 10. Each character class present
     * (upper, lower, digit, symbol) adds 15, and having both cases adds 10 more. The raw sum
     * can reach 110 and is clamped.
     */
    public static int score(String password) {
        if (password == null) {
            return 0;
        }
        int score = 0;
        int length = password.codePointCount(0, password.length());
        if (length >= 8) {
            score += 20;
        }
        if (length >= 12) {
            score += 10;
        }
        if (length >= 16) {
            score += 10;
        }

        var composition = Composition.of(password);
        if (composition.upper) {
            score += 15;
        }
        if (composition.lower) {
            score += 15;
        }
        if (composition.digit) {
            score += 15;
        }
        if (composition.symbol) {
            score += 15;
        }
        if (composition.upper && composition.lower) {
            score += 10;
        }
        return Math.min(score, MAX_SCORE);
    }

    public static PasswordStrength strength(String password) {
        return PasswordStrength.fromScore(score(password));
    }

    /** Label of {@link #strength(String)}, e.g. "Medium". */
    public static String label(String password) {
        return strength(password).label();
    }

    /** Which character classes occur in a password. Each code point counts towards one class. */
    private static final class Composition {

        private boolean upper;
        private boolean lower;
        private boolean digit;
        private boolean symbol;

        static Composition of(String password) {
            var composition = new Composition();
            password.codePoints().forEach(composition::classify);
            return composition;
        }

        private void classify(int codePoint) {
            if (Character.isUpperCase(codePoint)) {
                upper = true;
            } else if (Character.isLowerCase(codePoint)) {
                lower = true;
            } else if (Character.isDigit(codePoint)) {
                digit = true;
            } else if (isPunctuationOrSymbol(codePoint)) {
                symbol = true;
            }
        }

        private static boolean isPunctuationOrSymbol(int codePoint) {
            return switch (Character.getType(codePoint)) {
                case Character.CONNECTOR_PUNCTUATION,
                        Character.DASH_PUNCTUATION,
                        Character.START_PUNCTUATION,
                        Character.END_PUNCTUATION,
                        Character.INITIAL_QUOTE_PUNCTUATION,
                        Character.FINAL_QUOTE_PUNCTUATION,
                        Character.OTHER_PUNCTUATION,
                        Character.MATH_SYMBOL,
                        Character.CURRENCY_SYMBOL,
                        Character.MODIFIER_SYMBOL,
                        Character.OTHER_SYMBOL -> true;
                default -> false;
            };
        }
    }
}
