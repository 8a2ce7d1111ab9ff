package com.finch.security;

/**
 * Coarse strength bands for a {@link PasswordPolicy#score(String) password score}.
 *
 * <p>A UX signal only; acceptance is decided by {@link PasswordPolicy#validate(String)}.
 */
public enum PasswordStrength {

    VERY_WEAK("Very Weak", 0),
    WEAK("Weak", 20),
    MEDIUM("Medium", 40),
    STRONG("Strong", 60),
    VERY_STRONG("Very Strong", 80);

    private final String label;
    private final int minimumScore;

    PasswordStrength(String label, int minimumScore) {
        this.label = label;
        this.minimumScore = minimumScore;
    }

    /** Human-readable label, e.g. "Very Strong". */
    public String label() {
        return label;
    }

    /** Highest band whose minimum the score reaches. */
    public static PasswordStrength fromScore(int score) {
        PasswordStrength[] bands = values();
        for (int i = bands.length - 1; i > 0; i--) {
            if (score >= bands[i].minimumScore) {
                return bands[i];
            }
        }
        return VERY_WEAK;
    }
}
